package com.flagship.simple_banking.transaction;

import lombok.Value;

import java.util.List;

/**
 * One page of an account's transactions plus the account-wide total.
 */
@Value
public class TransactionPage {
    List<Transaction> transactions;
    long total;
    int limit;
    long offset;

    /**
     * ceil(total / limit), never less than one page even for an empty account.
     */
    public long getPages() {
        long pages = (total + limit - 1) / limit;
        return Math.max(1, pages);
    }
}
