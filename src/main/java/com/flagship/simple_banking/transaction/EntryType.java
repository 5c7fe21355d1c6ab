package com.flagship.simple_banking.transaction;

/**
 * Direction of a movement against an account.
 * Debits are stored negative, credits positive.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
