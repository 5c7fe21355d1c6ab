package com.flagship.simple_banking.account;

import lombok.Value;

import java.time.Instant;

/**
 * Account domain object. Created once, never updated.
 */
@Value
public class Account {
    Long id;
    String documentNumber;
    Instant createdAt;

    /**
     * A not-yet-persisted account; storage assigns the id and timestamp.
     */
    public static Account create(String documentNumber) {
        return new Account(null, documentNumber, null);
    }
}
