package com.flagship.simple_banking.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A signed monetary movement against an account.
 *
 * The sign of {@code amount} always follows the operation type's
 * classification; see {@link TransactionNormalizer}.
 */
@Value
public class Transaction {
    Long id;
    Long accountId;
    Integer operationTypeId;
    BigDecimal amount;
    Instant eventDate;

    /**
     * A not-yet-persisted transaction with an already normalized amount.
     */
    public static Transaction pending(long accountId, OperationType operationType,
                                      BigDecimal normalizedAmount, Instant eventDate) {
        return new Transaction(null, accountId, operationType.getId(), normalizedAmount, eventDate);
    }
}
