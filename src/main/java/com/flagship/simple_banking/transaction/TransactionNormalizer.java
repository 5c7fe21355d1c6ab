package com.flagship.simple_banking.transaction;

import com.flagship.simple_banking.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Pure business rules for incoming transactions: request validation that
 * needs no storage round-trip, and amount sign normalization.
 */
@Component
public class TransactionNormalizer {

    /** Matches the {@code NUMERIC(19, 4)} amount column. */
    static final int AMOUNT_SCALE = 4;
    static final int AMOUNT_INTEGER_DIGITS = 15;

    /**
     * Checks run in a fixed order and the first failure wins:
     * account id, then operation type, then amount. An amount the ledger
     * cannot store exactly (more than four decimals, or more than fifteen
     * integer digits) is rejected rather than rounded.
     *
     * @return the resolved operation type
     * @throws ValidationException INVALID_ACCOUNT_ID, INVALID_OPERATION_TYPE, ZERO_AMOUNT or INVALID_AMOUNT
     */
    public OperationType validate(Long accountId, Integer operationTypeId, BigDecimal amount) {
        if (accountId == null || accountId <= 0) {
            throw ValidationException.invalidAccountId();
        }

        OperationType operationType = OperationType.fromId(operationTypeId)
            .orElseThrow(ValidationException::invalidOperationType);

        if (amount == null || amount.signum() == 0) {
            throw ValidationException.zeroAmount();
        }

        BigDecimal significant = amount.stripTrailingZeros();
        if (significant.scale() > AMOUNT_SCALE
                || significant.precision() - significant.scale() > AMOUNT_INTEGER_DIGITS) {
            throw ValidationException.invalidAmount(AMOUNT_SCALE, AMOUNT_INTEGER_DIGITS);
        }

        return operationType;
    }

    /**
     * Debits become -|amount|, credits +|amount|. The client's sign is ignored
     * and the magnitude (including scale) is kept as submitted.
     */
    public BigDecimal normalize(BigDecimal amount, OperationType operationType) {
        BigDecimal magnitude = amount.abs();
        return switch (operationType.entryType()) {
            case DEBIT -> magnitude.negate();
            case CREDIT -> magnitude;
        };
    }
}
