package com.flagship.simple_banking.exception;

/**
 * Client-correctable request problem (400).
 */
public class ValidationException extends BankingException {

    public ValidationException(ErrorCode code, String message) {
        super(code, ErrorCategory.VALIDATION_ERROR, message, null);
    }

    public static ValidationException invalidAccountId() {
        return new ValidationException(ErrorCode.INVALID_ACCOUNT_ID, "account_id must be greater than 0");
    }

    public static ValidationException invalidOperationType() {
        return new ValidationException(ErrorCode.INVALID_OPERATION_TYPE, "operation_type_id must be between 1 and 4");
    }

    public static ValidationException zeroAmount() {
        return new ValidationException(ErrorCode.ZERO_AMOUNT, "amount cannot be zero");
    }

    public static ValidationException invalidAmount(int maxDecimals, int maxIntegerDigits) {
        return new ValidationException(ErrorCode.INVALID_AMOUNT,
            "amount must have at most " + maxIntegerDigits + " integer digits and " + maxDecimals + " decimal places");
    }
}
