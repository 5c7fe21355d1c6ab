package com.flagship.simple_banking.exception;

/**
 * Referenced resource does not exist (404).
 */
public class NotFoundException extends BankingException {

    public NotFoundException(ErrorCode code, String message) {
        super(code, ErrorCategory.NOT_FOUND, message, null);
    }

    public static NotFoundException account(long accountId) {
        return new NotFoundException(ErrorCode.ACCOUNT_NOT_FOUND, "account with id " + accountId + " not found");
    }

    public static NotFoundException transaction(long transactionId) {
        return new NotFoundException(ErrorCode.TRANSACTION_NOT_FOUND,
            "transaction with id " + transactionId + " not found");
    }
}
