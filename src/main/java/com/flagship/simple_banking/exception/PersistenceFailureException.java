package com.flagship.simple_banking.exception;

/**
 * Storage collaborator failed (500). The message is internal; clients only
 * ever see a generic text.
 */
public class PersistenceFailureException extends BankingException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, ErrorCategory.PERSISTENCE_FAILURE, message, cause);
    }
}
