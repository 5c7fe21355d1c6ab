package com.flagship.simple_banking.exception;

/**
 * Base type for all domain failures that the API maps to a response.
 *
 * Subclasses pin the {@link ErrorCategory}; the boundary layer never needs to
 * inspect the message to pick a status.
 */
public abstract class BankingException extends RuntimeException {

    private final ErrorCode code;

    protected BankingException(ErrorCode code, ErrorCategory expectedCategory, String message, Throwable cause) {
        super(message, cause);
        if (code.getCategory() != expectedCategory) {
            throw new IllegalArgumentException(
                "Error code " + code + " does not belong to category " + expectedCategory);
        }
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
