package com.flagship.simple_banking.exception;

/**
 * Fine-grained failure codes, each belonging to one {@link ErrorCategory}.
 */
public enum ErrorCode {
    // Validation
    INVALID_ACCOUNT_ID(ErrorCategory.VALIDATION_ERROR),
    INVALID_TRANSACTION_ID(ErrorCategory.VALIDATION_ERROR),
    INVALID_OPERATION_TYPE(ErrorCategory.VALIDATION_ERROR),
    ZERO_AMOUNT(ErrorCategory.VALIDATION_ERROR),
    INVALID_AMOUNT(ErrorCategory.VALIDATION_ERROR),
    INVALID_DOCUMENT_NUMBER(ErrorCategory.VALIDATION_ERROR),
    INVALID_PAGINATION(ErrorCategory.VALIDATION_ERROR),
    INVALID_REQUEST_BODY(ErrorCategory.VALIDATION_ERROR),
    MISSING_HEADER(ErrorCategory.VALIDATION_ERROR),

    // Not found
    ACCOUNT_NOT_FOUND(ErrorCategory.NOT_FOUND),
    TRANSACTION_NOT_FOUND(ErrorCategory.NOT_FOUND),

    // Conflict
    DUPLICATE_DOCUMENT_NUMBER(ErrorCategory.CONFLICT),
    IDEMPOTENCY_KEY_IN_PROGRESS(ErrorCategory.CONFLICT),

    // Infrastructure
    PERSISTENCE_FAILURE(ErrorCategory.PERSISTENCE_FAILURE);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
