package com.flagship.simple_banking.exception;

/**
 * Request clashes with existing state (409).
 */
public class ConflictException extends BankingException {

    public ConflictException(ErrorCode code, String message) {
        super(code, ErrorCategory.CONFLICT, message, null);
    }

    public static ConflictException duplicateDocumentNumber() {
        return new ConflictException(ErrorCode.DUPLICATE_DOCUMENT_NUMBER,
            "account with this document number already exists");
    }
}
