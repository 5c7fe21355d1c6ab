package com.flagship.simple_banking.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * Domain failures arrive as typed {@link BankingException}s and are mapped by
 * category. Framework failures (missing header, unreadable JSON, bad path or
 * query parameters) are folded into {@link ErrorCategory#VALIDATION_ERROR}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String GENERIC_PERSISTENCE_MESSAGE = "A storage error occurred while processing the request";
    static final String GENERIC_INTERNAL_MESSAGE = "An unexpected error occurred";

    private static final Map<String, ErrorCode> FIELD_CODES = Map.of(
        "documentNumber", ErrorCode.INVALID_DOCUMENT_NUMBER,
        "limit", ErrorCode.INVALID_PAGINATION,
        "offset", ErrorCode.INVALID_PAGINATION,
        "transactionId", ErrorCode.INVALID_TRANSACTION_ID,
        "accountId", ErrorCode.INVALID_ACCOUNT_ID
    );

    @ExceptionHandler(PersistenceFailureException.class)
    public ResponseEntity<ApiError> handlePersistenceFailure(PersistenceFailureException e) {
        log.error("Persistence failure: {}", e.getMessage(), e);
        return respond(e.getCode(), GENERIC_PERSISTENCE_MESSAGE);
    }

    @ExceptionHandler(BankingException.class)
    public ResponseEntity<ApiError> handleBankingException(BankingException e) {
        log.warn("Request rejected: code={}, message={}", e.getCode(), e.getMessage());
        return respond(e.getCode(), e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(ErrorCode.MISSING_HEADER, "Required header '" + e.getHeaderName() + "' is missing");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(ErrorCode.INVALID_REQUEST_BODY, "Invalid request body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorCode code = errors.keySet().stream()
            .map(FIELD_CODES::get)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(ErrorCode.INVALID_REQUEST_BODY);

        ApiError error = ApiError.builder()
            .error(code.getCategory().name())
            .code(code.name())
            .message(errors.size() == 1 ? errors.values().iterator().next() : "Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(code.getCategory().getStatus()).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        ErrorCode code = FIELD_CODES.getOrDefault(e.getName(), ErrorCode.INVALID_REQUEST_BODY);
        return respond(code, "Invalid " + e.getName());
    }

    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ApiError> handleFrameworkError(Exception e) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) e).getStatusCode();
        log.debug("Framework rejected request: status={}, message={}", status.value(), e.getMessage());

        HttpStatus resolved = HttpStatus.resolve(status.value());
        String name = resolved != null ? resolved.name() : String.valueOf(status.value());
        ApiError error = ApiError.builder()
            .error(name)
            .code(name)
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("INTERNAL_ERROR")
            .code("INTERNAL_ERROR")
            .message(GENERIC_INTERNAL_MESSAGE)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.internalServerError().body(error);
    }

    private static ResponseEntity<ApiError> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getCategory().getStatus()).body(ApiError.of(code, message));
    }
}
