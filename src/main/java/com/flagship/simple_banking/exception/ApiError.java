package com.flagship.simple_banking.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error body.
 *
 * {@code error} is the machine-stable category, {@code code} the specific
 * failure and {@code message} the human-readable text.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String code;
    String message;
    Map<String, String> details;
    Instant timestamp;

    public static ApiError of(ErrorCode code, String message) {
        return ApiError.builder()
            .error(code.getCategory().name())
            .code(code.name())
            .message(message)
            .timestamp(Instant.now())
            .build();
    }
}
