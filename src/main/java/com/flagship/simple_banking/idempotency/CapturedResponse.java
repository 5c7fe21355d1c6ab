package com.flagship.simple_banking.idempotency;

import lombok.Value;

/**
 * Status, content type and full body of one handler execution.
 */
@Value
public class CapturedResponse {
    int status;
    String contentType;
    byte[] body;

    /**
     * Only 2xx outcomes are cached; everything else stays retryable.
     */
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
