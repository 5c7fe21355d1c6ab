package com.flagship.simple_banking.idempotency;

import lombok.Value;

/**
 * Outcome of {@link IdempotencyCoordinator#execute}: the response and whether
 * it came from the cache rather than from running the handler.
 */
@Value
public class IdempotentResult {
    CapturedResponse response;
    boolean replayed;

    static IdempotentResult fresh(CapturedResponse response) {
        return new IdempotentResult(response, false);
    }

    static IdempotentResult replayed(CapturedResponse response) {
        return new IdempotentResult(response, true);
    }
}
