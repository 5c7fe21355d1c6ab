package com.flagship.simple_banking.idempotency;

import com.flagship.simple_banking.exception.ConflictException;
import com.flagship.simple_banking.exception.ErrorCode;

/**
 * A caller gave up waiting for another request that holds the same key,
 * either because the configured wait timeout elapsed or the thread was
 * interrupted.
 */
public class IdempotencyKeyInProgressException extends ConflictException {

    public IdempotencyKeyInProgressException(String message) {
        super(ErrorCode.IDEMPOTENCY_KEY_IN_PROGRESS, message);
    }
}
