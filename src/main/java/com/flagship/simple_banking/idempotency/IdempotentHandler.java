package com.flagship.simple_banking.idempotency;

/**
 * The guarded business logic. Runs at most once per claim of a key.
 */
@FunctionalInterface
public interface IdempotentHandler {

    CapturedResponse handle() throws Exception;
}
