package com.flagship.simple_banking.observability;

import java.util.UUID;

/**
 * Header and MDC keys for request correlation.
 *
 * The correlation ID flows through HTTP requests (from header or generated),
 * all log statements (via MDC) and the response header, so a client can quote
 * it when reporting a failed call.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String IDEMPOTENCY_KEY_MDC_KEY = "idempotencyKey";

    private CorrelationContext() {
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
