package com.flagship.simple_banking.idempotency;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for request deduplication ({@code idempotency.*}).
 *
 * Both durations are unset by default: waiters block until the owning request
 * finishes, and completed responses are kept for the life of the process.
 */
@Component
@ConfigurationProperties(prefix = "idempotency")
public class IdempotencyProperties {
    private boolean enabled = true;
    private String headerName = "Idempotency-Key";
    private Duration inFlightWaitTimeout;
    private Duration completedTtl;
    private long evictionIntervalMs = 60_000L;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHeaderName() {
        return headerName;
    }

    public void setHeaderName(String headerName) {
        this.headerName = headerName;
    }

    public Duration getInFlightWaitTimeout() {
        return inFlightWaitTimeout;
    }

    public void setInFlightWaitTimeout(Duration inFlightWaitTimeout) {
        this.inFlightWaitTimeout = inFlightWaitTimeout;
    }

    public Duration getCompletedTtl() {
        return completedTtl;
    }

    public void setCompletedTtl(Duration completedTtl) {
        this.completedTtl = completedTtl;
    }

    public long getEvictionIntervalMs() {
        return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
        this.evictionIntervalMs = evictionIntervalMs;
    }
}
