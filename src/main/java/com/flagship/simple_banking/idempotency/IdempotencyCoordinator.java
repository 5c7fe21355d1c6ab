package com.flagship.simple_banking.idempotency;

import com.flagship.simple_banking.observability.BankingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Deduplicates executions that share an idempotency key.
 *
 * Each key is absent, in flight or completed. Exactly one caller claims an
 * absent key (putIfAbsent) and runs the handler; concurrent callers block on
 * the claim's latch and re-read the key when it is released. A 2xx outcome is
 * stored as completed before the latch opens, so every waiter replays it. Any
 * other outcome, including a thrown exception, removes the claim so the next
 * caller (a released waiter or a new request) runs the handler again.
 *
 * State is held in memory for the life of the process. Without
 * {@code idempotency.completed-ttl} the table grows with every distinct
 * successful key.
 */
@Component
@Slf4j
public class IdempotencyCoordinator {

    private final ConcurrentMap<String, KeyState> states = new ConcurrentHashMap<>();
    private final IdempotencyProperties properties;
    private final BankingMetrics metrics;
    private final Clock clock;

    public IdempotencyCoordinator(IdempotencyProperties properties, BankingMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs {@code handler} unless a completed response for {@code key} exists
     * or another caller is already running it, in which case this call waits
     * and returns that caller's response.
     *
     * @throws IdempotencyKeyInProgressException if a bounded wait timed out or was interrupted
     * @throws Exception whatever the handler throws, after the claim is released
     */
    public IdempotentResult execute(String key, IdempotentHandler handler) throws Exception {
        while (true) {
            KeyState current = states.get(key);

            if (current instanceof Completed completed) {
                if (!isExpired(completed)) {
                    metrics.recordIdempotencyHit();
                    log.debug("Replaying completed response for idempotency key {}", key);
                    return IdempotentResult.replayed(completed.response);
                }
                states.remove(key, completed);
                continue;
            }

            if (current instanceof InFlight inFlight) {
                metrics.recordIdempotencyWait();
                log.debug("Idempotency key {} is in flight, waiting", key);
                await(key, inFlight);
                continue;
            }

            InFlight claim = new InFlight();
            if (states.putIfAbsent(key, claim) != null) {
                continue;
            }

            metrics.recordIdempotencyMiss();
            return runClaimed(key, claim, handler);
        }
    }

    /**
     * Drops completed records older than the configured TTL.
     *
     * @return number of records removed, always 0 when no TTL is configured
     */
    public int evictExpired() {
        if (properties.getCompletedTtl() == null) {
            return 0;
        }
        int evicted = 0;
        for (Map.Entry<String, KeyState> entry : states.entrySet()) {
            if (entry.getValue() instanceof Completed completed
                    && isExpired(completed)
                    && states.remove(entry.getKey(), completed)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            metrics.recordIdempotencyEvictions(evicted);
        }
        return evicted;
    }

    /**
     * Number of keys currently tracked (in flight or completed).
     */
    public int size() {
        return states.size();
    }

    private IdempotentResult runClaimed(String key, InFlight claim, IdempotentHandler handler) throws Exception {
        boolean cached = false;
        try {
            CapturedResponse response = handler.handle();
            if (response.isSuccessful()) {
                states.replace(key, claim, new Completed(response, clock.instant()));
                cached = true;
                log.debug("Cached status {} for idempotency key {}", response.getStatus(), key);
            } else {
                log.debug("Status {} for idempotency key {} is not cached", response.getStatus(), key);
            }
            return IdempotentResult.fresh(response);
        } finally {
            if (!cached) {
                states.remove(key, claim);
            }
            claim.release();
        }
    }

    private void await(String key, InFlight inFlight) {
        Duration timeout = properties.getInFlightWaitTimeout();
        try {
            if (timeout == null) {
                inFlight.await();
            } else if (!inFlight.await(timeout)) {
                throw new IdempotencyKeyInProgressException(
                    "A request with idempotency key '" + key + "' is still in progress");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdempotencyKeyInProgressException(
                "Interrupted while waiting for idempotency key '" + key + "'");
        }
    }

    private boolean isExpired(Completed completed) {
        Duration ttl = properties.getCompletedTtl();
        return ttl != null && !clock.instant().isBefore(completed.completedAt.plus(ttl));
    }

    private interface KeyState {
    }

    private static final class InFlight implements KeyState {
        private final CountDownLatch done = new CountDownLatch(1);

        void await() throws InterruptedException {
            done.await();
        }

        boolean await(Duration timeout) throws InterruptedException {
            return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        void release() {
            done.countDown();
        }
    }

    private static final class Completed implements KeyState {
        private final CapturedResponse response;
        private final Instant completedAt;

        Completed(CapturedResponse response, Instant completedAt) {
            this.response = response;
            this.completedAt = completedAt;
        }
    }
}
