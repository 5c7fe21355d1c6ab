package com.flagship.simple_banking.idempotency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes completed idempotency records past their TTL.
 * Only active when {@code idempotency.completed-ttl} is set.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "idempotency", name = "completed-ttl")
@RequiredArgsConstructor
@Slf4j
public class IdempotencyEvictionTask {

    private final IdempotencyCoordinator coordinator;

    @Scheduled(fixedDelayString = "#{@idempotencyProperties.evictionIntervalMs}")
    public void evictExpired() {
        int evicted = coordinator.evictExpired();
        if (evicted > 0) {
            log.info("Evicted {} expired idempotency records, {} remaining", evicted, coordinator.size());
        }
    }
}
