package com.clapgrow.tracking.api.counter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-node counter store. Every update is one atomic {@code compute} on the key, so two
 * concurrent claims for the same key cannot both succeed.
 *
 * Time comes from the injected clock, which lets tests move through windows without sleeping.
 */
@Component
@ConditionalOnProperty(prefix = "tracking.counters", name = "store", havingValue = "memory")
@Slf4j
public class InMemoryWindowedCounterStore implements WindowedCounterStore {

    private final ConcurrentMap<String, WindowEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryWindowedCounterStore(Clock clock) {
        this.clock = clock;
    }

    private record WindowEntry(Instant expiresAt, long count) {
        boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    @Override
    public boolean acquireOnce(String key, Duration window) {
        Instant now = clock.instant();
        boolean[] acquired = {false};
        entries.compute(key, (k, existing) -> {
            if (existing != null && existing.isLive(now)) {
                return existing;
            }
            acquired[0] = true;
            return new WindowEntry(now.plus(window), 1L);
        });
        return acquired[0];
    }

    @Override
    public long incrementInWindow(String key, Duration window) {
        Instant now = clock.instant();
        WindowEntry updated = entries.compute(key, (k, existing) -> {
            if (existing == null || !existing.isLive(now)) {
                return new WindowEntry(now.plus(window), 1L);
            }
            return new WindowEntry(existing.expiresAt(), existing.count() + 1);
        });
        return updated.count();
    }

    @Scheduled(fixedDelay = 60000)
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !e.getValue().isLive(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Evicted {} expired counter windows", removed);
        }
    }

    int size() {
        return entries.size();
    }
}
