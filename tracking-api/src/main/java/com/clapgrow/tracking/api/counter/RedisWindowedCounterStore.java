package com.clapgrow.tracking.api.counter;

import com.clapgrow.tracking.api.config.TrackingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Counter store shared by every instance through Redis.
 *
 * Dedup claims are a single {@code SET key 1 NX PX window}. Rate counters run
 * {@code INCR} and, whenever the key has no TTL, {@code PEXPIRE} in one Lua script, so a
 * counter can never outlive its window.
 */
@Component
@ConditionalOnProperty(prefix = "tracking.counters", name = "store", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisWindowedCounterStore implements WindowedCounterStore {

    static final RedisScript<Long> INCREMENT_IN_WINDOW = new DefaultRedisScript<>(
        "local count = redis.call('INCR', KEYS[1]) "
            + "if redis.call('PTTL', KEYS[1]) < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) end "
            + "return count",
        Long.class);

    private final StringRedisTemplate redisTemplate;
    private final TrackingProperties trackingProperties;

    @Override
    public boolean acquireOnce(String key, Duration window) {
        Boolean acquired = redisTemplate.opsForValue()
            .setIfAbsent(prefixed(key), "1", window.toMillis(), TimeUnit.MILLISECONDS);
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public long incrementInWindow(String key, Duration window) {
        String redisKey = prefixed(key);
        Long count = redisTemplate.execute(INCREMENT_IN_WINDOW, Collections.singletonList(redisKey),
            String.valueOf(window.toMillis()));
        if (count == null) {
            // Only inside a pipeline/transaction; not used that way here
            log.warn("Redis counter script returned no value for {}", redisKey);
            return 1L;
        }
        return count;
    }

    private String prefixed(String key) {
        return trackingProperties.getCounters().getKeyPrefix() + key;
    }
}
