package com.clapgrow.tracking.api.integration;

import com.clapgrow.tracking.api.counter.WindowedCounterStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Redis Counter Store Integration Tests")
class RedisWindowedCounterStoreIT extends BaseIntegrationTest {

    @Autowired
    private WindowedCounterStore counterStore;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @Test
    @DisplayName("rate counter should always carry an expiry")
    void testCounterExpiryIsRestored() {
        String key = "rate:" + UUID.randomUUID();
        String redisKey = "tracking:" + key;

        assertThat(counterStore.incrementInWindow(key, Duration.ofSeconds(60))).isEqualTo(1L);
        assertThat(redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS)).isPositive();

        // Simulates an expiry lost between INCR and PEXPIRE
        redisTemplate.persist(redisKey);
        assertThat(redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS)).isEqualTo(-1L);

        assertThat(counterStore.incrementInWindow(key, Duration.ofSeconds(60))).isEqualTo(2L);
        assertThat(redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS)).isPositive();
    }
}
