package com.clapgrow.tracking.api.counter;

import com.clapgrow.tracking.api.config.TrackingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisWindowedCounterStoreTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisWindowedCounterStore store;

    @BeforeEach
    void setUp() {
        store = new RedisWindowedCounterStore(redisTemplate, new TrackingProperties());
    }

    @Test
    void everyIncrementCarriesTheWindowInOneScriptCall() {
        when(redisTemplate.execute(eq(RedisWindowedCounterStore.INCREMENT_IN_WINDOW),
                eq(List.of("tracking:rate:host")), eq("60000")))
            .thenReturn(1L, 2L, 3L);

        assertEquals(1L, store.incrementInWindow("rate:host", WINDOW));
        assertEquals(2L, store.incrementInWindow("rate:host", WINDOW));
        assertEquals(3L, store.incrementInWindow("rate:host", WINDOW));

        verify(redisTemplate, times(3)).execute(eq(RedisWindowedCounterStore.INCREMENT_IN_WINDOW),
            eq(List.of("tracking:rate:host")), eq("60000"));
        verify(redisTemplate, never()).expire(any(), anyLong(), any(TimeUnit.class));
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    void scriptRestoresAMissingExpiry() {
        String script = RedisWindowedCounterStore.INCREMENT_IN_WINDOW.getScriptAsString();

        assertTrue(script.contains("INCR"));
        assertTrue(script.contains("PTTL"));
        assertTrue(script.contains("PEXPIRE"));
        assertFalse(script.contains("== 1"), "expiry must not depend on being the first increment");
    }

    @Test
    void dedupClaimIsASingleConditionalSet() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent("tracking:open:M1", "1", 60000L, TimeUnit.MILLISECONDS))
            .thenReturn(true, false);

        assertTrue(store.acquireOnce("open:M1", WINDOW));
        assertFalse(store.acquireOnce("open:M1", WINDOW));
    }
}
