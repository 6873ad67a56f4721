package com.clapgrow.tracking.api.counter;

import java.time.Duration;

/**
 * Short-lived shared counters used on the tracking hot path: open coalescing and
 * per-source request rates.
 *
 * Implementations must be safe for concurrent callers and, when more than one instance
 * serves tracking traffic, shared between instances.
 */
public interface WindowedCounterStore {

    /**
     * Claims {@code key} for {@code window}.
     *
     * @return true for the first caller in the window, false while an earlier claim is live
     */
    boolean acquireOnce(String key, Duration window);

    /**
     * Increments the counter for {@code key}. The window starts with the first increment and
     * the counter resets when it elapses.
     *
     * @return the count including this increment
     */
    long incrementInWindow(String key, Duration window);
}
