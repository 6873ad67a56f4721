package com.clapgrow.tracking.api.broadcast;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * Fixed-capacity table of live subscribers indexed by handle. Slots are claimed and
 * released with compare-and-set; iteration never blocks registration.
 */
public class SubscriberTable {

    private final AtomicReferenceArray<LiveSubscriber> slots;
    private final AtomicInteger size = new AtomicInteger();

    public SubscriberTable(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.slots = new AtomicReferenceArray<>(capacity);
    }

    /**
     * Places a subscriber built for the first free handle.
     *
     * @return the subscriber, or null when every slot is taken
     */
    public LiveSubscriber claim(IntFunction<LiveSubscriber> factory) {
        for (int handle = 0; handle < slots.length(); handle++) {
            if (slots.get(handle) != null) {
                continue;
            }
            LiveSubscriber subscriber = factory.apply(handle);
            if (slots.compareAndSet(handle, null, subscriber)) {
                size.incrementAndGet();
                return subscriber;
            }
        }
        return null;
    }

    public LiveSubscriber get(int handle) {
        if (handle < 0 || handle >= slots.length()) {
            return null;
        }
        return slots.get(handle);
    }

    /**
     * Frees the slot only if it still holds {@code expected}.
     */
    public boolean release(LiveSubscriber expected) {
        int handle = expected.getHandle();
        if (handle < 0 || handle >= slots.length()) {
            return false;
        }
        if (slots.compareAndSet(handle, expected, null)) {
            size.decrementAndGet();
            return true;
        }
        return false;
    }

    public void forEach(Consumer<LiveSubscriber> action) {
        for (int handle = 0; handle < slots.length(); handle++) {
            LiveSubscriber subscriber = slots.get(handle);
            if (subscriber != null) {
                action.accept(subscriber);
            }
        }
    }

    public int size() {
        return size.get();
    }

    public int capacity() {
        return slots.length();
    }
}
