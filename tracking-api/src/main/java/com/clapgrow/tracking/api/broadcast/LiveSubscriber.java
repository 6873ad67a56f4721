package com.clapgrow.tracking.api.broadcast;

import com.clapgrow.tracking.api.dto.LiveEventFrame;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One connected live feed client: its viewer, its filter and a bounded frame buffer.
 *
 * The buffer drops its oldest frame when full, so a client that cannot keep up sees a gap
 * instead of holding memory or slowing delivery to anyone else. At most one drain task runs
 * per subscriber at any time.
 */
@Getter
public class LiveSubscriber {

    private final int handle;
    private final UUID viewerId;
    private final String tenantId;
    /** Null means every campaign of the tenant. */
    private final String campaignId;
    private final FrameSink sink;
    private final int capacity;

    private final ArrayDeque<LiveEventFrame> queue;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile boolean closed;

    public LiveSubscriber(int handle, UUID viewerId, String tenantId, String campaignId, FrameSink sink, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.handle = handle;
        this.viewerId = viewerId;
        this.tenantId = tenantId;
        this.campaignId = campaignId;
        this.sink = sink;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public boolean matches(String eventTenantId, String eventCampaignId) {
        return tenantId.equals(eventTenantId) && (campaignId == null || campaignId.equals(eventCampaignId));
    }

    /**
     * @return true when the oldest buffered frame was dropped to make room
     */
    public boolean enqueue(LiveEventFrame frame) {
        synchronized (queue) {
            boolean dropped = false;
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped = true;
            }
            queue.addLast(frame);
            return dropped;
        }
    }

    LiveEventFrame poll() {
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    public int pendingCount() {
        synchronized (queue) {
            return queue.size();
        }
    }

    boolean tryStartDrain() {
        return draining.compareAndSet(false, true);
    }

    void finishDrain() {
        draining.set(false);
    }

    void markClosed() {
        closed = true;
        synchronized (queue) {
            queue.clear();
        }
    }
}
