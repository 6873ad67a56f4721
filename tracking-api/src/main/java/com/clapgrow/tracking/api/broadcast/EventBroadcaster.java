package com.clapgrow.tracking.api.broadcast;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.dto.LiveEventFrame;
import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.api.service.RecipientHasher;
import com.clapgrow.tracking.api.service.TrackingMetricsService;
import com.clapgrow.tracking.api.service.ViewerPrincipal;
import com.clapgrow.tracking.api.service.ViewerService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Pushes recorded events to connected live feed subscribers.
 *
 * <p>{@link #publish} only enqueues; writes happen on the broadcast executor, one drain task
 * per subscriber, so neither the recorder nor other subscribers wait on a slow client.
 *
 * <p>Authorization is checked again for every delivery against the viewer roster. A viewer
 * revoked after connecting stops receiving frames at the next event and is disconnected.
 */
@Component
@Slf4j
public class EventBroadcaster {

    private final SubscriberTable table;
    private final ViewerService viewerService;
    private final RecipientHasher recipientHasher;
    private final TrackingMetricsService metricsService;
    private final Executor executor;
    private final int queueCapacity;

    public EventBroadcaster(ViewerService viewerService,
                            RecipientHasher recipientHasher,
                            TrackingMetricsService metricsService,
                            TrackingProperties trackingProperties,
                            @Qualifier("broadcastExecutor") Executor executor) {
        this.viewerService = viewerService;
        this.recipientHasher = recipientHasher;
        this.metricsService = metricsService;
        this.executor = executor;
        this.table = new SubscriberTable(trackingProperties.getBroadcast().getMaxSubscribers());
        this.queueCapacity = trackingProperties.getBroadcast().getQueueCapacity();
    }

    /**
     * @param campaignId null to receive every campaign of the viewer's tenant
     * @return subscriber handle
     * @throws IllegalStateException when the subscriber table is full
     */
    public int subscribe(ViewerPrincipal viewer, String campaignId, FrameSink sink) {
        LiveSubscriber subscriber = table.claim(handle ->
            new LiveSubscriber(handle, viewer.viewerId(), viewer.tenantId(), campaignId, sink, queueCapacity));
        if (subscriber == null) {
            log.warn("Live feed at capacity ({} subscribers); refusing viewer {}", table.capacity(), viewer.viewerId());
            throw new IllegalStateException("Live feed is at capacity");
        }
        log.info("Viewer {} subscribed to live feed (handle {}, campaign {})",
            viewer.viewerId(), subscriber.getHandle(), campaignId == null ? "*" : campaignId);
        return subscriber.getHandle();
    }

    public void unsubscribe(int handle) {
        LiveSubscriber subscriber = table.get(handle);
        if (subscriber != null) {
            remove(subscriber, "client closed");
        }
    }

    public void publish(TrackingEvent event) {
        LiveEventFrame frame = new LiveEventFrame(
            event.getEventType(),
            event.getCampaignId(),
            event.getMessageId(),
            event.getUrl(),
            event.getOccurredAt(),
            event.isAutomated(),
            event.getClassificationLabel(),
            recipientHasher.truncateForLiveFeed(event.getRecipientHash())
        );

        table.forEach(subscriber -> {
            if (subscriber.isClosed() || !subscriber.matches(event.getTenantId(), event.getCampaignId())) {
                return;
            }
            if (!viewerService.isAuthorized(subscriber.getViewerId(), subscriber.getTenantId())) {
                remove(subscriber, "viewer no longer authorized");
                return;
            }
            if (subscriber.enqueue(frame)) {
                metricsService.recordBroadcastDropped();
                log.warn("Live feed subscriber {} is behind; dropped oldest frame", subscriber.getHandle());
            }
            scheduleDrain(subscriber);
        });
    }

    /**
     * Disconnects subscribers whose viewer was revoked even when no event arrives for them.
     */
    @Scheduled(fixedDelayString = "#{@trackingProperties.broadcast.rosterRefreshInterval.toMillis()}")
    public void sweepRevoked() {
        table.forEach(subscriber -> {
            if (!viewerService.isAuthorized(subscriber.getViewerId(), subscriber.getTenantId())) {
                remove(subscriber, "viewer no longer authorized");
            }
        });
    }

    public int subscriberCount() {
        return table.size();
    }

    @PreDestroy
    public void closeAll() {
        table.forEach(subscriber -> remove(subscriber, "shutdown"));
    }

    private void scheduleDrain(LiveSubscriber subscriber) {
        if (!subscriber.tryStartDrain()) {
            return;
        }
        try {
            executor.execute(() -> drain(subscriber));
        } catch (RejectedExecutionException e) {
            subscriber.finishDrain();
            log.warn("Broadcast executor saturated; subscriber {} will be drained on the next event",
                subscriber.getHandle());
        }
    }

    private void drain(LiveSubscriber subscriber) {
        try {
            LiveEventFrame frame;
            while (!subscriber.isClosed() && (frame = subscriber.poll()) != null) {
                subscriber.getSink().send(frame);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Live feed subscriber {} write failed: {}", subscriber.getHandle(), e.getMessage());
            remove(subscriber, "write failed");
        } finally {
            subscriber.finishDrain();
        }
        // A frame enqueued between the last poll and finishDrain would otherwise wait for the next event
        if (!subscriber.isClosed() && subscriber.pendingCount() > 0) {
            scheduleDrain(subscriber);
        }
    }

    private void remove(LiveSubscriber subscriber, String reason) {
        if (table.release(subscriber)) {
            subscriber.markClosed();
            subscriber.getSink().close();
            log.info("Live feed subscriber {} (viewer {}) removed: {}",
                subscriber.getHandle(), subscriber.getViewerId(), reason);
        }
    }
}
