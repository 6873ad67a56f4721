package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.ProviderEventRequest;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.exception.TrackingNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Delivery provider callbacks (bounce, unsubscribe, complaint). They take the same Kafka
 * path to the recorder as beacon and redirect hits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderEventService {

    private final TrackingDirectoryService directoryService;
    private final OptOutService optOutService;
    private final EngagementEventPublisher eventPublisher;
    private final TrackingMetricsService metricsService;
    private final Clock clock;

    /**
     * @return true when the event was forwarded, false when the recipient suppresses it
     * @throws IllegalArgumentException for event types only a client can produce
     * @throws TrackingNotFoundException when the message was never registered
     */
    public boolean accept(ProviderEventRequest request) {
        if (!request.getEventType().isProviderReported()) {
            throw new IllegalArgumentException("Event type " + request.getEventType()
                + " cannot be reported by a provider; use BOUNCE, UNSUBSCRIBE or COMPLAINT");
        }
        TrackedMessageView message = directoryService.findMessage(request.getMessageId())
            .orElseThrow(() -> new TrackingNotFoundException("Message not found: " + request.getMessageId()));

        if (optOutService.isSuppressed(message.recipientHash(), request.getEventType())) {
            log.debug("Provider {} event for message {} suppressed by opt-out",
                request.getEventType(), message.messageId());
            metricsService.recordSuppressed(TrackingMetricsService.REASON_OPTED_OUT);
            return false;
        }

        Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : clock.instant();
        eventPublisher.publishProviderEvent(message, request.getEventType(), occurredAt);
        log.info("Accepted {} from provider {} for message {}", request.getEventType(),
            request.getProvider() != null ? request.getProvider() : "unspecified", message.messageId());
        return true;
    }
}
