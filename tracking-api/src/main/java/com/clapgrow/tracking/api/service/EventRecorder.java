package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.broadcast.EventBroadcaster;
import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.api.repository.TrackingEventRepository;
import com.clapgrow.tracking.common.event.EngagementEventMessage;
import com.clapgrow.tracking.common.privacy.IpAddressTruncator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Persists engagement events and passes each stored event to the live broadcaster.
 *
 * <p>Rows are insert-only. The source address is truncated again at write time so nothing
 * longer than a network prefix is stored even if a producer skipped it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventRecorder {

    private final TrackingEventRepository trackingEventRepository;
    private final ClientHeaderSanitizer headerSanitizer;
    private final EventBroadcaster eventBroadcaster;
    private final TrackingMetricsService metricsService;
    private final Clock clock;

    public RecordResult record(EngagementEventMessage event) {
        return record(event, UUID.randomUUID());
    }

    /**
     * Records {@code event} under {@code eventId}. Recording the same id twice stores one row
     * and reports the second attempt as {@link RecordError.Kind#DUPLICATE}.
     */
    public RecordResult record(EngagementEventMessage event, UUID eventId) {
        RecordError invalid = validate(event);
        if (invalid != null) {
            log.warn("Dropping {} event for message {}: {}", event.eventType(), event.messageId(), invalid.message());
            return RecordResult.failure(invalid);
        }

        TrackingEvent entity = toEntity(event, eventId);
        TrackingEvent saved;
        try {
            saved = trackingEventRepository.save(entity);
        } catch (DataIntegrityViolationException e) {
            if (isAlreadyStored(eventId)) {
                log.debug("Event {} for message {} already recorded", eventId, event.messageId());
                return RecordResult.failure(RecordError.duplicate("Event " + eventId + " already recorded"));
            }
            log.error("Rejected {} event for message {}: {}", event.eventType(), event.messageId(), e.getMessage());
            metricsService.recordFailure(TrackingMetricsService.STAGE_PERSIST);
            return RecordResult.failure(RecordError.invalid(e.getMostSpecificCause().getMessage()));
        } catch (DataAccessException e) {
            log.error("Failed to persist {} event for message {}", event.eventType(), event.messageId(), e);
            metricsService.recordFailure(TrackingMetricsService.STAGE_PERSIST);
            return RecordResult.failure(RecordError.persistence(e.getMessage()));
        }

        metricsService.recordEventRecorded(saved.getEventType(), saved.isAutomated());
        if (!event.eventType().isProviderReported()) {
            metricsService.recordIngestLatency(clock.millis() - event.occurredAtEpochMillis());
        }

        try {
            eventBroadcaster.publish(saved);
        } catch (RuntimeException e) {
            // Stored is stored; a live feed problem must not turn into a redelivery
            log.error("Failed to broadcast event {} for message {}", saved.getId(), saved.getMessageId(), e);
        }
        return RecordResult.success(saved.getId());
    }

    private boolean isAlreadyStored(UUID eventId) {
        try {
            return trackingEventRepository.existsById(eventId);
        } catch (DataAccessException e) {
            return false;
        }
    }

    private static RecordError validate(EngagementEventMessage event) {
        if (isBlank(event.campaignId()) || isBlank(event.tenantId())) {
            return RecordError.invalid("campaignId and tenantId are required");
        }
        if (isBlank(event.recipientHash())) {
            return RecordError.invalid("recipientHash is required");
        }
        if (!RecipientHasher.isHash(event.recipientHash())) {
            return RecordError.invalid("recipientHash is not a keyed hash");
        }
        if (isBlank(event.classificationLabel())) {
            return RecordError.invalid("classification label is required");
        }
        return null;
    }

    private TrackingEvent toEntity(EngagementEventMessage event, UUID eventId) {
        TrackingEvent entity = new TrackingEvent();
        entity.setId(eventId);
        entity.setCampaignId(event.campaignId());
        entity.setTenantId(event.tenantId());
        entity.setMessageId(event.messageId());
        entity.setRecipientHash(event.recipientHash());
        entity.setEventType(event.eventType());
        entity.setUrl(event.url());
        entity.setOccurredAt(LocalDateTime.ofInstant(Instant.ofEpochMilli(event.occurredAtEpochMillis()), ZoneOffset.UTC));
        entity.setSourceIp(IpAddressTruncator.truncate(event.sourceIp()));
        entity.setClassificationLabel(event.classificationLabel());
        entity.setClassificationConfidence(event.classificationConfidence());
        entity.setClassificationRule(event.classificationRule());
        entity.setAutomated(event.automated());
        entity.setDeviceType(event.deviceType());
        entity.setClientName(event.clientName());
        entity.setRawClientHeaders(headerSanitizer.sanitize(event));
        entity.setAnonymized(false);
        return entity;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
