package com.clapgrow.tracking.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire payload published to the engagement events topic.
 *
 * <p>Produced by the beacon, redirect and webhook paths, keyed by {@code messageId} so that
 * every event of one message lands on the same partition and is recorded in order.
 * The recipient identifier is already a keyed hash and the source address is already
 * truncated when this payload is built; raw values never reach the topic.
 *
 * <p>{@code occurredAtEpochMillis} is kept as epoch millis so the payload does not depend on
 * a particular date/time module being registered on the consumer's mapper.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngagementEventMessage(
    String messageId,
    String campaignId,
    String tenantId,
    String recipientHash,
    EngagementEventType eventType,
    String url,
    long occurredAtEpochMillis,
    String sourceIp,
    String userAgent,
    String referer,
    String acceptLanguage,
    String classificationLabel,
    double classificationConfidence,
    String classificationRule,
    boolean automated,
    String deviceType,
    String clientName
) {
    public EngagementEventMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId is required");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (eventType.requiresUrl() != (url != null)) {
            throw new IllegalArgumentException("url must be present exactly for CLICK events, got "
                + eventType + " with url=" + (url != null));
        }
    }
}
