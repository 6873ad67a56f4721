package com.clapgrow.tracking.api.dto;

import com.clapgrow.tracking.common.event.EngagementEventType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Record pushed to live feed subscribers. Carries a shortened recipient hash only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LiveEventFrame(
    EngagementEventType eventType,
    String campaignId,
    String messageId,
    String url,
    LocalDateTime occurredAt,
    boolean isAutomated,
    String classificationLabel,
    String recipientHash
) {
}
