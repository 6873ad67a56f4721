package com.clapgrow.tracking.api.dto;

import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackingEventResponse {
    private UUID id;
    private String campaignId;
    private String messageId;
    private String recipientHash;
    private EngagementEventType eventType;
    private String url;
    private LocalDateTime occurredAt;
    private String sourceIp;
    private String classificationLabel;
    private Double classificationConfidence;
    private String classificationRule;
    private boolean automated;
    private String deviceType;
    private String clientName;
    private boolean anonymized;

    public static TrackingEventResponse from(TrackingEvent event) {
        return new TrackingEventResponse(
            event.getId(),
            event.getCampaignId(),
            event.getMessageId(),
            event.getRecipientHash(),
            event.getEventType(),
            event.getUrl(),
            event.getOccurredAt(),
            event.getSourceIp(),
            event.getClassificationLabel(),
            event.getClassificationConfidence(),
            event.getClassificationRule(),
            event.isAutomated(),
            event.getDeviceType(),
            event.getClientName(),
            event.isAnonymized()
        );
    }
}
