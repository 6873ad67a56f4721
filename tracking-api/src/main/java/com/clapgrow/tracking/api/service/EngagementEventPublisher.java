package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.classifier.Classification;
import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.enums.ClientLabel;
import com.clapgrow.tracking.common.event.EngagementEventMessage;
import com.clapgrow.tracking.common.event.EngagementEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Hands accepted tracking hits to the recorder through Kafka. The HTTP response never waits
 * for the send; failures are logged and counted, never surfaced to the client.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementEventPublisher {

    static final String PROVIDER_RULE = "provider-reported";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final TrackingProperties trackingProperties;
    private final TrackingMetricsService metricsService;

    public void publishClientEvent(TrackedMessageView message, EngagementEventType eventType, String url,
                                   TrackingRequestInfo request, Classification classification) {
        publish(new EngagementEventMessage(
            message.messageId(),
            message.campaignId(),
            message.tenantId(),
            message.recipientHash(),
            eventType,
            url,
            request.receivedAt().toEpochMilli(),
            request.sourceIp(),
            request.userAgent(),
            request.referer(),
            request.acceptLanguage(),
            classification.label().wireName(),
            classification.confidence(),
            classification.rule(),
            classification.isAutomated(),
            classification.deviceType(),
            classification.clientName()
        ));
    }

    /**
     * Provider callbacks carry no client to classify; they are stored as unknown, not automated.
     */
    public void publishProviderEvent(TrackedMessageView message, EngagementEventType eventType, Instant occurredAt) {
        publish(new EngagementEventMessage(
            message.messageId(),
            message.campaignId(),
            message.tenantId(),
            message.recipientHash(),
            eventType,
            null,
            occurredAt.toEpochMilli(),
            null, null, null, null,
            ClientLabel.UNKNOWN.wireName(),
            0.0,
            PROVIDER_RULE,
            false,
            null,
            null
        ));
    }

    void publish(EngagementEventMessage event) {
        String topic = trackingProperties.getKafka().getEventsTopic();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event for message {}", event.eventType(), event.messageId(), e);
            metricsService.recordFailure(TrackingMetricsService.STAGE_PUBLISH);
            return;
        }

        try {
            // Keyed by messageId: one message's events are consumed in order
            kafkaTemplate.send(topic, event.messageId(), payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish {} event for message {} to {}",
                            event.eventType(), event.messageId(), topic, ex);
                        metricsService.recordFailure(TrackingMetricsService.STAGE_PUBLISH);
                    } else if (log.isDebugEnabled()) {
                        log.debug("Published {} event for message {} to partition {}",
                            event.eventType(), event.messageId(), result.getRecordMetadata().partition());
                    }
                });
        } catch (Exception e) {
            // Synchronous failures: producer closed, metadata unavailable, buffer full
            log.error("Failed to publish {} event for message {} to {}", event.eventType(), event.messageId(), topic, e);
            metricsService.recordFailure(TrackingMetricsService.STAGE_PUBLISH);
        }
    }
}
