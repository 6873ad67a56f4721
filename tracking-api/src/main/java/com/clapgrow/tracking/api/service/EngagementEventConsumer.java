package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.common.event.EngagementEventMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Feeds the recorder from the engagement events topic.
 *
 * <p>The event id is derived from the record's topic, partition and offset, so a redelivered
 * record maps to the row already written instead of a second one. Only retryable persistence
 * failures are redelivered; everything else is acknowledged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementEventConsumer {

    private static final Duration REDELIVERY_BACKOFF = Duration.ofSeconds(2);

    private final EventRecorder eventRecorder;
    private final ObjectMapper objectMapper;
    private final TrackingMetricsService metricsService;

    @KafkaListener(
        topics = "#{@trackingProperties.kafka.eventsTopic}",
        containerFactory = "kafkaListenerContainerFactory")
    public void onEngagementEvent(
            @Payload String payload,
            @Header(KafkaHeaders.RECEIVED_KEY) String messageId,
            @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        EngagementEventMessage event;
        try {
            event = objectMapper.readValue(payload, EngagementEventMessage.class);
        } catch (Exception e) {
            log.error("Undecodable engagement event for message {} at {}-{}@{}; skipping",
                messageId, topic, partition, offset, e);
            metricsService.recordFailure(TrackingMetricsService.STAGE_DECODE);
            acknowledgment.acknowledge();
            return;
        }

        RecordResult result = eventRecorder.record(event, deliveryId(topic, partition, offset));
        if (result.isSuccess() || !result.getError().retryable()) {
            acknowledgment.acknowledge();
            return;
        }

        log.warn("Recording {} event for message {} failed ({}); redelivering in {}",
            event.eventType(), messageId, result.getError().message(), REDELIVERY_BACKOFF);
        acknowledgment.nack(REDELIVERY_BACKOFF);
    }

    static UUID deliveryId(String topic, int partition, long offset) {
        return UUID.nameUUIDFromBytes((topic + "/" + partition + "/" + offset).getBytes(StandardCharsets.UTF_8));
    }
}
