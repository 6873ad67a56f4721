package com.clapgrow.tracking.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared consumer settings for the engagement event listeners.
 *
 * <p>Keeps the offset, timeout and rebalance settings in one place so every listener that
 * consumes {@code tracking-events} behaves the same way.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * String groupId = KafkaConsumerConfigHelper.buildGroupId("tracking-recorder", "prod");
 * Map<String, Object> props = KafkaConsumerConfigHelper.createBaseConsumerProperties(
 *     bootstrapServers, groupId, 50);
 * }</pre>
 */
public final class KafkaConsumerConfigHelper {

    private KafkaConsumerConfigHelper() {
    }

    /**
     * Creates base consumer properties.
     *
     * <p>Offsets are committed manually after an event has been handed to the recorder.
     * Cooperative sticky assignment avoids stop-the-world rebalances while instances scale.
     *
     * @param bootstrapServers Kafka bootstrap servers (e.g., "localhost:9092")
     * @param groupId consumer group id, usually built with {@link #buildGroupId(String, String)}
     * @param maxPollRecords upper bound on records handed to one poll; engagement events are
     *                       small, so this is larger than for provider-calling workers
     * @return properties ready for {@code DefaultKafkaConsumerFactory}
     */
    public static Map<String, Object> createBaseConsumerProperties(String bootstrapServers, String groupId,
                                                                   int maxPollRecords) {
        if (maxPollRecords <= 0) {
            throw new IllegalArgumentException("maxPollRecords must be positive: " + maxPollRecords);
        }
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPollRecords);

        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        configProps.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        configProps.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        configProps.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, 1);
        configProps.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, 500);

        configProps.put(
            ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG,
            "org.apache.kafka.clients.consumer.CooperativeStickyAssignor"
        );

        return configProps;
    }

    /**
     * Builds a consumer group id with an optional environment prefix.
     *
     * <ul>
     *   <li>{@code buildGroupId("tracking-recorder", "prod")} → "prod-tracking-recorder"</li>
     *   <li>{@code buildGroupId("tracking-recorder", null)} → "tracking-recorder"</li>
     *   <li>{@code buildGroupId("tracking-recorder", " ")} → "tracking-recorder"</li>
     * </ul>
     */
    public static String buildGroupId(String baseGroupId, String environmentPrefix) {
        if (environmentPrefix != null && !environmentPrefix.trim().isEmpty()) {
            return environmentPrefix.trim() + "-" + baseGroupId;
        }
        return baseGroupId;
    }
}
