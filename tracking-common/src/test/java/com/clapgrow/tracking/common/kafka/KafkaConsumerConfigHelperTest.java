package com.clapgrow.tracking.common.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConsumerConfigHelperTest {

    @Test
    void testManualCommitAndGroup() {
        Map<String, Object> props = KafkaConsumerConfigHelper.createBaseConsumerProperties(
            "localhost:9092", "tracking-recorder", 50);

        assertEquals("tracking-recorder", props.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals(false, props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals(50, props.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
    }

    @Test
    void testRejectsNonPositivePollSize() {
        assertThrows(IllegalArgumentException.class,
            () -> KafkaConsumerConfigHelper.createBaseConsumerProperties("localhost:9092", "g", 0));
    }

    @Test
    void testBuildGroupId() {
        assertEquals("prod-tracking-recorder", KafkaConsumerConfigHelper.buildGroupId("tracking-recorder", "prod"));
        assertEquals("tracking-recorder", KafkaConsumerConfigHelper.buildGroupId("tracking-recorder", null));
        assertEquals("tracking-recorder", KafkaConsumerConfigHelper.buildGroupId("tracking-recorder", "  "));
    }
}
