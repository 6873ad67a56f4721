package com.clapgrow.tracking.common.event;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngagementEventMessageTest {

    @Test
    void testClickRequiresUrl() {
        assertThrows(IllegalArgumentException.class, () -> message(EngagementEventType.CLICK, null));
        assertDoesNotThrow(() -> message(EngagementEventType.CLICK, "https://example.com/product"));
    }

    @Test
    void testNonClickRejectsUrl() {
        assertThrows(IllegalArgumentException.class, () -> message(EngagementEventType.OPEN, "https://example.com"));
        assertDoesNotThrow(() -> message(EngagementEventType.OPEN, null));
        assertDoesNotThrow(() -> message(EngagementEventType.BOUNCE, null));
    }

    @Test
    void testProviderReportedTypes() {
        assertFalse(EngagementEventType.OPEN.isProviderReported());
        assertFalse(EngagementEventType.CLICK.isProviderReported());
        assertTrue(EngagementEventType.BOUNCE.isProviderReported());
        assertTrue(EngagementEventType.UNSUBSCRIBE.isProviderReported());
        assertTrue(EngagementEventType.COMPLAINT.isProviderReported());
    }

    private static EngagementEventMessage message(EngagementEventType type, String url) {
        return new EngagementEventMessage("M1", "C1", "T1", "hash", type, url, 0L,
            null, null, null, null, "human", 0.5, "default", false, "desktop", "Unknown");
    }
}
