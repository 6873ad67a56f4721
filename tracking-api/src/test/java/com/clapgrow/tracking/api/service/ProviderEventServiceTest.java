package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.ProviderEventRequest;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.exception.TrackingNotFoundException;
import com.clapgrow.tracking.api.support.MutableClock;
import com.clapgrow.tracking.common.event.EngagementEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderEventServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final TrackedMessageView MESSAGE = new TrackedMessageView("M1", "C1", "tenant-1", "f".repeat(64), null);

    @Mock
    private TrackingDirectoryService directoryService;

    @Mock
    private OptOutService optOutService;

    @Mock
    private EngagementEventPublisher eventPublisher;

    @Mock
    private TrackingMetricsService metricsService;

    private ProviderEventService providerEventService;

    @BeforeEach
    void setUp() {
        providerEventService = new ProviderEventService(directoryService, optOutService, eventPublisher,
            metricsService, new MutableClock(NOW));
    }

    @Test
    void bounceIsForwardedWithReceiptTimeWhenNoneGiven() {
        when(directoryService.findMessage("M1")).thenReturn(Optional.of(MESSAGE));

        assertTrue(providerEventService.accept(request(EngagementEventType.BOUNCE, null)));

        verify(eventPublisher).publishProviderEvent(MESSAGE, EngagementEventType.BOUNCE, NOW);
    }

    @Test
    void reportedTimeIsKept() {
        Instant reported = Instant.parse("2024-05-01T09:15:00Z");
        when(directoryService.findMessage("M1")).thenReturn(Optional.of(MESSAGE));

        providerEventService.accept(request(EngagementEventType.COMPLAINT, reported));

        verify(eventPublisher).publishProviderEvent(MESSAGE, EngagementEventType.COMPLAINT, reported);
    }

    @Test
    void clientEventTypesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> providerEventService.accept(request(EngagementEventType.OPEN, null)));
        assertThrows(IllegalArgumentException.class,
            () -> providerEventService.accept(request(EngagementEventType.CLICK, null)));
        verifyNoInteractions(directoryService, eventPublisher);
    }

    @Test
    void unknownMessageIsNotFound() {
        when(directoryService.findMessage("M1")).thenReturn(Optional.empty());

        assertThrows(TrackingNotFoundException.class,
            () -> providerEventService.accept(request(EngagementEventType.BOUNCE, null)));
    }

    @Test
    void optedOutRecipientIsSuppressed() {
        when(directoryService.findMessage("M1")).thenReturn(Optional.of(MESSAGE));
        when(optOutService.isSuppressed(MESSAGE.recipientHash(), EngagementEventType.UNSUBSCRIBE)).thenReturn(true);

        assertFalse(providerEventService.accept(request(EngagementEventType.UNSUBSCRIBE, null)));

        verify(metricsService).recordSuppressed(TrackingMetricsService.REASON_OPTED_OUT);
        verifyNoInteractions(eventPublisher);
    }

    private static ProviderEventRequest request(EngagementEventType type, Instant occurredAt) {
        ProviderEventRequest request = new ProviderEventRequest();
        request.setMessageId("M1");
        request.setEventType(type);
        request.setOccurredAt(occurredAt);
        request.setProvider("sendgrid");
        return request;
    }
}
