package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.classifier.Classification;
import com.clapgrow.tracking.api.dto.CampaignFlagsView;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.enums.ClientLabel;
import com.clapgrow.tracking.api.exception.TrackingProtocolException;
import com.clapgrow.tracking.api.support.MutableClock;
import com.clapgrow.tracking.api.support.TestTrackingProperties;
import com.clapgrow.tracking.common.event.EngagementEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClickTrackingServiceTest {

    private static final String URL = "https://example.com/product";
    private static final String RECIPIENT_HASH = "b".repeat(64);
    private static final TrackedMessageView MESSAGE = new TrackedMessageView(
        "M1", "C1", "tenant-1", RECIPIENT_HASH, LocalDateTime.parse("2024-05-01T09:00:00"));

    @Mock
    private TrackingDirectoryService directoryService;

    @Mock
    private OptOutService optOutService;

    @Mock
    private TrackingHitClassifier hitClassifier;

    @Mock
    private EngagementEventPublisher eventPublisher;

    @Mock
    private TrackingMetricsService metricsService;

    private TrackingSignatureService signatureService;
    private ClickTrackingService clickService;
    private TrackingRequestInfo request;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        signatureService = new TrackingSignatureService(TestTrackingProperties.create(), clock);
        clickService = new ClickTrackingService(signatureService, directoryService, optOutService,
            hitClassifier, eventPublisher, metricsService);
        request = new TrackingRequestInfo("198.51.100.0", "host-key-2", "Mozilla/5.0", null, null, clock.instant());
    }

    @Test
    void validSignatureRecordsAndRedirects() {
        Classification human = new Classification(ClientLabel.HUMAN, 0.5, "fallback-human", "desktop", "Unknown");
        when(directoryService.findMessage("M1")).thenReturn(Optional.of(MESSAGE));
        when(directoryService.campaignFlags("C1")).thenReturn(CampaignFlagsView.defaults("C1"));
        when(hitClassifier.classify(MESSAGE, EngagementEventType.CLICK, request)).thenReturn(human);

        ClickOutcome outcome = clickService.handleClick("M1", URL, signatureService.sign("M1", URL), request);

        assertTrue(outcome.verified());
        assertEquals(URL, outcome.location());
        verify(eventPublisher).publishClientEvent(MESSAGE, EngagementEventType.CLICK, URL, request, human);
    }

    @Test
    void tamperedSignatureIsRejectedWithoutLookup() {
        String sig = signatureService.sign("M1", URL);

        ClickOutcome outcome = clickService.handleClick("M1", URL, sig + "x", request);

        assertFalse(outcome.verified());
        assertNull(outcome.location());
        verify(metricsService).recordSignatureRejected();
        verifyNoInteractions(directoryService, eventPublisher);
    }

    @Test
    void signatureForAnotherDestinationIsRejected() {
        String sig = signatureService.sign("M1", URL);

        assertFalse(clickService.handleClick("M1", "https://evil.example.com/", sig, request).verified());
    }

    @Test
    void unknownMessageStillRedirects() {
        when(directoryService.findMessage("M1")).thenReturn(Optional.empty());

        ClickOutcome outcome = clickService.handleClick("M1", URL, signatureService.sign("M1", URL), request);

        assertTrue(outcome.verified());
        verifyNoInteractions(eventPublisher);
        verify(metricsService).recordSuppressed(TrackingMetricsService.REASON_UNKNOWN_MESSAGE);
    }

    @Test
    void disabledClickTrackingStillRedirects() {
        when(directoryService.findMessage("M1")).thenReturn(Optional.of(MESSAGE));
        when(directoryService.campaignFlags("C1")).thenReturn(new CampaignFlagsView("C1", true, false));

        ClickOutcome outcome = clickService.handleClick("M1", URL, signatureService.sign("M1", URL), request);

        assertTrue(outcome.verified());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void optedOutRecipientStillRedirects() {
        when(directoryService.findMessage("M1")).thenReturn(Optional.of(MESSAGE));
        when(directoryService.campaignFlags("C1")).thenReturn(CampaignFlagsView.defaults("C1"));
        when(optOutService.isSuppressed(RECIPIENT_HASH, EngagementEventType.CLICK)).thenReturn(true);

        ClickOutcome outcome = clickService.handleClick("M1", URL, signatureService.sign("M1", URL), request);

        assertTrue(outcome.verified());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void internalFailureStillRedirects() {
        when(directoryService.findMessage("M1")).thenThrow(new IllegalStateException("cache unavailable"));

        ClickOutcome outcome = clickService.handleClick("M1", URL, signatureService.sign("M1", URL), request);

        assertTrue(outcome.verified());
        assertEquals(URL, outcome.location());
        verify(metricsService).recordFailure(TrackingMetricsService.STAGE_PUBLISH);
    }

    @Test
    void missingParameterIsProtocolError() {
        assertThrows(TrackingProtocolException.class, () -> clickService.handleClick(null, URL, "sig", request));
        assertThrows(TrackingProtocolException.class, () -> clickService.handleClick("M1", "", "sig", request));
        assertThrows(TrackingProtocolException.class, () -> clickService.handleClick("M1", URL, null, request));
        verifyNoInteractions(metricsService, directoryService);
    }
}
