package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.classifier.Classification;
import com.clapgrow.tracking.api.classifier.ClientClassifier;
import com.clapgrow.tracking.api.classifier.RequestContext;
import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.counter.InMemoryWindowedCounterStore;
import com.clapgrow.tracking.api.counter.WindowedCounterStore;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.enums.ClientLabel;
import com.clapgrow.tracking.api.support.MutableClock;
import com.clapgrow.tracking.api.support.TestTrackingProperties;
import com.clapgrow.tracking.common.event.EngagementEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrackingHitClassifierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Classification RESULT = new Classification(ClientLabel.HUMAN, 0.5, "fallback-human", null, "Unknown");

    @Mock
    private ClientClassifier clientClassifier;

    @Mock
    private WindowedCounterStore counterStore;

    private TrackingHitClassifier hitClassifier;

    @BeforeEach
    void setUp() {
        hitClassifier = new TrackingHitClassifier(clientClassifier, counterStore, new TrackingProperties());
    }

    @Test
    void countsRequestsPerSourceHostAndMeasuresElapsedTime() {
        when(counterStore.incrementInWindow("rate:host-key", Duration.ofSeconds(60))).thenReturn(7L);
        when(clientClassifier.classify(any())).thenReturn(RESULT);
        TrackedMessageView message = message(LocalDateTime.parse("2024-05-01T09:59:57"));

        Classification result = hitClassifier.classify(message, EngagementEventType.OPEN,
            new TrackingRequestInfo("203.0.113.0", "host-key", "UA", "https://mail.example.com/", null, NOW));

        assertSame(RESULT, result);
        RequestContext context = captureContext();
        assertEquals(7L, context.requestsInWindow());
        assertEquals(Duration.ofSeconds(3), context.elapsedSinceSend());
        assertEquals("UA", context.userAgent());
        assertEquals(EngagementEventType.OPEN, context.eventType());
    }

    @Test
    void unknownSendTimeAndSourceLeaveTimingAndRateEmpty() {
        when(clientClassifier.classify(any())).thenReturn(RESULT);

        hitClassifier.classify(message(null), EngagementEventType.CLICK,
            new TrackingRequestInfo(null, null, null, null, null, NOW));

        RequestContext context = captureContext();
        assertNull(context.elapsedSinceSend());
        assertEquals(0L, context.requestsInWindow());
        verifyNoInteractions(counterStore);
    }

    @Test
    void sendTimeInTheFutureCountsAsImmediate() {
        when(clientClassifier.classify(any())).thenReturn(RESULT);

        hitClassifier.classify(message(LocalDateTime.parse("2024-05-01T10:00:05")), EngagementEventType.OPEN,
            new TrackingRequestInfo(null, null, "UA", null, null, NOW));

        assertEquals(Duration.ZERO, captureContext().elapsedSinceSend());
    }

    @Test
    void distinctHostsInOneNetworkAreCountedSeparately() {
        when(clientClassifier.classify(any())).thenReturn(RESULT);
        TrackingHitClassifier classifier = sharedCounterClassifier();
        RecipientHasher hasher = new RecipientHasher(TestTrackingProperties.create());

        for (int host = 1; host <= 21; host++) {
            TrackingRequestInfo request = TrackingRequestInfo.from(
                remoteRequest("198.51.100." + host), false, NOW, hasher::hashSourceAddress);
            assertEquals("198.51.100.0", request.sourceIp());
            classifier.classify(message(null), EngagementEventType.OPEN, request);
        }

        for (RequestContext context : captureContexts(21)) {
            assertEquals(1L, context.requestsInWindow());
        }
    }

    @Test
    void repeatedRequestsFromOneHostAccumulate() {
        when(clientClassifier.classify(any())).thenReturn(RESULT);
        TrackingHitClassifier classifier = sharedCounterClassifier();
        RecipientHasher hasher = new RecipientHasher(TestTrackingProperties.create());

        for (int i = 0; i < 21; i++) {
            classifier.classify(message(null), EngagementEventType.OPEN,
                TrackingRequestInfo.from(remoteRequest("198.51.100.7"), false, NOW, hasher::hashSourceAddress));
        }

        List<RequestContext> contexts = captureContexts(21);
        assertEquals(21L, contexts.get(20).requestsInWindow());
    }

    @Test
    void forwardedAddressIsIgnoredUnlessTrusted() {
        MockHttpServletRequest request = remoteRequest("192.0.2.10");
        request.addHeader("X-Forwarded-For", "203.0.113.77, 10.0.0.1");

        TrackingRequestInfo untrusted = TrackingRequestInfo.from(request, false, NOW, address -> "key:" + address);
        TrackingRequestInfo trusted = TrackingRequestInfo.from(request, true, NOW, address -> "key:" + address);

        assertEquals("192.0.2.0", untrusted.sourceIp());
        assertEquals("key:192.0.2.10", untrusted.sourceKey());
        assertEquals("203.0.113.0", trusted.sourceIp());
        assertEquals("key:203.0.113.77", trusted.sourceKey());
    }

    private TrackingHitClassifier sharedCounterClassifier() {
        InMemoryWindowedCounterStore store = new InMemoryWindowedCounterStore(new MutableClock(NOW));
        return new TrackingHitClassifier(clientClassifier, store, new TrackingProperties());
    }

    private static MockHttpServletRequest remoteRequest(String address) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/tracking/open");
        request.setRemoteAddr(address);
        request.addHeader("User-Agent", "Mozilla/5.0");
        return request;
    }

    private List<RequestContext> captureContexts(int expected) {
        ArgumentCaptor<RequestContext> captor = ArgumentCaptor.forClass(RequestContext.class);
        verify(clientClassifier, times(expected)).classify(captor.capture());
        return captor.getAllValues();
    }

    private RequestContext captureContext() {
        ArgumentCaptor<RequestContext> captor = ArgumentCaptor.forClass(RequestContext.class);
        verify(clientClassifier).classify(captor.capture());
        return captor.getValue();
    }

    private static TrackedMessageView message(LocalDateTime sentAt) {
        return new TrackedMessageView("M1", "C1", "tenant-1", "c".repeat(64), sentAt);
    }
}
