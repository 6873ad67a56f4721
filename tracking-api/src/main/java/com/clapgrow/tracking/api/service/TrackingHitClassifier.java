package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.classifier.Classification;
import com.clapgrow.tracking.api.classifier.ClientClassifier;
import com.clapgrow.tracking.api.classifier.RequestContext;
import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.counter.WindowedCounterStore;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Builds the classifier input for one beacon or redirect hit: the per-host request count
 * from the shared counter store and the time elapsed since the message was sent.
 * Hosts are counted by the keyed hash of their full address, so neighbours in one
 * truncated network do not add up.
 */
@Component
@RequiredArgsConstructor
public class TrackingHitClassifier {

    static final String RATE_KEY_PREFIX = "rate:";

    private final ClientClassifier clientClassifier;
    private final WindowedCounterStore counterStore;
    private final TrackingProperties trackingProperties;

    public Classification classify(TrackedMessageView message, EngagementEventType eventType, TrackingRequestInfo request) {
        long requestsInWindow = 0;
        if (request.sourceKey() != null) {
            requestsInWindow = counterStore.incrementInWindow(RATE_KEY_PREFIX + request.sourceKey(),
                trackingProperties.getClassifier().getRateWindow());
        }
        return clientClassifier.classify(new RequestContext(
            request.userAgent(),
            request.referer(),
            eventType,
            elapsedSinceSend(message.sentAt(), request),
            requestsInWindow
        ));
    }

    private static Duration elapsedSinceSend(LocalDateTime sentAt, TrackingRequestInfo request) {
        if (sentAt == null) {
            return null;
        }
        Duration elapsed = Duration.between(sentAt, LocalDateTime.ofInstant(request.receivedAt(), ZoneOffset.UTC));
        // Clock skew between the sender and this service
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
