package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.classifier.Classification;
import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.counter.WindowedCounterStore;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Open beacon handling.
 *
 * The caller always answers with the same image whatever happens here, so this class never
 * throws: every skipped hit is counted under its reason and every failure is logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BeaconTrackingService {

    static final String OPEN_KEY_PREFIX = "open:";

    private final TrackingSignatureService signatureService;
    private final TrackingDirectoryService directoryService;
    private final OptOutService optOutService;
    private final TrackingHitClassifier hitClassifier;
    private final WindowedCounterStore counterStore;
    private final EngagementEventPublisher eventPublisher;
    private final TrackingMetricsService metricsService;
    private final TrackingProperties trackingProperties;

    /**
     * @return true when an OPEN event was handed to the recorder
     */
    public boolean handleOpen(String messageId, String token, TrackingRequestInfo request) {
        try {
            return process(messageId, token, request);
        } catch (Exception e) {
            log.error("Open tracking failed for message {}", messageId, e);
            metricsService.recordFailure(TrackingMetricsService.STAGE_PUBLISH);
            return false;
        }
    }

    private boolean process(String messageId, String token, TrackingRequestInfo request) {
        if (messageId == null || messageId.isBlank()) {
            log.debug("Beacon hit without messageId");
            metricsService.recordSuppressed(TrackingMetricsService.REASON_UNKNOWN_MESSAGE);
            return false;
        }
        if (trackingProperties.getOpen().isRequireToken() && !signatureService.verifyOpen(messageId, token)) {
            log.debug("Beacon hit for message {} with invalid open token", messageId);
            metricsService.recordSuppressed(TrackingMetricsService.REASON_INVALID_TOKEN);
            return false;
        }

        Optional<TrackedMessageView> found = directoryService.findMessage(messageId);
        if (found.isEmpty()) {
            log.debug("Beacon hit for unknown message {}", messageId);
            metricsService.recordSuppressed(TrackingMetricsService.REASON_UNKNOWN_MESSAGE);
            return false;
        }
        TrackedMessageView message = found.get();

        if (!directoryService.campaignFlags(message.campaignId()).openTrackingEnabled()) {
            log.debug("Open tracking disabled for campaign {}", message.campaignId());
            metricsService.recordSuppressed(TrackingMetricsService.REASON_TRACKING_DISABLED);
            return false;
        }
        if (optOutService.isSuppressed(message.recipientHash(), EngagementEventType.OPEN)) {
            log.debug("Recipient of message {} opted out of open tracking", messageId);
            metricsService.recordSuppressed(TrackingMetricsService.REASON_OPTED_OUT);
            return false;
        }

        Classification classification = hitClassifier.classify(message, EngagementEventType.OPEN, request);

        if (!counterStore.acquireOnce(OPEN_KEY_PREFIX + messageId, trackingProperties.getOpen().getCoalescingWindow())) {
            log.debug("Open for message {} coalesced into an earlier open", messageId);
            metricsService.recordSuppressed(TrackingMetricsService.REASON_DUPLICATE);
            return false;
        }

        eventPublisher.publishClientEvent(message, EngagementEventType.OPEN, null, request, classification);
        return true;
    }
}
