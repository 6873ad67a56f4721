package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.classifier.Classification;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.exception.TrackingProtocolException;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Signed redirect handling.
 *
 * The signature decides the response and nothing else does: a valid pair redirects even when
 * the message is unknown, tracking is off or recording fails, and an invalid pair is refused
 * whether or not the message exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClickTrackingService {

    private final TrackingSignatureService signatureService;
    private final TrackingDirectoryService directoryService;
    private final OptOutService optOutService;
    private final TrackingHitClassifier hitClassifier;
    private final EngagementEventPublisher eventPublisher;
    private final TrackingMetricsService metricsService;

    /**
     * @throws TrackingProtocolException when a parameter is missing
     */
    public ClickOutcome handleClick(String messageId, String url, String sig, TrackingRequestInfo request) {
        requireParameter("messageId", messageId);
        requireParameter("url", url);
        requireParameter("sig", sig);

        if (!signatureService.verify(messageId, url, sig)) {
            metricsService.recordSignatureRejected();
            log.warn("Rejected click for message {} from {}: signature mismatch, possible tampering",
                messageId, request.sourceIp());
            return ClickOutcome.rejected();
        }

        try {
            track(messageId, url, request);
        } catch (Exception e) {
            log.error("Click tracking failed for message {}", messageId, e);
            metricsService.recordFailure(TrackingMetricsService.STAGE_PUBLISH);
        }
        return ClickOutcome.redirect(url);
    }

    private void track(String messageId, String url, TrackingRequestInfo request) {
        Optional<TrackedMessageView> found = directoryService.findMessage(messageId);
        if (found.isEmpty()) {
            log.debug("Signed click for unregistered message {}", messageId);
            metricsService.recordSuppressed(TrackingMetricsService.REASON_UNKNOWN_MESSAGE);
            return;
        }
        TrackedMessageView message = found.get();

        if (!directoryService.campaignFlags(message.campaignId()).clickTrackingEnabled()) {
            log.debug("Click tracking disabled for campaign {}", message.campaignId());
            metricsService.recordSuppressed(TrackingMetricsService.REASON_TRACKING_DISABLED);
            return;
        }
        if (optOutService.isSuppressed(message.recipientHash(), EngagementEventType.CLICK)) {
            log.debug("Recipient of message {} opted out of click tracking", messageId);
            metricsService.recordSuppressed(TrackingMetricsService.REASON_OPTED_OUT);
            return;
        }

        Classification classification = hitClassifier.classify(message, EngagementEventType.CLICK, request);
        eventPublisher.publishClientEvent(message, EngagementEventType.CLICK, url, request, classification);
    }

    private static void requireParameter(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new TrackingProtocolException("Missing required parameter: " + name);
        }
    }
}
