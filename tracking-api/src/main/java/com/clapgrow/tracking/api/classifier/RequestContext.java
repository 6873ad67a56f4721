package com.clapgrow.tracking.api.classifier;

import com.clapgrow.tracking.common.event.EngagementEventType;

import java.time.Duration;

/**
 * Everything the classifier may look at for one request.
 *
 * @param elapsedSinceSend null when the send time of the message is unknown
 * @param requestsInWindow requests seen from the same source network in the current rate
 *                         window, this one included
 */
public record RequestContext(
    String userAgent,
    String referer,
    EngagementEventType eventType,
    Duration elapsedSinceSend,
    long requestsInWindow
) {

    public boolean hasUserAgent() {
        return userAgent != null && !userAgent.isBlank();
    }
}
