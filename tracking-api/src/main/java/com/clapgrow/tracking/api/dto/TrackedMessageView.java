package com.clapgrow.tracking.api.dto;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Cached projection of a registered message.
 */
public record TrackedMessageView(
    String messageId,
    String campaignId,
    String tenantId,
    String recipientHash,
    LocalDateTime sentAt
) implements Serializable {
}
