package com.clapgrow.tracking.api.dto;

import com.clapgrow.tracking.common.event.EngagementEventType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

/**
 * Delivery provider callback: BOUNCE, UNSUBSCRIBE or COMPLAINT for a registered message.
 */
@Data
public class ProviderEventRequest {
    @NotBlank(message = "Message ID is required")
    private String messageId;

    @NotNull(message = "Event type is required")
    private EngagementEventType eventType;

    private Instant occurredAt;

    @Size(max = 50, message = "Provider must not exceed 50 characters")
    private String provider;
}
