package com.clapgrow.tracking.api.dto;

import com.clapgrow.tracking.common.event.EngagementEventType;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Set;

/**
 * Explicit opt-out. Give the raw address or its hash. An empty {@code eventTypes}
 * suppresses every event type.
 */
@Data
public class OptOutRequest {
    private String recipient;

    private String recipientHash;

    private Set<EngagementEventType> eventTypes;

    @Size(max = 50, message = "Source must not exceed 50 characters")
    private String source;
}
