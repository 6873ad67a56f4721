package com.clapgrow.tracking.api.dto;

import com.clapgrow.tracking.common.event.EngagementEventType;

import java.io.Serializable;
import java.util.Set;

/**
 * Event types suppressed for one recipient hash. Empty when the recipient never opted out,
 * so "not suppressed" is cacheable as well.
 */
public record SuppressionView(Set<EngagementEventType> suppressedEventTypes) implements Serializable {

    public SuppressionView {
        suppressedEventTypes = suppressedEventTypes == null ? Set.of() : Set.copyOf(suppressedEventTypes);
    }

    public static SuppressionView none() {
        return new SuppressionView(Set.of());
    }

    public boolean suppresses(EngagementEventType eventType) {
        return suppressedEventTypes.contains(eventType);
    }
}
