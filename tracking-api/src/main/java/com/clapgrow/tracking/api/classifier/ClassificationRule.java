package com.clapgrow.tracking.api.classifier;

import com.clapgrow.tracking.api.enums.ClientLabel;
import com.clapgrow.tracking.common.event.EngagementEventType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One row of the classification table.
 *
 * <pre>
 * { "name": "fast-open", "kind": "TIMING", "label": "bot", "confidence": 0.6,
 *   "maxElapsed": "PT5S", "eventTypes": ["OPEN"] }
 * </pre>
 *
 * Only the parameters of the rule's kind are read; {@code eventTypes} restricts the rule to
 * some event types and applies to every kind (empty means all).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationRule(
    String name,
    RuleKind kind,
    ClientLabel label,
    double confidence,
    List<String> patterns,
    Duration maxElapsed,
    Long maxRequests,
    Set<EngagementEventType> eventTypes
) {

    public ClassificationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Rule " + name + " has no kind");
        }
        if (label == null) {
            throw new IllegalArgumentException("Rule " + name + " has no label");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Rule " + name + " confidence out of range: " + confidence);
        }
        switch (kind) {
            case USER_AGENT_MATCH -> {
                if (patterns == null || patterns.isEmpty()) {
                    throw new IllegalArgumentException("Rule " + name + " needs at least one pattern");
                }
                patterns = patterns.stream()
                    .filter(p -> p != null && !p.isBlank())
                    .map(p -> p.toLowerCase(Locale.ROOT))
                    .toList();
            }
            case TIMING -> {
                if (maxElapsed == null || maxElapsed.isNegative() || maxElapsed.isZero()) {
                    throw new IllegalArgumentException("Rule " + name + " needs a positive maxElapsed");
                }
            }
            case RATE -> {
                if (maxRequests == null || maxRequests <= 0) {
                    throw new IllegalArgumentException("Rule " + name + " needs a positive maxRequests");
                }
            }
        }
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    boolean appliesTo(EngagementEventType eventType) {
        return eventTypes.isEmpty() || eventTypes.contains(eventType);
    }

    boolean matches(RequestContext context) {
        if (!appliesTo(context.eventType())) {
            return false;
        }
        return switch (kind) {
            case USER_AGENT_MATCH -> {
                if (!context.hasUserAgent()) {
                    yield false;
                }
                String userAgent = context.userAgent().toLowerCase(Locale.ROOT);
                yield patterns.stream().anyMatch(userAgent::contains);
            }
            // Negative elapsed means the send timestamp is ahead of our clock; treat as immediate
            case TIMING -> context.elapsedSinceSend() != null
                && context.elapsedSinceSend().compareTo(maxElapsed) < 0;
            case RATE -> context.requestsInWindow() > maxRequests;
        };
    }
}
