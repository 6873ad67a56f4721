package com.clapgrow.tracking.common.event;

/**
 * Kind of engagement signal recorded for a tracked message.
 *
 * OPEN and CLICK are observed directly by the beacon and redirect endpoints.
 * BOUNCE, UNSUBSCRIBE and COMPLAINT are reported by the delivery provider
 * through the event webhook.
 */
public enum EngagementEventType {
    OPEN,
    CLICK,
    BOUNCE,
    UNSUBSCRIBE,
    COMPLAINT;

    /**
     * Whether the event can only originate from the delivery provider
     * (never from a recipient's client hitting our endpoints).
     */
    public boolean isProviderReported() {
        return this == BOUNCE || this == UNSUBSCRIBE || this == COMPLAINT;
    }

    /**
     * CLICK is the only event type that carries a destination URL.
     */
    public boolean requiresUrl() {
        return this == CLICK;
    }
}
