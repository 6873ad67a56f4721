package com.clapgrow.tracking.api.service;

/**
 * Result of a redirect request. Only a verified signature yields a location.
 */
public record ClickOutcome(boolean verified, String location) {

    public static ClickOutcome redirect(String location) {
        return new ClickOutcome(true, location);
    }

    public static ClickOutcome rejected() {
        return new ClickOutcome(false, null);
    }
}
