package com.clapgrow.tracking.api.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classifier verdict for a single tracking request.
 */
public enum ClientLabel {
    HUMAN("human", false),
    BOT("bot", true),
    PRIVACY_PROXY("privacy-proxy", true),
    UNKNOWN("unknown", false);

    private final String wireName;
    private final boolean automated;

    ClientLabel(String wireName, boolean automated) {
        this.wireName = wireName;
        this.automated = automated;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Automated traffic is stored and counted in raw totals but excluded from
     * confirmed-human rates.
     */
    public boolean isAutomated() {
        return automated;
    }

    @JsonCreator
    public static ClientLabel fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Label is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ClientLabel label : values()) {
            if (label.wireName.equals(normalized) || label.name().equalsIgnoreCase(normalized)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown client label: " + value);
    }
}
