package com.clapgrow.tracking.api.classifier;

import java.util.Locale;

/**
 * Coarse device and mail client detection from the User-Agent header.
 */
public final class UserAgentParser {

    public static final String UNKNOWN_CLIENT = "Unknown";

    private UserAgentParser() {
    }

    public record ClientInfo(String deviceType, String clientName) {
    }

    public static ClientInfo parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return new ClientInfo(null, UNKNOWN_CLIENT);
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);
        return new ClientInfo(deviceType(ua), clientName(ua));
    }

    private static String deviceType(String ua) {
        // iPad and Android tablets omit "mobile"; check tablets first
        if (ua.contains("ipad") || ua.contains("tablet")) {
            return "tablet";
        }
        if (ua.contains("mobile") || ua.contains("android") || ua.contains("iphone")) {
            return "mobile";
        }
        return "desktop";
    }

    private static String clientName(String ua) {
        if (ua.contains("outlook") || ua.contains("microsoft office")) {
            return "Outlook";
        }
        if (ua.contains("gmail") || ua.contains("googleimageproxy")) {
            return "Gmail";
        }
        if (ua.contains("yahoo")) {
            return "Yahoo Mail";
        }
        if (ua.contains("thunderbird")) {
            return "Thunderbird";
        }
        if (ua.contains("apple mail") || (ua.contains("applewebkit") && ua.contains("mac os x")
                && !ua.contains("safari"))) {
            return "Apple Mail";
        }
        return UNKNOWN_CLIENT;
    }
}
