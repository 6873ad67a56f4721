package com.clapgrow.tracking.api.support;

import com.clapgrow.tracking.api.config.TrackingProperties;

public final class TestTrackingProperties {

    public static final String BASE_URL = "https://t.example.com/tracking";
    public static final String SIGNATURE_KEY = "test-signature-key-0123456789abcdef";
    public static final String RECIPIENT_KEY = "test-recipient-hash-key";

    private TestTrackingProperties() {
    }

    public static TrackingProperties create() {
        TrackingProperties properties = new TrackingProperties();
        properties.setBaseUrl(BASE_URL);
        properties.getSignature().setCurrentKey(SIGNATURE_KEY);
        properties.getPrivacy().setRecipientHashKey(RECIPIENT_KEY);
        return properties;
    }
}
