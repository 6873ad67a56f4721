package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.TrackingProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Keyed hash of recipient addresses. Addresses are trimmed and lower-cased first so one
 * mailbox always maps to one identifier. The raw address is never stored or logged.
 *
 * <p>The same key also hashes client source addresses for the per-host rate counter.
 */
@Component
public class RecipientHasher {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SOURCE_ADDRESS_DOMAIN = "source-address\n";

    private final SecretKeySpec key;
    private final int liveFeedLength;

    public RecipientHasher(TrackingProperties trackingProperties) {
        String configured = trackingProperties.getPrivacy().getRecipientHashKey();
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("tracking.privacy.recipient-hash-key must be configured");
        }
        this.key = new SecretKeySpec(configured.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.liveFeedLength = trackingProperties.getPrivacy().getLiveFeedHashLength();
    }

    /**
     * @return 64 lowercase hex characters
     */
    public String hash(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient is required");
        }
        return hmacHex(recipient.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Keyed hash of a full client address, used only as a counter key. Separated from
     * recipient hashes by a domain prefix.
     *
     * @return 64 lowercase hex characters, or null when there is no address
     */
    public String hashSourceAddress(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return hmacHex(SOURCE_ADDRESS_DOMAIN + address.trim().toLowerCase(Locale.ROOT));
    }

    private String hmacHex(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * Prefix of a stored hash, enough to tell recipients apart on a dashboard.
     */
    public String truncateForLiveFeed(String recipientHash) {
        if (recipientHash == null) {
            return null;
        }
        return recipientHash.length() <= liveFeedLength ? recipientHash : recipientHash.substring(0, liveFeedLength);
    }

    public static boolean isHash(String value) {
        return value != null && value.matches("[0-9a-f]{64}");
    }
}
