package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.TrackingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Tamper-evident tokens binding a message id to a destination.
 *
 * <p>token = base64url(truncate(HMAC-SHA256(key, messageId + "\n" + url), 16 bytes)), no padding.
 * The newline cannot appear in a message id, so two different pairs never produce the
 * same MAC input. 128 bits keep the tracked URL short while leaving forgery out of reach.
 *
 * <p>Rotation: new tokens always use the current key. Verification also accepts the
 * previous key until its configured deadline, so links already delivered keep working
 * through a rotation.
 */
@Service
@Slf4j
public class TrackingSignatureService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    /** Destination value signed for open beacons. */
    public static final String OPEN_TARGET = "OPEN";

    private final SecretKeySpec currentKey;
    private final SecretKeySpec previousKey;
    private final Instant previousKeyValidUntil;
    private final int truncatedBytes;
    private final Clock clock;

    public TrackingSignatureService(TrackingProperties trackingProperties, Clock clock) {
        TrackingProperties.Signature signature = trackingProperties.getSignature();
        if (signature.getCurrentKey() == null || signature.getCurrentKey().isBlank()) {
            throw new IllegalStateException("tracking.signature.current-key must be configured");
        }
        if (signature.getTruncatedBytes() < 8 || signature.getTruncatedBytes() > 32) {
            throw new IllegalStateException("tracking.signature.truncated-bytes must be between 8 and 32");
        }
        this.currentKey = keySpec(signature.getCurrentKey());
        this.truncatedBytes = signature.getTruncatedBytes();
        this.clock = clock;

        if (signature.getPreviousKey() != null && !signature.getPreviousKey().isBlank()) {
            this.previousKey = keySpec(signature.getPreviousKey());
            this.previousKeyValidUntil = parseDeadline(signature.getPreviousKeyValidUntil());
            log.info("Previous signature key accepted until {}", previousKeyValidUntil);
        } else {
            this.previousKey = null;
            this.previousKeyValidUntil = null;
        }
    }

    public String sign(String messageId, String url) {
        requireInputs(messageId, url);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(mac(currentKey, messageId, url));
    }

    public String signOpen(String messageId) {
        return sign(messageId, OPEN_TARGET);
    }

    /**
     * Constant-time check of {@code token} against the current key and, within its grace
     * period, the previous key. Malformed tokens simply fail.
     */
    public boolean verify(String messageId, String url, String token) {
        if (messageId == null || url == null || token == null || token.isEmpty()) {
            return false;
        }
        byte[] provided;
        try {
            provided = Base64.getUrlDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (provided.length != truncatedBytes) {
            return false;
        }

        boolean valid = MessageDigest.isEqual(provided, mac(currentKey, messageId, url));
        if (previousKey != null && clock.instant().isBefore(previousKeyValidUntil)) {
            // Both keys are always computed so timing does not reveal which one matched
            valid |= MessageDigest.isEqual(provided, mac(previousKey, messageId, url));
        }
        return valid;
    }

    public boolean verifyOpen(String messageId, String token) {
        return verify(messageId, OPEN_TARGET, token);
    }

    private byte[] mac(SecretKeySpec key, String messageId, String url) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            byte[] full = mac.doFinal((messageId + "\n" + url).getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(full, truncatedBytes);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static void requireInputs(String messageId, String url) {
        if (messageId == null || messageId.isEmpty()) {
            throw new IllegalArgumentException("messageId is required");
        }
        if (messageId.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("messageId must not contain a newline");
        }
        if (url == null) {
            throw new IllegalArgumentException("url is required");
        }
    }

    private static SecretKeySpec keySpec(String key) {
        return new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    private static Instant parseDeadline(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(
                "tracking.signature.previous-key-valid-until is required when a previous key is configured");
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid tracking.signature.previous-key-valid-until: " + value, e);
        }
    }
}
