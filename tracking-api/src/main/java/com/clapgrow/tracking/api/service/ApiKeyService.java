package com.clapgrow.tracking.api.service;

import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

/**
 * Issues and checks viewer keys.
 *
 * A key has the form {@code {viewerId}.{secret}}. The id part locates the viewer row
 * directly, so verification costs one lookup and one BCrypt comparison instead of a scan
 * over every stored hash. Only the BCrypt hash of the whole key is stored.
 */
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    private static final int SECRET_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final PasswordEncoder passwordEncoder;

    public String generateApiKey(UUID viewerId) {
        byte[] randomBytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return viewerId + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    public String hashApiKey(String apiKey) {
        return passwordEncoder.encode(apiKey);
    }

    public boolean validateApiKey(String rawApiKey, String hashedApiKey) {
        if (rawApiKey == null || hashedApiKey == null) {
            return false;
        }
        return passwordEncoder.matches(rawApiKey, hashedApiKey);
    }

    /**
     * Viewer id encoded in the key, or null when the key is not in {@code id.secret} form.
     */
    public UUID extractViewerId(String apiKey) {
        if (apiKey == null) {
            return null;
        }
        int dot = apiKey.indexOf('.');
        if (dot <= 0 || dot == apiKey.length() - 1) {
            return null;
        }
        try {
            return UUID.fromString(apiKey.substring(0, dot));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
