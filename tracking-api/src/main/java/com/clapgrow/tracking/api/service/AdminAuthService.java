package com.clapgrow.tracking.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the operator key used on viewer management, classifier reload and manual
 * retention runs.
 */
@Service
@Slf4j
public class AdminAuthService {

    private final byte[] configuredAdminKey;

    public AdminAuthService(@Value("${admin.api-key:}") String adminApiKey) {
        if (adminApiKey != null && !adminApiKey.trim().isEmpty()) {
            this.configuredAdminKey = adminApiKey.getBytes(StandardCharsets.UTF_8);
        } else {
            this.configuredAdminKey = null;
            log.warn("Admin API key is not configured. Admin endpoints will be inaccessible.");
        }
    }

    public void validateAdminKey(String providedKey) {
        if (configuredAdminKey == null) {
            throw new SecurityException("Admin API key is not configured");
        }
        if (providedKey == null || providedKey.trim().isEmpty()) {
            throw new SecurityException("Admin API key is required");
        }
        if (!MessageDigest.isEqual(providedKey.getBytes(StandardCharsets.UTF_8), configuredAdminKey)) {
            throw new SecurityException("Invalid admin API key");
        }
    }
}
