package com.clapgrow.tracking.api.service;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ApiKeyServiceTest {

    private final ApiKeyService apiKeyService = new ApiKeyService(new BCryptPasswordEncoder(4));

    @Test
    void testGenerateApiKeyCarriesViewerId() {
        UUID viewerId = UUID.randomUUID();
        String apiKey = apiKeyService.generateApiKey(viewerId);

        assertTrue(apiKey.startsWith(viewerId + "."));
        assertEquals(viewerId, apiKeyService.extractViewerId(apiKey));
    }

    @Test
    void testGenerateUniqueApiKeys() {
        UUID viewerId = UUID.randomUUID();
        assertNotEquals(apiKeyService.generateApiKey(viewerId), apiKeyService.generateApiKey(viewerId));
    }

    @Test
    void testHashAndValidateApiKey() {
        String apiKey = apiKeyService.generateApiKey(UUID.randomUUID());
        String hash = apiKeyService.hashApiKey(apiKey);

        assertNotEquals(apiKey, hash);
        assertTrue(apiKeyService.validateApiKey(apiKey, hash));
        assertFalse(apiKeyService.validateApiKey("wrong-key", hash));
        assertFalse(apiKeyService.validateApiKey(null, hash));
    }

    @Test
    void testExtractViewerIdFromMalformedKey() {
        assertNull(apiKeyService.extractViewerId(null));
        assertNull(apiKeyService.extractViewerId("no-separator"));
        assertNull(apiKeyService.extractViewerId("not-a-uuid.secret"));
        assertNull(apiKeyService.extractViewerId(UUID.randomUUID() + "."));
    }
}
