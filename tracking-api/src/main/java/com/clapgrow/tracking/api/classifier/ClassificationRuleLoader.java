package com.clapgrow.tracking.api.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the rule table from a Spring resource location (classpath:, file:, ...).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClassificationRuleLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    /**
     * @throws IOException when the resource is missing or is not a valid table
     */
    public ClassificationRuleSet load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Classification rules not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ClassificationRuleSet ruleSet = objectMapper.readValue(in, ClassificationRuleSet.class);
            log.debug("Parsed {} classification rules (version {}) from {}",
                ruleSet.size(), ruleSet.version(), location);
            return ruleSet;
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid classification rules at " + location + ": " + e.getMessage(), e);
        }
    }
}
