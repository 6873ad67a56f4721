package com.clapgrow.tracking.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${cors.allowed-methods:GET,POST,PUT,DELETE,OPTIONS}")
    private String[] allowedMethods;

    @Value("${cors.max-age:3600}")
    private long maxAge;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        boolean hasWildcard = Arrays.stream(allowedOrigins).anyMatch("*"::equals);

        // Dashboards read summaries and the live feed from the browser
        configureCors(registry.addMapping("/api/v1/tracking/**"), hasWildcard)
                .allowedHeaders("Content-Type", "X-Viewer-Key", "X-Admin-Key", "Last-Event-ID");
    }

    private CorsRegistration configureCors(CorsRegistration registration, boolean hasWildcard) {
        registration.allowedMethods(allowedMethods)
                .allowCredentials(true)
                .maxAge(maxAge);

        if (hasWildcard) {
            // allowedOrigins("*") is rejected together with credentials
            registration.allowedOriginPatterns("*");
        } else {
            registration.allowedOrigins(allowedOrigins);
        }
        return registration;
    }
}
