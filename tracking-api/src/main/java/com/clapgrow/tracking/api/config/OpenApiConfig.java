package com.clapgrow.tracking.api.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${tracking.public-api-url:http://localhost:8080}")
    private String publicApiUrl;

    @Bean
    public OpenAPI trackingApiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Engagement Tracking API")
                        .description("Open beacon and signed click redirect endpoints, message instrumentation, " +
                                "provider event ingestion, opt-outs, campaign engagement queries and the live event feed.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com")))
                .components(new Components()
                        .addSecuritySchemes("viewerKey", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Viewer-Key"))
                        .addSecuritySchemes("adminKey", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Admin-Key")))
                .servers(List.of(new Server().url(publicApiUrl).description("Tracking API")));
    }
}
