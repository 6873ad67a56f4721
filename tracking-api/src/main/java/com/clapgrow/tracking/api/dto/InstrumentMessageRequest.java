package com.clapgrow.tracking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

/**
 * Send-time registration of one outbound message. Either the raw recipient address or an
 * already computed recipient hash must be given; a raw address is hashed on arrival.
 */
@Data
public class InstrumentMessageRequest {
    @NotBlank(message = "Campaign ID is required")
    @Size(max = 100, message = "Campaign ID must not exceed 100 characters")
    private String campaignId;

    @NotBlank(message = "Tenant ID is required")
    @Size(max = 100, message = "Tenant ID must not exceed 100 characters")
    private String tenantId;

    private String recipient;

    private String recipientHash;

    private Instant sentAt;

    @NotBlank(message = "HTML body is required")
    private String html;
}
