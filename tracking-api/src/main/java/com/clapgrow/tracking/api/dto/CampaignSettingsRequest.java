package com.clapgrow.tracking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CampaignSettingsRequest {
    @NotBlank(message = "Tenant ID is required")
    private String tenantId;

    @NotNull(message = "openTrackingEnabled is required")
    private Boolean openTrackingEnabled;

    @NotNull(message = "clickTrackingEnabled is required")
    private Boolean clickTrackingEnabled;
}
