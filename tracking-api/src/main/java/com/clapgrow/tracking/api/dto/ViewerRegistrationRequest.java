package com.clapgrow.tracking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ViewerRegistrationRequest {
    @NotBlank(message = "Tenant ID is required")
    @Size(max = 100, message = "Tenant ID must not exceed 100 characters")
    private String tenantId;

    @NotBlank(message = "Viewer name is required")
    @Size(max = 255, message = "Viewer name must not exceed 255 characters")
    private String name;
}
