package com.clapgrow.tracking.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * The plain key is only returned here; afterwards only its hash exists.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViewerRegistrationResponse {
    private UUID viewerId;
    private String tenantId;
    private String name;
    private String apiKey;
}
