package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.dto.ApiResponse;
import com.clapgrow.tracking.api.dto.CampaignFlagsView;
import com.clapgrow.tracking.api.dto.CampaignSettingsRequest;
import com.clapgrow.tracking.api.dto.InstrumentMessageRequest;
import com.clapgrow.tracking.api.dto.InstrumentMessageResponse;
import com.clapgrow.tracking.api.service.InstrumentationService;
import com.clapgrow.tracking.api.service.TrackingDirectoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hooks for the sending pipeline and campaign management.
 */
@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
@Tag(name = "Instrumentation", description = "Send-time message registration and campaign tracking flags")
public class InstrumentationController {

    private final InstrumentationService instrumentationService;
    private final TrackingDirectoryService directoryService;

    @PostMapping("/messages/{messageId}/instrument")
    @Operation(summary = "Register a message and rewrite its markup",
               description = "Links become signed redirects and one open beacon is added. Safe to call again.")
    public ResponseEntity<ApiResponse<InstrumentMessageResponse>> instrument(
            @PathVariable String messageId,
            @Valid @RequestBody InstrumentMessageRequest request) {
        return ResponseEntity.ok(ApiResponse.success(instrumentationService.instrument(messageId, request)));
    }

    @PutMapping("/campaigns/{campaignId}/settings")
    @Operation(summary = "Set campaign tracking flags")
    public ResponseEntity<ApiResponse<CampaignFlagsView>> updateSettings(
            @PathVariable String campaignId,
            @Valid @RequestBody CampaignSettingsRequest request) {
        CampaignFlagsView flags = directoryService.upsertCampaignSettings(campaignId, request.getTenantId(),
            request.getOpenTrackingEnabled(), request.getClickTrackingEnabled());
        return ResponseEntity.ok(ApiResponse.success(flags));
    }
}
