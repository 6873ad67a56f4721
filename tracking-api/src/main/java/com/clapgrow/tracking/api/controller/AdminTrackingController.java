package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.annotation.AdminApi;
import com.clapgrow.tracking.api.annotation.RequireAdminAuth;
import com.clapgrow.tracking.api.classifier.ClassificationRuleSet;
import com.clapgrow.tracking.api.classifier.ClientClassifier;
import com.clapgrow.tracking.api.dto.ApiResponse;
import com.clapgrow.tracking.api.dto.RetentionRunResponse;
import com.clapgrow.tracking.api.dto.ViewerRegistrationRequest;
import com.clapgrow.tracking.api.dto.ViewerRegistrationResponse;
import com.clapgrow.tracking.api.retention.RetentionService;
import com.clapgrow.tracking.api.service.ViewerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Operator endpoints. Every handler requires the admin key.
 */
@RestController
@RequestMapping("/api/v1/tracking/admin")
@RequiredArgsConstructor
@Slf4j
@AdminApi
@Tag(name = "Admin", description = "Viewer credentials, classifier rules and retention")
@SecurityRequirement(name = "adminKey")
public class AdminTrackingController {

    private final ViewerService viewerService;
    private final ClientClassifier clientClassifier;
    private final RetentionService retentionService;

    @PostMapping("/viewers")
    @RequireAdminAuth
    @Operation(summary = "Create a viewer", description = "The key in the response is not retrievable later.")
    public ResponseEntity<ApiResponse<ViewerRegistrationResponse>> registerViewer(
            @Valid @RequestBody ViewerRegistrationRequest request) {
        ViewerRegistrationResponse response = viewerService.register(request.getTenantId(), request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @DeleteMapping("/viewers/{viewerId}")
    @RequireAdminAuth
    @Operation(summary = "Revoke a viewer", description = "Open live feed connections of the viewer are closed.")
    public ResponseEntity<ApiResponse<Void>> revokeViewer(@PathVariable UUID viewerId) {
        viewerService.revoke(viewerId);
        return ResponseEntity.ok(ApiResponse.successEmpty());
    }

    @PostMapping("/classifier/reload")
    @RequireAdminAuth
    @Operation(summary = "Reload the classification rule table")
    public ResponseEntity<ApiResponse<Map<String, Object>>> reloadClassifier() {
        boolean reloaded = clientClassifier.reload();
        ClassificationRuleSet rules = clientClassifier.currentRules();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reloaded", reloaded);
        body.put("version", rules.version());
        body.put("rules", rules.size());
        if (!reloaded) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiResponse<>(false, body, "Rule table could not be loaded; previous table kept"));
        }
        return ResponseEntity.ok(ApiResponse.success(body));
    }

    @PostMapping("/retention/run")
    @RequireAdminAuth
    @Operation(summary = "Run retention now", description = "Same work as the scheduled run. 409 while a run is in progress.")
    public ResponseEntity<ApiResponse<RetentionRunResponse>> runRetention() {
        log.info("Retention run requested through admin API");
        return ResponseEntity.ok(ApiResponse.success(retentionService.runRetention()));
    }
}
