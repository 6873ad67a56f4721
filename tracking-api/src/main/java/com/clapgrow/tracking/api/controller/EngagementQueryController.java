package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.dto.ApiResponse;
import com.clapgrow.tracking.api.dto.CampaignSummaryResponse;
import com.clapgrow.tracking.api.dto.EngagementAnalyticsResponse;
import com.clapgrow.tracking.api.dto.LinkStatsResponse;
import com.clapgrow.tracking.api.dto.TrackingEventResponse;
import com.clapgrow.tracking.api.service.EngagementQueryService;
import com.clapgrow.tracking.api.service.ViewerPrincipal;
import com.clapgrow.tracking.api.service.ViewerService;
import com.clapgrow.tracking.common.event.EngagementEventType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
@Tag(name = "Engagement", description = "Campaign engagement reads, scoped to the viewer's tenant")
@SecurityRequirement(name = "viewerKey")
public class EngagementQueryController {

    static final String VIEWER_KEY_HEADER = "X-Viewer-Key";

    private final ViewerService viewerService;
    private final EngagementQueryService queryService;

    @GetMapping("/campaigns/{campaignId}/summary")
    @Operation(summary = "Campaign totals and rates",
               description = "Served from the periodic rollup unless fresh=true.")
    public ResponseEntity<ApiResponse<CampaignSummaryResponse>> summary(
            @RequestHeader(value = VIEWER_KEY_HEADER, required = false) String viewerKey,
            @PathVariable String campaignId,
            @RequestParam(defaultValue = "false") boolean fresh) {
        ViewerPrincipal viewer = viewerService.authenticate(viewerKey);
        return ResponseEntity.ok(ApiResponse.success(queryService.summary(viewer, campaignId, fresh)));
    }

    @GetMapping("/campaigns/{campaignId}/links")
    @Operation(summary = "Clicks per destination link")
    public ResponseEntity<ApiResponse<List<LinkStatsResponse>>> links(
            @RequestHeader(value = VIEWER_KEY_HEADER, required = false) String viewerKey,
            @PathVariable String campaignId) {
        ViewerPrincipal viewer = viewerService.authenticate(viewerKey);
        return ResponseEntity.ok(ApiResponse.success(queryService.links(viewer, campaignId)));
    }

    @GetMapping("/campaigns/{campaignId}/events")
    @Operation(summary = "Campaign events, newest first")
    public ResponseEntity<Map<String, Object>> events(
            @RequestHeader(value = VIEWER_KEY_HEADER, required = false) String viewerKey,
            @PathVariable String campaignId,
            @RequestParam(required = false) EngagementEventType eventType,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        ViewerPrincipal viewer = viewerService.authenticate(viewerKey);
        Page<TrackingEventResponse> events = queryService.campaignEvents(viewer, campaignId, eventType, page, size);

        Map<String, Object> response = new HashMap<>();
        response.put("content", events.getContent());
        response.put("totalElements", events.getTotalElements());
        response.put("totalPages", events.getTotalPages());
        response.put("currentPage", events.getNumber());
        response.put("size", events.getSize());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/recipients/{recipientHash}/events")
    @Operation(summary = "Event history of one recipient")
    public ResponseEntity<ApiResponse<List<TrackingEventResponse>>> recipientEvents(
            @RequestHeader(value = VIEWER_KEY_HEADER, required = false) String viewerKey,
            @PathVariable String recipientHash,
            @RequestParam(defaultValue = "30") int daysBack) {
        ViewerPrincipal viewer = viewerService.authenticate(viewerKey);
        return ResponseEntity.ok(ApiResponse.success(queryService.recipientHistory(viewer, recipientHash, daysBack)));
    }

    @GetMapping("/analytics")
    @Operation(summary = "Event counts by type, device and day")
    public ResponseEntity<ApiResponse<EngagementAnalyticsResponse>> analytics(
            @RequestHeader(value = VIEWER_KEY_HEADER, required = false) String viewerKey,
            @RequestParam(required = false) String campaignId,
            @RequestParam(defaultValue = "7") int daysBack) {
        ViewerPrincipal viewer = viewerService.authenticate(viewerKey);
        return ResponseEntity.ok(ApiResponse.success(queryService.analytics(viewer, campaignId, daysBack)));
    }
}
