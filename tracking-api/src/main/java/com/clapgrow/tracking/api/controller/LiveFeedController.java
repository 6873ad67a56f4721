package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.broadcast.EventBroadcaster;
import com.clapgrow.tracking.api.broadcast.SseFrameSink;
import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.service.EngagementQueryService;
import com.clapgrow.tracking.api.service.ViewerPrincipal;
import com.clapgrow.tracking.api.service.ViewerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
@Tag(name = "Live feed", description = "Server-Sent Events stream of recorded events")
@SecurityRequirement(name = "viewerKey")
public class LiveFeedController {

    private final ViewerService viewerService;
    private final EngagementQueryService queryService;
    private final EventBroadcaster eventBroadcaster;
    private final TrackingProperties trackingProperties;

    @GetMapping("/live")
    @Operation(summary = "Subscribe to recorded events",
               description = "Streams engagement events of the viewer's tenant, optionally one campaign. "
                   + "The stream ends when the viewer is revoked.")
    public SseEmitter live(@RequestHeader(value = EngagementQueryController.VIEWER_KEY_HEADER, required = false) String viewerKey,
                           @RequestParam(required = false) String campaignId) {
        ViewerPrincipal viewer = viewerService.authenticate(viewerKey);
        if (campaignId != null) {
            queryService.requireCampaignAccess(viewer, campaignId);
        }

        SseEmitter emitter = new SseEmitter(trackingProperties.getBroadcast().getConnectionTimeout().toMillis());
        int handle = eventBroadcaster.subscribe(viewer, campaignId, new SseFrameSink(emitter));
        emitter.onCompletion(() -> eventBroadcaster.unsubscribe(handle));
        emitter.onTimeout(() -> eventBroadcaster.unsubscribe(handle));
        emitter.onError(e -> eventBroadcaster.unsubscribe(handle));
        return emitter;
    }
}
