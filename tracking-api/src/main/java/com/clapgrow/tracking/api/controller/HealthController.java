package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.broadcast.EventBroadcaster;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    private final EventBroadcaster eventBroadcaster;

    @GetMapping("/health")
    @Operation(
            summary = "Health check",
            description = "Liveness of the tracking service with the number of connected live feed subscribers."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is up")
    })
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "tracking-api");
        response.put("liveSubscribers", eventBroadcaster.subscriberCount());
        return ResponseEntity.ok(response);
    }
}
