package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.dto.ApiResponse;
import com.clapgrow.tracking.api.dto.ProviderEventRequest;
import com.clapgrow.tracking.api.service.ProviderEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
@Tag(name = "Provider events", description = "Delivery provider webhooks")
public class ProviderEventController {

    private final ProviderEventService providerEventService;

    @PostMapping("/events")
    @Operation(summary = "Report a bounce, unsubscribe or complaint",
               description = "Recorded asynchronously. A recipient opt-out silently suppresses the event.")
    public ResponseEntity<ApiResponse<Map<String, Object>>> report(@Valid @RequestBody ProviderEventRequest request) {
        boolean forwarded = providerEventService.accept(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(Map.of("messageId", request.getMessageId(), "accepted", forwarded)));
    }
}
