package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.dto.ApiResponse;
import com.clapgrow.tracking.api.dto.OptOutRequest;
import com.clapgrow.tracking.api.dto.OptOutResponse;
import com.clapgrow.tracking.api.entity.OptOutRecord;
import com.clapgrow.tracking.api.service.InstrumentationService;
import com.clapgrow.tracking.api.service.OptOutService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tracking")
@RequiredArgsConstructor
@Tag(name = "Opt-outs", description = "Explicit recipient opt-outs")
public class OptOutController {

    private static final String DEFAULT_SOURCE = "api";

    private final OptOutService optOutService;
    private final InstrumentationService instrumentationService;

    @PostMapping("/opt-outs")
    @Operation(summary = "Record an opt-out",
               description = "Takes the raw address or its hash. Without event types every type is suppressed.")
    public ResponseEntity<ApiResponse<OptOutResponse>> optOut(@Valid @RequestBody OptOutRequest request) {
        String recipientHash = instrumentationService.resolveRecipientHash(request.getRecipient(), request.getRecipientHash());
        OptOutRecord record = optOutService.recordOptOut(recipientHash, request.getEventTypes(),
            request.getSource() != null ? request.getSource() : DEFAULT_SOURCE);
        return ResponseEntity.ok(ApiResponse.success(
            new OptOutResponse(record.getRecipientHash(), record.suppressedCopy(), record.getOptedOutAt())));
    }
}
