package com.clapgrow.tracking.api.controller;

import com.clapgrow.tracking.api.service.BeaconTrackingService;
import com.clapgrow.tracking.api.service.ClickOutcome;
import com.clapgrow.tracking.api.service.ClickTrackingService;
import com.clapgrow.tracking.api.service.RecipientHasher;
import com.clapgrow.tracking.api.service.TrackingRequestInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Base64;

/**
 * Public endpoints hit by mail clients: the open beacon and the signed click redirect.
 */
@RestController
@RequestMapping("/tracking")
@Tag(name = "Tracking", description = "Open beacon and click redirect endpoints embedded in outbound mail")
public class TrackingController {

    /** Transparent 1x1 PNG. */
    static final byte[] PIXEL = Base64.getDecoder().decode(
        "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAQAAAC1HAwCAAAAC0lEQVR42mNkYAAAAAYAAjCB0C8AAAAASUVORK5CYII=");

    private final BeaconTrackingService beaconTrackingService;
    private final ClickTrackingService clickTrackingService;
    private final RecipientHasher recipientHasher;
    private final Clock clock;
    private final boolean trustForwardedFor;

    public TrackingController(BeaconTrackingService beaconTrackingService,
                              ClickTrackingService clickTrackingService,
                              RecipientHasher recipientHasher,
                              Clock clock,
                              @Value("${tracking.trust-forwarded-for:false}") boolean trustForwardedFor) {
        this.beaconTrackingService = beaconTrackingService;
        this.clickTrackingService = clickTrackingService;
        this.recipientHasher = recipientHasher;
        this.clock = clock;
        this.trustForwardedFor = trustForwardedFor;
    }

    @GetMapping("/open")
    @Operation(
            summary = "Open beacon",
            description = "Always returns the same transparent image. Whether the open was recorded is not observable."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "1x1 PNG")
    })
    public ResponseEntity<byte[]> open(@RequestParam(required = false) String messageId,
                                       @RequestParam(name = "t", required = false) String token,
                                       HttpServletRequest request) {
        beaconTrackingService.handleOpen(messageId, token, requestInfo(request));
        return ResponseEntity.ok()
            .contentType(MediaType.IMAGE_PNG)
            .cacheControl(CacheControl.noStore())
            .body(PIXEL);
    }

    @GetMapping("/click")
    @Operation(
            summary = "Signed click redirect",
            description = "Redirects to url when sig was issued for exactly this messageId and url."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "302", description = "Redirect to the destination"),
            @ApiResponse(responseCode = "400", description = "A parameter is missing"),
            @ApiResponse(responseCode = "403", description = "Signature does not match")
    })
    public ResponseEntity<Void> click(@RequestParam(required = false) String messageId,
                                      @RequestParam(required = false) String url,
                                      @RequestParam(required = false) String sig,
                                      HttpServletRequest request) {
        ClickOutcome outcome = clickTrackingService.handleClick(messageId, url, sig, requestInfo(request));
        if (!outcome.verified()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        return ResponseEntity.status(HttpStatus.FOUND)
            .header(HttpHeaders.LOCATION, outcome.location())
            .cacheControl(CacheControl.noStore())
            .build();
    }

    private TrackingRequestInfo requestInfo(HttpServletRequest request) {
        return TrackingRequestInfo.from(request, trustForwardedFor, clock.instant(), recipientHasher::hashSourceAddress);
    }
}
