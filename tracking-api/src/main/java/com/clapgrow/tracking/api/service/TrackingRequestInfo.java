package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.common.privacy.IpAddressTruncator;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Client facts of one beacon or redirect request. The source address is truncated as soon
 * as it is read; beyond this point the full address only exists as the keyed
 * {@code sourceKey}, which feeds the per-host rate counter and is never stored.
 */
public record TrackingRequestInfo(
    String sourceIp,
    String sourceKey,
    String userAgent,
    String referer,
    String acceptLanguage,
    Instant receivedAt
) {

    public static TrackingRequestInfo from(HttpServletRequest request, boolean trustForwardedFor, Instant receivedAt,
                                           UnaryOperator<String> addressHasher) {
        String address = null;
        if (trustForwardedFor) {
            address = firstForwardedAddress(request.getHeader("X-Forwarded-For"));
        }
        if (address == null || address.isBlank()) {
            address = request.getRemoteAddr();
        }
        return new TrackingRequestInfo(
            IpAddressTruncator.truncate(address),
            address == null ? null : addressHasher.apply(address),
            request.getHeader("User-Agent"),
            request.getHeader("Referer"),
            request.getHeader("Accept-Language"),
            receivedAt
        );
    }

    private static String firstForwardedAddress(String header) {
        if (header == null) {
            return null;
        }
        int comma = header.indexOf(',');
        return (comma < 0 ? header : header.substring(0, comma)).trim();
    }
}
