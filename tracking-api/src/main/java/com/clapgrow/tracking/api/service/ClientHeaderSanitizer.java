package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.common.event.EngagementEventMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the stored client header subset: only configured headers, control characters
 * removed, length capped, and the Referer reduced to scheme, host and path so query strings
 * (which may carry addresses or tokens) are not kept.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClientHeaderSanitizer {

    private final TrackingProperties trackingProperties;
    private final ObjectMapper objectMapper;

    /**
     * @return JSON object of kept headers, or null when there is nothing to keep
     */
    public String sanitize(EngagementEventMessage event) {
        Map<String, String> available = new LinkedHashMap<>();
        available.put("user-agent", event.userAgent());
        available.put("referer", stripQuery(event.referer()));
        available.put("accept-language", event.acceptLanguage());

        int maxLength = trackingProperties.getPrivacy().getMaxHeaderLength();
        Map<String, String> kept = new LinkedHashMap<>();
        for (String header : trackingProperties.getPrivacy().getKeptHeaders()) {
            String value = available.get(header.toLowerCase(Locale.ROOT));
            if (value == null) {
                continue;
            }
            String clean = value.replaceAll("\\p{Cntrl}", "").trim();
            if (clean.isEmpty()) {
                continue;
            }
            kept.put(header, clean.length() > maxLength ? clean.substring(0, maxLength) : clean);
        }
        if (kept.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(kept);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize client headers for message {}; storing none", event.messageId());
            return null;
        }
    }

    static String stripQuery(String referer) {
        if (referer == null) {
            return null;
        }
        int cut = referer.length();
        int query = referer.indexOf('?');
        int fragment = referer.indexOf('#');
        if (query >= 0) {
            cut = query;
        }
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        return referer.substring(0, cut);
    }
}
