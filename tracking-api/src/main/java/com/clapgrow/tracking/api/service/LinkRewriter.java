package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.TrackingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Instruments outbound HTML: every trackable anchor is pointed at the signed click
 * redirect and one open beacon is added.
 *
 * <p>Only the href value of rewritten anchors and the beacon insertion point change; all
 * other markup is copied through byte for byte. Anchors already pointing at the click
 * endpoint and an existing beacon are recognized, so rewriting twice gives the same output
 * as rewriting once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkRewriter {

    private static final Pattern ANCHOR_TAG = Pattern.compile("<a\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern HREF_ATTRIBUTE = Pattern.compile(
        "\\bhref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s\"'>]+))", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CLOSE = Pattern.compile("</body\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x[0-9a-fA-F]+|[0-9]+);");

    private final TrackingSignatureService signatureService;
    private final TrackingProperties trackingProperties;

    public String rewrite(String markup, String messageId) {
        if (markup == null) {
            throw new IllegalArgumentException("markup is required");
        }
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId is required");
        }
        String base = baseUrl();
        List<String> skipMarkers = trackingProperties.getRewriter().getSkipMarkers().stream()
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .toList();

        Matcher anchors = ANCHOR_TAG.matcher(markup);
        StringBuilder out = new StringBuilder(markup.length() + 256);
        int rewritten = 0;
        while (anchors.find()) {
            String tag = anchors.group();
            String replacement = rewriteAnchor(tag, messageId, base, skipMarkers);
            if (!replacement.equals(tag)) {
                rewritten++;
            }
            anchors.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        anchors.appendTail(out);

        String result = insertBeacon(out.toString(), messageId, base);
        log.debug("Instrumented message {}: {} links rewritten", messageId, rewritten);
        return result;
    }

    private String rewriteAnchor(String tag, String messageId, String base, List<String> skipMarkers) {
        String lowerTag = tag.toLowerCase(Locale.ROOT);
        for (String marker : skipMarkers) {
            if (lowerTag.contains(marker)) {
                return tag;
            }
        }

        Matcher href = HREF_ATTRIBUTE.matcher(tag);
        if (!href.find()) {
            return tag;
        }
        int valueGroup = href.group(1) != null ? 1 : href.group(2) != null ? 2 : 3;
        String destination = unescapeHtml(href.group(valueGroup)).trim();

        if (!isTrackable(destination) || destination.startsWith(base + "/click?")) {
            return tag;
        }

        String tracked = escapeAttribute(clickUrl(base, messageId, destination));
        String quote = valueGroup == 2 ? "'" : "\"";
        return tag.substring(0, href.start()) + "href=" + quote + tracked + quote + tag.substring(href.end());
    }

    private String insertBeacon(String markup, String messageId, String base) {
        if (markup.contains(base + "/open?messageId=")) {
            return markup;
        }
        String beacon = "<img src=\"" + escapeAttribute(openUrl(base, messageId)) + "\""
            + " width=\"1\" height=\"1\" alt=\"\" style=\"display:block;border:0;width:1px;height:1px\" />";

        int insertAt = -1;
        Matcher body = BODY_CLOSE.matcher(markup);
        while (body.find()) {
            insertAt = body.start();
        }
        if (insertAt < 0) {
            return markup + beacon;
        }
        return markup.substring(0, insertAt) + beacon + markup.substring(insertAt);
    }

    public String clickUrl(String base, String messageId, String destination) {
        return base + "/click?messageId=" + encode(messageId)
            + "&url=" + encode(destination)
            + "&sig=" + signatureService.sign(messageId, destination);
    }

    public String openUrl(String base, String messageId) {
        return base + "/open?messageId=" + encode(messageId) + "&t=" + signatureService.signOpen(messageId);
    }

    private String baseUrl() {
        String base = trackingProperties.getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static boolean isTrackable(String destination) {
        String lower = destination.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String escapeAttribute(String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;").replace("'", "&#39;");
    }

    static String unescapeHtml(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        Matcher numeric = NUMERIC_ENTITY.matcher(value);
        StringBuilder decoded = new StringBuilder(value.length());
        while (numeric.find()) {
            String code = numeric.group(1);
            String replacement;
            try {
                int codePoint = code.startsWith("x") || code.startsWith("X")
                    ? Integer.parseInt(code.substring(1), 16)
                    : Integer.parseInt(code);
                replacement = new String(Character.toChars(codePoint));
            } catch (IllegalArgumentException e) {
                // Out-of-range reference, keep it literally
                replacement = numeric.group();
            }
            numeric.appendReplacement(decoded, Matcher.quoteReplacement(replacement));
        }
        numeric.appendTail(decoded);
        // &amp; last so "&amp;lt;" stays "&lt;"
        return decoded.toString()
            .replace("&quot;", "\"")
            .replace("&apos;", "'")
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&amp;", "&");
    }
}
