package com.clapgrow.tracking.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed settings for the tracking engine.
 *
 * Maps to:
 * tracking:
 *   base-url: https://t.example.com/tracking
 *   signature:
 *     current-key: ...
 *   open:
 *     coalescing-window: 60s
 *   ...
 */
@Configuration
@ConfigurationProperties(prefix = "tracking")
@Data
public class TrackingProperties {

    /**
     * Public base of the tracking routes, without trailing slash. Rewritten links become
     * {baseUrl}/click?... and beacons {baseUrl}/open?...
     */
    private String baseUrl = "http://localhost:8080/tracking";

    private Signature signature = new Signature();
    private Rewriter rewriter = new Rewriter();
    private Open open = new Open();
    private Classifier classifier = new Classifier();
    private Counters counters = new Counters();
    private Privacy privacy = new Privacy();
    private Broadcast broadcast = new Broadcast();
    private Retention retention = new Retention();
    private Rollup rollup = new Rollup();
    private Kafka kafka = new Kafka();

    @Data
    public static class Signature {
        /**
         * Active MAC key. Every new token is signed with it.
         */
        private String currentKey;

        /**
         * Key that was active before the last rotation. Accepted for verification only,
         * and only until {@link #previousKeyValidUntil}.
         */
        private String previousKey;

        /**
         * ISO-8601 instant after which {@link #previousKey} is no longer accepted.
         */
        private String previousKeyValidUntil;

        /**
         * Bytes of the MAC kept in the token. 16 bytes = 22 base64url characters.
         */
        private int truncatedBytes = 16;
    }

    @Data
    public static class Rewriter {
        /**
         * Case-insensitive markers that exclude an anchor from rewriting when they appear
         * anywhere in the anchor tag (attributes included).
         */
        private List<String> skipMarkers = new ArrayList<>(List.of(
            "data-unsubscribe", "data-no-track", "{{unsubscribe_url}}", "list-unsubscribe"));
    }

    @Data
    public static class Open {
        /**
         * Repeat OPEN hits for one message inside this window are merged into one event.
         */
        private Duration coalescingWindow = Duration.ofSeconds(60);

        /**
         * When true, a beacon hit whose t parameter does not verify is answered but not recorded.
         */
        private boolean requireToken = true;
    }

    @Data
    public static class Classifier {
        /**
         * Spring resource location of the ordered rule table (JSON).
         */
        private String rulesLocation = "classpath:classification-rules.json";

        /**
         * Fixed delay between rule table reloads. Zero disables the periodic reload.
         */
        private Duration reloadInterval = Duration.ofMinutes(5);

        /**
         * Window used for the per-source-IP request counter fed to RATE rules.
         */
        private Duration rateWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class Counters {
        /**
         * redis (shared across instances) or memory (single node, tests).
         */
        private String store = "redis";

        private String keyPrefix = "tracking:";
    }

    @Data
    public static class Privacy {
        /**
         * Key for the recipient identifier hash. Changing it breaks the link between
         * existing events and opt-outs, so it is not rotated with the signature key.
         */
        private String recipientHashKey;

        /**
         * Characters of the recipient hash exposed on the live feed.
         */
        private int liveFeedHashLength = 12;

        /**
         * Client headers kept (sanitized and truncated) on stored events.
         */
        private List<String> keptHeaders = new ArrayList<>(List.of("User-Agent", "Referer", "Accept-Language"));

        private int maxHeaderLength = 256;
    }

    @Data
    public static class Broadcast {
        /**
         * Size of the subscriber table. Connections beyond it are refused.
         */
        private int maxSubscribers = 1024;

        /**
         * Frames buffered per subscriber; the oldest frame is dropped on overflow.
         */
        private int queueCapacity = 256;

        /**
         * SSE emitter timeout.
         */
        private Duration connectionTimeout = Duration.ofMinutes(30);

        private Duration rosterRefreshInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Retention {
        private boolean enabled = true;

        private String cron = "0 30 3 * * *";

        /**
         * Events older than this lose source address and client headers.
         */
        private Duration anonymizeAfter = Duration.ofDays(30);

        /**
         * Events older than this are archived to cold storage and deleted.
         */
        private Duration rawRetention = Duration.ofDays(395);

        /**
         * Lower bound on the distance between now and the processed range. Raised to the
         * coalescing window if configured smaller.
         */
        private Duration safetyMargin = Duration.ofHours(1);

        private int batchSize = 500;

        private String archiveDir = "archive";
    }

    @Data
    public static class Rollup {
        private Duration refreshInterval = Duration.ofMinutes(5);

        /**
         * Campaigns with events newer than this are refreshed on each pass.
         */
        private Duration activeLookback = Duration.ofDays(7);
    }

    @Data
    public static class Kafka {
        private String eventsTopic = "tracking-events";

        private String groupId = "tracking-recorder";

        private String environmentPrefix;

        private int maxPollRecords = 100;
    }
}
