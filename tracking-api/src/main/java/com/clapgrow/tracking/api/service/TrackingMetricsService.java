package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.enums.ClientLabel;
import com.clapgrow.tracking.common.event.EngagementEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Prometheus metrics for the tracking engine, exposed at /actuator/prometheus.
 *
 * Every meter is registered once in {@link #init()} and looked up from a map afterwards;
 * nothing is built on the request path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingMetricsService {

    public static final String STAGE_PUBLISH = "publish";
    public static final String STAGE_PERSIST = "persist";
    public static final String STAGE_DECODE = "decode";

    public static final String REASON_DUPLICATE = "duplicate";
    public static final String REASON_OPTED_OUT = "opted_out";
    public static final String REASON_TRACKING_DISABLED = "tracking_disabled";
    public static final String REASON_UNKNOWN_MESSAGE = "unknown_message";
    public static final String REASON_INVALID_TOKEN = "invalid_token";

    private static final String[] STAGES = {STAGE_PUBLISH, STAGE_PERSIST, STAGE_DECODE};
    private static final String[] REASONS = {
        REASON_DUPLICATE, REASON_OPTED_OUT, REASON_TRACKING_DISABLED, REASON_UNKNOWN_MESSAGE, REASON_INVALID_TOKEN
    };

    private final MeterRegistry meterRegistry;

    private final Map<EngagementEventType, Counter> recordedHuman = new EnumMap<>(EngagementEventType.class);
    private final Map<EngagementEventType, Counter> recordedAutomated = new EnumMap<>(EngagementEventType.class);
    private final Map<ClientLabel, Counter> labelCounters = new EnumMap<>(ClientLabel.class);
    private final Map<String, Counter> suppressedCounters = new HashMap<>();
    private final Map<String, Counter> failureCounters = new HashMap<>();

    private Counter signatureRejected;
    private Counter broadcastDropped;
    private Counter retentionArchived;
    private Counter retentionDeleted;
    private Counter retentionAnonymized;
    private Counter retentionFailures;
    private Timer ingestLatency;

    @PostConstruct
    void init() {
        for (EngagementEventType type : EngagementEventType.values()) {
            recordedHuman.put(type, Counter.builder("tracking.events.recorded")
                .description("Engagement events persisted")
                .tag("eventType", type.name())
                .tag("automated", "false")
                .register(meterRegistry));
            recordedAutomated.put(type, Counter.builder("tracking.events.recorded")
                .description("Engagement events persisted")
                .tag("eventType", type.name())
                .tag("automated", "true")
                .register(meterRegistry));
        }

        for (ClientLabel label : ClientLabel.values()) {
            labelCounters.put(label, Counter.builder("tracking.classifier.label")
                .description("Classifier verdicts")
                .tag("label", label.wireName())
                .register(meterRegistry));
        }

        for (String reason : REASONS) {
            suppressedCounters.put(reason, Counter.builder("tracking.events.suppressed")
                .description("Tracking hits answered without recording an event")
                .tag("reason", reason)
                .register(meterRegistry));
        }

        for (String stage : STAGES) {
            failureCounters.put(stage, Counter.builder("tracking.recording.failures")
                .description("Events lost or delayed by a publish/persist failure")
                .tag("stage", stage)
                .register(meterRegistry));
        }

        signatureRejected = Counter.builder("tracking.signature.rejected")
            .description("Click redirects refused because the signature did not verify")
            .register(meterRegistry);
        broadcastDropped = Counter.builder("tracking.broadcast.dropped")
            .description("Live feed frames dropped because a subscriber queue was full")
            .register(meterRegistry);
        retentionArchived = Counter.builder("tracking.retention.archived")
            .description("Events exported to cold storage")
            .register(meterRegistry);
        retentionDeleted = Counter.builder("tracking.retention.deleted")
            .description("Events deleted after export")
            .register(meterRegistry);
        retentionAnonymized = Counter.builder("tracking.retention.anonymized")
            .description("Events stripped of source address and client headers")
            .register(meterRegistry);
        retentionFailures = Counter.builder("tracking.retention.failures")
            .description("Retention batches that failed and were rolled back")
            .register(meterRegistry);
        ingestLatency = Timer.builder("tracking.ingest.latency")
            .description("Time from the tracking hit to the persisted event")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        log.info("Initialized tracking metrics for {} event types", EngagementEventType.values().length);
    }

    public void recordEventRecorded(EngagementEventType type, boolean automated) {
        (automated ? recordedAutomated : recordedHuman).get(type).increment();
    }

    public void recordClassification(ClientLabel label) {
        labelCounters.get(label).increment();
    }

    public void recordSuppressed(String reason) {
        Counter counter = suppressedCounters.get(reason);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordFailure(String stage) {
        Counter counter = failureCounters.get(stage);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordSignatureRejected() {
        signatureRejected.increment();
    }

    public void recordBroadcastDropped() {
        broadcastDropped.increment();
    }

    public void recordRetentionArchived(int count) {
        retentionArchived.increment(count);
    }

    public void recordRetentionDeleted(int count) {
        retentionDeleted.increment(count);
    }

    public void recordRetentionAnonymized(int count) {
        retentionAnonymized.increment(count);
    }

    public void recordRetentionFailure() {
        retentionFailures.increment();
    }

    public void recordIngestLatency(long durationMillis) {
        if (durationMillis >= 0) {
            ingestLatency.record(durationMillis, TimeUnit.MILLISECONDS);
        }
    }
}
