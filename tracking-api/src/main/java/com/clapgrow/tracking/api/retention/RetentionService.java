package com.clapgrow.tracking.api.retention;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.dto.RetentionRunResponse;
import com.clapgrow.tracking.api.exception.RetentionBatchException;
import com.clapgrow.tracking.api.service.TrackingMetricsService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduled privacy retention.
 *
 * <p>Phase 1 anonymizes events older than {@code anonymize-after}; phase 2 archives and
 * deletes events older than {@code raw-retention}. Each phase only touches events strictly
 * older than {@code now - max(window, safetyMargin)}, with the margin never below the open
 * coalescing window, and walks them oldest first in fixed-size batches.
 *
 * <p>A failed batch stops the run; the next run starts again from the oldest unprocessed
 * event. Cancellation is checked between batches. Opt-out records are never read or written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionService {

    private final RetentionBatchProcessor batchProcessor;
    private final TrackingProperties trackingProperties;
    private final TrackingMetricsService metricsService;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile boolean shuttingDown;

    @Scheduled(cron = "${tracking.retention.cron:0 30 3 * * *}", zone = "UTC")
    public void scheduledRun() {
        if (!trackingProperties.getRetention().isEnabled()) {
            log.debug("Retention disabled; skipping scheduled run");
            return;
        }
        try {
            runRetention();
        } catch (IllegalStateException e) {
            log.warn("Skipping scheduled retention run: {}", e.getMessage());
        }
    }

    /**
     * @throws IllegalStateException when a run is already in progress
     */
    public RetentionRunResponse runRetention() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Retention run already in progress");
        }
        cancelRequested.set(false);
        RetentionRunResponse result = new RetentionRunResponse();
        try {
            TrackingProperties.Retention retention = trackingProperties.getRetention();
            LocalDateTime now = LocalDateTime.now(clock);

            LocalDateTime anonymizeCutoff = cutoff(now, retention.getAnonymizeAfter());
            log.info("Retention run started: anonymize before {}, purge before {}",
                anonymizeCutoff, cutoff(now, retention.getRawRetention()));

            while (!isCancelled()) {
                int anonymized = batchProcessor.anonymizeBatch(anonymizeCutoff, retention.getBatchSize());
                if (anonymized == 0) {
                    break;
                }
                result.setBatches(result.getBatches() + 1);
                result.setAnonymized(result.getAnonymized() + anonymized);
                metricsService.recordRetentionAnonymized(anonymized);
            }

            LocalDateTime purgeCutoff = cutoff(now, retention.getRawRetention());
            while (!isCancelled()) {
                int deleted = batchProcessor.purgeBatch(purgeCutoff, retention.getBatchSize());
                if (deleted == 0) {
                    break;
                }
                result.setBatches(result.getBatches() + 1);
                result.setArchived(result.getArchived() + deleted);
                result.setDeleted(result.getDeleted() + deleted);
                metricsService.recordRetentionArchived(deleted);
                metricsService.recordRetentionDeleted(deleted);
            }

            result.setCancelled(isCancelled());
        } catch (RetentionBatchException e) {
            metricsService.recordRetentionFailure();
            log.error("Retention batch {} failed; run stopped after {} batches", e.getBatchKey(), result.getBatches(), e);
            result.setFailed(true);
        } catch (DataAccessException e) {
            metricsService.recordRetentionFailure();
            log.error("Retention batch lookup failed; run stopped after {} batches", result.getBatches(), e);
            result.setFailed(true);
        } finally {
            running.set(false);
        }

        if (result.isCancelled()) {
            log.info("Retention run cancelled after {} batches", result.getBatches());
        }
        log.info("Retention run finished: batches={}, anonymized={}, archived={}, deleted={}",
            result.getBatches(), result.getAnonymized(), result.getArchived(), result.getDeleted());
        return result;
    }

    /**
     * Stops the current run after its in-flight batch.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
    }

    LocalDateTime cutoff(LocalDateTime now, Duration window) {
        Duration margin = trackingProperties.getRetention().getSafetyMargin();
        Duration coalescing = trackingProperties.getOpen().getCoalescingWindow();
        if (margin.compareTo(coalescing) < 0) {
            margin = coalescing;
        }
        return now.minus(window.compareTo(margin) >= 0 ? window : margin);
    }

    private boolean isCancelled() {
        return shuttingDown || cancelRequested.get();
    }
}
