package com.clapgrow.tracking.api.retention;

import com.clapgrow.tracking.api.entity.RetentionBatch;
import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.api.enums.RetentionPhase;
import com.clapgrow.tracking.api.exception.ColdStorageException;
import com.clapgrow.tracking.api.exception.RetentionBatchException;
import com.clapgrow.tracking.api.repository.RetentionBatchRepository;
import com.clapgrow.tracking.api.repository.TrackingEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * One retention batch per call, each in its own transaction together with its ledger row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionBatchProcessor {

    private final TrackingEventRepository eventRepository;
    private final RetentionBatchRepository batchRepository;
    private final ColdStorageExporter coldStorageExporter;
    private final Clock clock;

    /**
     * Clears source address and client headers of the oldest events before {@code cutoff}.
     *
     * @return events anonymized; 0 when nothing is left in range
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, timeout = 120)
    public int anonymizeBatch(LocalDateTime cutoff, int batchSize) {
        List<TrackingEvent> batch = eventRepository.findAnonymizationBatch(cutoff, PageRequest.of(0, batchSize));
        if (batch.isEmpty()) {
            return 0;
        }
        String batchKey = batchKey(RetentionPhase.ANONYMIZE, batch);
        try {
            int updated = eventRepository.anonymizeByIds(ids(batch));
            batchRepository.save(ledgerRow(batchKey, RetentionPhase.ANONYMIZE, batch));
            log.debug("Anonymized batch {} ({} events)", batchKey, updated);
            return updated;
        } catch (RuntimeException e) {
            throw new RetentionBatchException(batchKey, "Anonymization failed for batch " + batchKey, e);
        }
    }

    /**
     * Archives the oldest events before {@code cutoff}, then deletes them. The export happens
     * before the delete; a failed export rolls the batch back with nothing deleted.
     *
     * @return events deleted; 0 when nothing is left in range
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, timeout = 300)
    public int purgeBatch(LocalDateTime cutoff, int batchSize) {
        List<TrackingEvent> batch = eventRepository.findPurgeBatch(cutoff, PageRequest.of(0, batchSize));
        if (batch.isEmpty()) {
            return 0;
        }
        String batchKey = batchKey(RetentionPhase.PURGE, batch);
        try {
            coldStorageExporter.export(batchKey, batch);
        } catch (ColdStorageException e) {
            throw new RetentionBatchException(batchKey, "Cold storage export failed for batch " + batchKey, e);
        }
        try {
            int deleted = eventRepository.deleteByIds(ids(batch));
            batchRepository.save(ledgerRow(batchKey, RetentionPhase.PURGE, batch));
            log.debug("Purged batch {} ({} events)", batchKey, deleted);
            return deleted;
        } catch (RuntimeException e) {
            throw new RetentionBatchException(batchKey, "Delete failed for batch " + batchKey, e);
        }
    }

    /**
     * Keyed on the oldest event only. A retry after a rollback starts at the same event whatever
     * its size, so its export overwrites the earlier one instead of adding a second copy.
     */
    static String batchKey(RetentionPhase phase, List<TrackingEvent> batch) {
        TrackingEvent first = batch.get(0);
        return phase.name() + "-" + first.getOccurredAt().toInstant(ZoneOffset.UTC).toEpochMilli()
            + "-" + first.getId();
    }

    private RetentionBatch ledgerRow(String batchKey, RetentionPhase phase, List<TrackingEvent> batch) {
        RetentionBatch row = new RetentionBatch();
        row.setBatchKey(batchKey);
        row.setPhase(phase);
        row.setRangeStart(batch.get(0).getOccurredAt());
        row.setRangeEnd(batch.get(batch.size() - 1).getOccurredAt());
        row.setEventCount(batch.size());
        row.setCompletedAt(LocalDateTime.now(clock));
        return row;
    }

    private static List<UUID> ids(List<TrackingEvent> batch) {
        return batch.stream().map(TrackingEvent::getId).toList();
    }
}
