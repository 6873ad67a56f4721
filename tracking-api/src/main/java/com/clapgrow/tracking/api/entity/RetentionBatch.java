package com.clapgrow.tracking.api.entity;

import com.clapgrow.tracking.api.enums.RetentionPhase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Ledger row for one completed retention batch. Written in the same transaction as the
 * batch's update/delete, so a batch either has a ledger row and is fully applied, or has
 * neither.
 */
@Entity
@Table(name = "retention_batches", indexes = {
    @Index(name = "idx_retention_batches_completed", columnList = "completed_at")
})
@Getter
@Setter
@NoArgsConstructor
public class RetentionBatch {

    @Id
    @Column(name = "batch_key", length = 120)
    private String batchKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 20)
    private RetentionPhase phase;

    @Column(name = "range_start", nullable = false)
    private LocalDateTime rangeStart;

    @Column(name = "range_end", nullable = false)
    private LocalDateTime rangeEnd;

    @Column(name = "event_count", nullable = false)
    private Integer eventCount;

    @Column(name = "completed_at", nullable = false)
    private LocalDateTime completedAt;
}
