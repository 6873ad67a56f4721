package com.clapgrow.tracking.api.entity;

import com.clapgrow.tracking.common.event.EngagementEventType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.domain.Persistable;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One recorded engagement signal. Rows are append-only: after insert only the retention
 * pass touches them (clearing {@code sourceIp}/{@code rawClientHeaders}, or deleting).
 *
 * The id is assigned by the recorder before insert, so the entity reports itself as new
 * until it has been persisted or loaded.
 */
@Entity
@Table(name = "tracking_events", indexes = {
    @Index(name = "idx_tracking_events_campaign", columnList = "campaign_id, event_type"),
    @Index(name = "idx_tracking_events_message", columnList = "message_id"),
    @Index(name = "idx_tracking_events_recipient", columnList = "recipient_hash"),
    @Index(name = "idx_tracking_events_occurred", columnList = "occurred_at, id")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class TrackingEvent implements Persistable<UUID> {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "campaign_id", nullable = false, length = 100)
    private String campaignId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "message_id", nullable = false, length = 100)
    private String messageId;

    /**
     * Keyed hash of the recipient address. Never the raw address.
     */
    @Column(name = "recipient_hash", nullable = false, length = 64)
    private String recipientHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private EngagementEventType eventType;

    /**
     * Destination of a CLICK; null for every other event type.
     */
    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    /**
     * Network prefix only (IPv4 /24, IPv6 /48).
     */
    @Column(name = "source_ip", length = 45)
    private String sourceIp;

    @Column(name = "classification_label", nullable = false, length = 20)
    private String classificationLabel;

    @Column(name = "classification_confidence", nullable = false)
    private Double classificationConfidence;

    @Column(name = "classification_rule", length = 100)
    private String classificationRule;

    @Column(name = "device_type", length = 20)
    private String deviceType;

    @Column(name = "client_name", length = 50)
    private String clientName;

    @Column(name = "is_automated", nullable = false)
    private boolean automated;

    @Column(name = "raw_client_headers", columnDefinition = "JSONB")
    @org.hibernate.annotations.Type(com.clapgrow.tracking.api.config.PostgreSQLJSONBType.class)
    private String rawClientHeaders;

    @Column(name = "is_anonymized", nullable = false)
    private boolean anonymized;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Transient
    private boolean newEntity = true;

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.newEntity = false;
    }
}
