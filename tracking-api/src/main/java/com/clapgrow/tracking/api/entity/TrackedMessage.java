package com.clapgrow.tracking.api.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Local mirror of an outbound message, registered when its markup is instrumented.
 * The recipient is stored only as a keyed hash.
 */
@Entity
@Table(name = "tracked_messages", indexes = {
    @Index(name = "idx_tracked_messages_campaign", columnList = "campaign_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TrackedMessage extends BaseAuditableEntity {

    @Id
    @Column(name = "message_id", length = 100)
    private String messageId;

    @Column(name = "campaign_id", nullable = false, length = 100)
    private String campaignId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "recipient_hash", nullable = false, length = 64)
    private String recipientHash;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;
}
