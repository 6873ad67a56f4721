package com.clapgrow.tracking.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Materialized campaign aggregates. Derived from {@code tracking_events} and safe to rebuild
 * at any time; never authoritative.
 */
@Entity
@Table(name = "campaign_rollups")
@Getter
@Setter
@NoArgsConstructor
public class CampaignRollup extends BaseAuditableEntity {

    @Id
    @Column(name = "campaign_id", length = 100)
    private String campaignId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "messages_sent", nullable = false)
    private Long messagesSent = 0L;

    @Column(name = "opens", nullable = false)
    private Long opens = 0L;

    @Column(name = "unique_opens", nullable = false)
    private Long uniqueOpens = 0L;

    @Column(name = "human_opens", nullable = false)
    private Long humanOpens = 0L;

    @Column(name = "unique_human_opens", nullable = false)
    private Long uniqueHumanOpens = 0L;

    @Column(name = "clicks", nullable = false)
    private Long clicks = 0L;

    @Column(name = "unique_clicks", nullable = false)
    private Long uniqueClicks = 0L;

    @Column(name = "human_clicks", nullable = false)
    private Long humanClicks = 0L;

    @Column(name = "unique_human_clicks", nullable = false)
    private Long uniqueHumanClicks = 0L;

    @Column(name = "refreshed_at", nullable = false)
    private LocalDateTime refreshedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
