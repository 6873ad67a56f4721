package com.clapgrow.tracking.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Tracking flags of a campaign, mirrored from campaign management.
 */
@Entity
@Table(name = "campaign_tracking_settings")
@Getter
@Setter
@NoArgsConstructor
public class CampaignTrackingSettings extends BaseAuditableEntity {

    @Id
    @Column(name = "campaign_id", length = 100)
    private String campaignId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "open_tracking_enabled", nullable = false)
    private Boolean openTrackingEnabled = true;

    @Column(name = "click_tracking_enabled", nullable = false)
    private Boolean clickTrackingEnabled = true;

    @Version
    @Column(name = "version")
    private Long version;
}
