package com.clapgrow.tracking.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Credential allowed to read a tenant's engagement data and live feed.
 * Deactivating a viewer stops live delivery on the next published event.
 */
@Entity
@Table(name = "tracking_viewers", indexes = {
    @Index(name = "idx_tracking_viewers_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@NoArgsConstructor
public class TrackingViewer extends BaseAuditableEntity {

    /**
     * Assigned by ViewerService before the first save; the id is part of the issued key.
     */
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "api_key_hash", nullable = false, length = 255)
    private String apiKeyHash;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
