package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.TrackingViewer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TrackingViewerRepository extends JpaRepository<TrackingViewer, UUID> {

    List<TrackingViewer> findByIsActiveTrue();

    List<TrackingViewer> findByTenantIdOrderByCreatedAtDesc(String tenantId);
}
