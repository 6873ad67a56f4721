package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.CampaignTrackingSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignTrackingSettingsRepository extends JpaRepository<CampaignTrackingSettings, String> {
}
