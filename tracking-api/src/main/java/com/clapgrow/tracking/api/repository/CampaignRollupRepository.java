package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.CampaignRollup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CampaignRollupRepository extends JpaRepository<CampaignRollup, String> {
}
