package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.TrackedMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TrackedMessageRepository extends JpaRepository<TrackedMessage, String> {

    long countByCampaignId(String campaignId);

    Optional<TrackedMessage> findFirstByCampaignId(String campaignId);
}
