package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.RetentionBatch;
import com.clapgrow.tracking.api.enums.RetentionPhase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RetentionBatchRepository extends JpaRepository<RetentionBatch, String> {

    long countByPhase(RetentionPhase phase);
}
