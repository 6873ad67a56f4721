package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.OptOutRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface OptOutRecordRepository extends JpaRepository<OptOutRecord, UUID> {

    Optional<OptOutRecord> findByRecipientHash(String recipientHash);
}
