package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.CacheConfig;
import com.clapgrow.tracking.api.entity.OptOutRecord;
import com.clapgrow.tracking.api.repository.OptOutRecordRepository;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Recipient opt-outs. Records are only ever widened: a later opt-out adds event types,
 * nothing here removes them, and retention never reads this table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptOutService {

    private final OptOutRecordRepository optOutRecordRepository;
    private final TrackingDirectoryService directoryService;
    private final Clock clock;

    public boolean isSuppressed(String recipientHash, EngagementEventType eventType) {
        if (recipientHash == null) {
            return false;
        }
        return directoryService.suppression(recipientHash).suppresses(eventType);
    }

    /**
     * @param eventTypes types to suppress; null or empty suppresses all of them
     */
    @CacheEvict(value = CacheConfig.OPT_OUTS, key = "#recipientHash")
    @Transactional
    public OptOutRecord recordOptOut(String recipientHash, Set<EngagementEventType> eventTypes, String source) {
        if (!RecipientHasher.isHash(recipientHash)) {
            throw new IllegalArgumentException("recipientHash must be a 64 character hex hash");
        }
        Set<EngagementEventType> requested = eventTypes == null || eventTypes.isEmpty()
            ? EnumSet.allOf(EngagementEventType.class)
            : EnumSet.copyOf(eventTypes);

        OptOutRecord record = optOutRecordRepository.findByRecipientHash(recipientHash).orElseGet(() -> {
            OptOutRecord created = new OptOutRecord();
            created.setRecipientHash(recipientHash);
            created.setOptedOutAt(LocalDateTime.now(clock));
            created.setSource(source);
            return created;
        });
        record.getSuppressedEventTypes().addAll(requested);
        OptOutRecord saved = optOutRecordRepository.save(record);
        log.info("Opt-out recorded for recipient {}: {}", abbreviate(recipientHash), saved.getSuppressedEventTypes());
        return saved;
    }

    private static String abbreviate(String recipientHash) {
        return recipientHash.substring(0, 12);
    }
}
