package com.clapgrow.tracking.api.repository;

import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.common.event.EngagementEventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TrackingEventRepository extends JpaRepository<TrackingEvent, UUID> {

    Page<TrackingEvent> findByCampaignIdOrderByOccurredAtDesc(String campaignId, Pageable pageable);

    Page<TrackingEvent> findByCampaignIdAndEventTypeOrderByOccurredAtDesc(
        String campaignId, EngagementEventType eventType, Pageable pageable);

    List<TrackingEvent> findByTenantIdAndRecipientHashAndOccurredAtGreaterThanEqualOrderByOccurredAtDesc(
        String tenantId, String recipientHash, LocalDateTime since);

    /**
     * Totals for one event type of a campaign. "Unique" counts distinct messages;
     * "human" counts only events the classifier labelled human.
     */
    @Query("SELECT COUNT(e) AS total, " +
           "COUNT(DISTINCT e.messageId) AS uniqueMessages, " +
           "SUM(CASE WHEN e.classificationLabel = 'human' THEN 1 ELSE 0 END) AS human, " +
           "COUNT(DISTINCT CASE WHEN e.classificationLabel = 'human' THEN e.messageId ELSE NULL END) AS uniqueHuman " +
           "FROM TrackingEvent e WHERE e.campaignId = :campaignId AND e.eventType = :eventType")
    EngagementCounts countEngagement(@Param("campaignId") String campaignId,
                                     @Param("eventType") EngagementEventType eventType);

    @Query("SELECT e.url AS url, COUNT(e) AS clicks, COUNT(DISTINCT e.messageId) AS uniqueClicks, " +
           "SUM(CASE WHEN e.classificationLabel = 'human' THEN 1 ELSE 0 END) AS humanClicks " +
           "FROM TrackingEvent e WHERE e.campaignId = :campaignId AND e.eventType = :eventType " +
           "GROUP BY e.url ORDER BY COUNT(e) DESC")
    List<LinkCounts> countLinks(@Param("campaignId") String campaignId,
                                @Param("eventType") EngagementEventType eventType);

    @Query("SELECT DISTINCT e.campaignId FROM TrackingEvent e WHERE e.occurredAt >= :since")
    List<String> findCampaignIdsActiveSince(@Param("since") LocalDateTime since);

    @Query("SELECT e.eventType AS eventType, COUNT(e) AS total FROM TrackingEvent e " +
           "WHERE e.tenantId = :tenantId AND (:campaignId IS NULL OR e.campaignId = :campaignId) " +
           "AND e.occurredAt >= :since GROUP BY e.eventType")
    List<TypeCount> countByType(@Param("tenantId") String tenantId,
                                @Param("campaignId") String campaignId,
                                @Param("since") LocalDateTime since);

    @Query("SELECT e.deviceType AS deviceType, COUNT(e) AS total FROM TrackingEvent e " +
           "WHERE e.tenantId = :tenantId AND (:campaignId IS NULL OR e.campaignId = :campaignId) " +
           "AND e.occurredAt >= :since GROUP BY e.deviceType")
    List<DeviceCount> countByDevice(@Param("tenantId") String tenantId,
                                    @Param("campaignId") String campaignId,
                                    @Param("since") LocalDateTime since);

    @Query(value = "SELECT TO_CHAR(occurred_at, 'YYYY-MM-DD') AS day, event_type AS eventType, COUNT(*) AS total " +
                   "FROM tracking_events WHERE tenant_id = :tenantId " +
                   "AND (CAST(:campaignId AS VARCHAR) IS NULL OR campaign_id = CAST(:campaignId AS VARCHAR)) " +
                   "AND occurred_at >= :since " +
                   "GROUP BY TO_CHAR(occurred_at, 'YYYY-MM-DD'), event_type ORDER BY day", nativeQuery = true)
    List<DailyCount> countByDay(@Param("tenantId") String tenantId,
                                @Param("campaignId") String campaignId,
                                @Param("since") LocalDateTime since);

    /**
     * Oldest not-yet-anonymized events before the cutoff. Anonymized rows leave the
     * predicate, so repeated calls walk forward without an explicit cursor.
     */
    @Query("SELECT e FROM TrackingEvent e WHERE e.occurredAt < :cutoff AND e.anonymized = false " +
           "ORDER BY e.occurredAt ASC, e.id ASC")
    List<TrackingEvent> findAnonymizationBatch(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);

    /**
     * Oldest events before the cutoff. Deleted rows leave the predicate.
     */
    @Query("SELECT e FROM TrackingEvent e WHERE e.occurredAt < :cutoff ORDER BY e.occurredAt ASC, e.id ASC")
    List<TrackingEvent> findPurgeBatch(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);

    @Modifying
    @Query("UPDATE TrackingEvent e SET e.sourceIp = NULL, e.rawClientHeaders = NULL, e.anonymized = true " +
           "WHERE e.id IN :ids")
    int anonymizeByIds(@Param("ids") Collection<UUID> ids);

    @Modifying
    @Query("DELETE FROM TrackingEvent e WHERE e.id IN :ids")
    int deleteByIds(@Param("ids") Collection<UUID> ids);

    interface EngagementCounts {
        Long getTotal();
        Long getUniqueMessages();
        Long getHuman();
        Long getUniqueHuman();
    }

    interface LinkCounts {
        String getUrl();
        Long getClicks();
        Long getUniqueClicks();
        Long getHumanClicks();
    }

    interface TypeCount {
        EngagementEventType getEventType();
        Long getTotal();
    }

    interface DeviceCount {
        String getDeviceType();
        Long getTotal();
    }

    interface DailyCount {
        String getDay();
        String getEventType();
        Long getTotal();
    }
}
