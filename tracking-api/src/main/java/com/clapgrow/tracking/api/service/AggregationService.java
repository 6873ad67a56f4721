package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.dto.CampaignSummaryResponse;
import com.clapgrow.tracking.api.dto.LinkStatsResponse;
import com.clapgrow.tracking.api.entity.CampaignRollup;
import com.clapgrow.tracking.api.repository.CampaignRollupRepository;
import com.clapgrow.tracking.api.repository.TrackedMessageRepository;
import com.clapgrow.tracking.api.repository.TrackingEventRepository;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Campaign engagement totals.
 *
 * <p>Summaries are served from {@code campaign_rollups}, refreshed on a fixed delay for
 * campaigns with recent activity, or computed from the event table on request. Unique counts
 * are distinct messages; rates are unique counts over messages sent, 0 when nothing was sent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationService {

    private final TrackingEventRepository eventRepository;
    private final TrackedMessageRepository trackedMessageRepository;
    private final CampaignRollupRepository rollupRepository;
    private final TrackingDirectoryService directoryService;
    private final TrackingProperties trackingProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{@trackingProperties.rollup.refreshInterval.toMillis()}",
               initialDelayString = "#{@trackingProperties.rollup.refreshInterval.toMillis()}")
    public void refreshActiveRollups() {
        LocalDateTime since = LocalDateTime.now(clock).minus(trackingProperties.getRollup().getActiveLookback());
        List<String> campaignIds = eventRepository.findCampaignIdsActiveSince(since);
        int refreshed = 0;
        for (String campaignId : campaignIds) {
            try {
                refreshRollup(campaignId);
                refreshed++;
            } catch (Exception e) {
                log.error("Rollup refresh failed for campaign {}", campaignId, e);
            }
        }
        if (!campaignIds.isEmpty()) {
            log.info("Refreshed {} of {} active campaign rollups", refreshed, campaignIds.size());
        }
    }

    /**
     * Recomputes and stores the rollup of one campaign.
     */
    public CampaignRollup refreshRollup(String campaignId) {
        CampaignSummaryResponse computed = compute(campaignId);
        CampaignRollup rollup = rollupRepository.findById(campaignId).orElseGet(() -> {
            CampaignRollup created = new CampaignRollup();
            created.setCampaignId(campaignId);
            return created;
        });
        rollup.setTenantId(directoryService.resolveCampaignTenant(campaignId).orElse(rollup.getTenantId()));
        if (rollup.getTenantId() == null) {
            throw new IllegalStateException("No tenant known for campaign " + campaignId);
        }
        rollup.setMessagesSent(computed.getMessagesSent());
        rollup.setOpens(computed.getOpens());
        rollup.setUniqueOpens(computed.getUniqueOpens());
        rollup.setHumanOpens(computed.getHumanOpens());
        rollup.setUniqueHumanOpens(computed.getUniqueHumanOpens());
        rollup.setClicks(computed.getClicks());
        rollup.setUniqueClicks(computed.getUniqueClicks());
        rollup.setHumanClicks(computed.getHumanClicks());
        rollup.setUniqueHumanClicks(computed.getUniqueHumanClicks());
        rollup.setRefreshedAt(computed.getRefreshedAt());
        return rollupRepository.save(rollup);
    }

    /**
     * @param fresh compute from the event table instead of reading the stored rollup
     */
    @Transactional(readOnly = true)
    public CampaignSummaryResponse summary(String campaignId, boolean fresh) {
        if (!fresh) {
            Optional<CampaignRollup> stored = rollupRepository.findById(campaignId);
            if (stored.isPresent()) {
                return fromRollup(stored.get());
            }
        }
        return compute(campaignId);
    }

    @Transactional(readOnly = true)
    public List<LinkStatsResponse> linkStats(String campaignId) {
        return eventRepository.countLinks(campaignId, EngagementEventType.CLICK).stream()
            .map(row -> new LinkStatsResponse(row.getUrl(), orZero(row.getClicks()),
                orZero(row.getUniqueClicks()), orZero(row.getHumanClicks())))
            .toList();
    }

    CampaignSummaryResponse compute(String campaignId) {
        long sent = trackedMessageRepository.countByCampaignId(campaignId);
        TrackingEventRepository.EngagementCounts opens =
            eventRepository.countEngagement(campaignId, EngagementEventType.OPEN);
        TrackingEventRepository.EngagementCounts clicks =
            eventRepository.countEngagement(campaignId, EngagementEventType.CLICK);

        long uniqueOpens = orZero(opens.getUniqueMessages());
        long uniqueClicks = orZero(clicks.getUniqueMessages());
        long uniqueHumanOpens = orZero(opens.getUniqueHuman());
        long uniqueHumanClicks = orZero(clicks.getUniqueHuman());

        return CampaignSummaryResponse.builder()
            .campaignId(campaignId)
            .messagesSent(sent)
            .opens(orZero(opens.getTotal()))
            .uniqueOpens(uniqueOpens)
            .humanOpens(orZero(opens.getHuman()))
            .uniqueHumanOpens(uniqueHumanOpens)
            .clicks(orZero(clicks.getTotal()))
            .uniqueClicks(uniqueClicks)
            .humanClicks(orZero(clicks.getHuman()))
            .uniqueHumanClicks(uniqueHumanClicks)
            .openRate(rate(uniqueOpens, sent))
            .clickRate(rate(uniqueClicks, sent))
            .humanOpenRate(rate(uniqueHumanOpens, sent))
            .humanClickRate(rate(uniqueHumanClicks, sent))
            .refreshedAt(LocalDateTime.now(clock))
            .fresh(true)
            .build();
    }

    private static CampaignSummaryResponse fromRollup(CampaignRollup rollup) {
        long sent = rollup.getMessagesSent();
        return CampaignSummaryResponse.builder()
            .campaignId(rollup.getCampaignId())
            .messagesSent(sent)
            .opens(rollup.getOpens())
            .uniqueOpens(rollup.getUniqueOpens())
            .humanOpens(rollup.getHumanOpens())
            .uniqueHumanOpens(rollup.getUniqueHumanOpens())
            .clicks(rollup.getClicks())
            .uniqueClicks(rollup.getUniqueClicks())
            .humanClicks(rollup.getHumanClicks())
            .uniqueHumanClicks(rollup.getUniqueHumanClicks())
            .openRate(rate(rollup.getUniqueOpens(), sent))
            .clickRate(rate(rollup.getUniqueClicks(), sent))
            .humanOpenRate(rate(rollup.getUniqueHumanOpens(), sent))
            .humanClickRate(rate(rollup.getUniqueHumanClicks(), sent))
            .refreshedAt(rollup.getRefreshedAt())
            .fresh(false)
            .build();
    }

    static double rate(long unique, long sent) {
        return sent == 0 ? 0.0 : (double) unique / sent;
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
