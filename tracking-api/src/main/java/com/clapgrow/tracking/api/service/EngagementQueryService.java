package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.CampaignSummaryResponse;
import com.clapgrow.tracking.api.dto.EngagementAnalyticsResponse;
import com.clapgrow.tracking.api.dto.LinkStatsResponse;
import com.clapgrow.tracking.api.dto.TrackingEventResponse;
import com.clapgrow.tracking.api.exception.TrackingNotFoundException;
import com.clapgrow.tracking.api.repository.TrackingEventRepository;
import com.clapgrow.tracking.common.event.EngagementEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Viewer read paths. Every query is limited to the viewer's tenant; a campaign of another
 * tenant answers exactly like a campaign that does not exist.
 */
@Service
@RequiredArgsConstructor
public class EngagementQueryService {

    static final int MAX_PAGE_SIZE = 200;
    static final int MAX_DAYS_BACK = 400;
    static final String UNKNOWN_DEVICE = "unknown";

    private final TrackingEventRepository eventRepository;
    private final TrackingDirectoryService directoryService;
    private final AggregationService aggregationService;
    private final Clock clock;

    public CampaignSummaryResponse summary(ViewerPrincipal viewer, String campaignId, boolean fresh) {
        requireCampaignAccess(viewer, campaignId);
        return aggregationService.summary(campaignId, fresh);
    }

    public List<LinkStatsResponse> links(ViewerPrincipal viewer, String campaignId) {
        requireCampaignAccess(viewer, campaignId);
        return aggregationService.linkStats(campaignId);
    }

    @Transactional(readOnly = true)
    public Page<TrackingEventResponse> campaignEvents(ViewerPrincipal viewer, String campaignId,
                                                      EngagementEventType eventType, int page, int size) {
        requireCampaignAccess(viewer, campaignId);
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        Pageable pageable = PageRequest.of(page, size);
        return (eventType == null
            ? eventRepository.findByCampaignIdOrderByOccurredAtDesc(campaignId, pageable)
            : eventRepository.findByCampaignIdAndEventTypeOrderByOccurredAtDesc(campaignId, eventType, pageable))
            .map(TrackingEventResponse::from);
    }

    @Transactional(readOnly = true)
    public List<TrackingEventResponse> recipientHistory(ViewerPrincipal viewer, String recipientHash, int daysBack) {
        if (!RecipientHasher.isHash(recipientHash)) {
            throw new IllegalArgumentException("recipientHash must be a 64 character hex hash");
        }
        LocalDateTime since = since(daysBack);
        return eventRepository
            .findByTenantIdAndRecipientHashAndOccurredAtGreaterThanEqualOrderByOccurredAtDesc(
                viewer.tenantId(), recipientHash, since)
            .stream()
            .map(TrackingEventResponse::from)
            .toList();
    }

    /**
     * Counts by event type, by device type and by UTC day.
     *
     * @param campaignId null for every campaign of the viewer's tenant
     */
    @Transactional(readOnly = true)
    public EngagementAnalyticsResponse analytics(ViewerPrincipal viewer, String campaignId, int daysBack) {
        if (campaignId != null) {
            requireCampaignAccess(viewer, campaignId);
        }
        LocalDateTime since = since(daysBack);
        String tenantId = viewer.tenantId();

        Map<String, Long> byType = new LinkedHashMap<>();
        for (EngagementEventType type : EngagementEventType.values()) {
            byType.put(type.name(), 0L);
        }
        eventRepository.countByType(tenantId, campaignId, since)
            .forEach(row -> byType.put(row.getEventType().name(), row.getTotal()));

        Map<String, Long> byDevice = new TreeMap<>();
        eventRepository.countByDevice(tenantId, campaignId, since)
            .forEach(row -> byDevice.merge(row.getDeviceType() == null ? UNKNOWN_DEVICE : row.getDeviceType(),
                row.getTotal(), Long::sum));

        Map<String, Map<String, Long>> perDay = new TreeMap<>();
        eventRepository.countByDay(tenantId, campaignId, since)
            .forEach(row -> perDay.computeIfAbsent(row.getDay(), day -> new TreeMap<>())
                .put(row.getEventType(), row.getTotal()));
        List<EngagementAnalyticsResponse.DailyCounts> byDay = new ArrayList<>();
        perDay.forEach((day, counts) -> byDay.add(new EngagementAnalyticsResponse.DailyCounts(day, counts)));

        return new EngagementAnalyticsResponse(campaignId, daysBack, byType, byDevice, byDay);
    }

    /**
     * @throws TrackingNotFoundException when the campaign is unknown or owned by another tenant
     */
    public void requireCampaignAccess(ViewerPrincipal viewer, String campaignId) {
        String owner = directoryService.resolveCampaignTenant(campaignId).orElse(null);
        if (owner == null || !owner.equals(viewer.tenantId())) {
            throw new TrackingNotFoundException("Campaign not found: " + campaignId);
        }
    }

    private LocalDateTime since(int daysBack) {
        if (daysBack < 1 || daysBack > MAX_DAYS_BACK) {
            throw new IllegalArgumentException("daysBack must be between 1 and " + MAX_DAYS_BACK);
        }
        return LocalDate.now(clock).minusDays(daysBack - 1L).atStartOfDay();
    }
}
