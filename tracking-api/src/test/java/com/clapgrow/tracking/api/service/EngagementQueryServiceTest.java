package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.EngagementAnalyticsResponse;
import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.api.exception.TrackingNotFoundException;
import com.clapgrow.tracking.api.repository.TrackingEventRepository;
import com.clapgrow.tracking.api.support.MutableClock;
import com.clapgrow.tracking.common.event.EngagementEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EngagementQueryServiceTest {

    private static final ViewerPrincipal VIEWER = new ViewerPrincipal(UUID.randomUUID(), "tenant-1", "Dashboard");
    private static final String RECIPIENT_HASH = "9".repeat(64);

    @Mock
    private TrackingEventRepository eventRepository;

    @Mock
    private TrackingDirectoryService directoryService;

    @Mock
    private AggregationService aggregationService;

    private EngagementQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new EngagementQueryService(eventRepository, directoryService, aggregationService,
            new MutableClock(Instant.parse("2024-05-10T15:30:00Z")));
    }

    @Test
    void campaignOfAnotherTenantLooksLikeMissingCampaign() {
        when(directoryService.resolveCampaignTenant("C2")).thenReturn(Optional.of("tenant-2"));
        when(directoryService.resolveCampaignTenant("C3")).thenReturn(Optional.empty());

        assertThrows(TrackingNotFoundException.class, () -> queryService.summary(VIEWER, "C2", false));
        assertThrows(TrackingNotFoundException.class, () -> queryService.summary(VIEWER, "C3", false));
        verifyNoInteractions(aggregationService);
    }

    @Test
    void summaryDelegatesForOwnCampaign() {
        when(directoryService.resolveCampaignTenant("C1")).thenReturn(Optional.of("tenant-1"));

        queryService.summary(VIEWER, "C1", true);

        verify(aggregationService).summary("C1", true);
    }

    @Test
    void eventsArePagedAndFilteredByType() {
        when(directoryService.resolveCampaignTenant("C1")).thenReturn(Optional.of("tenant-1"));
        TrackingEvent event = new TrackingEvent();
        event.setId(UUID.randomUUID());
        event.setCampaignId("C1");
        event.setEventType(EngagementEventType.CLICK);
        when(eventRepository.findByCampaignIdAndEventTypeOrderByOccurredAtDesc("C1", EngagementEventType.CLICK,
            PageRequest.of(1, 20))).thenReturn(new PageImpl<>(List.of(event), PageRequest.of(1, 20), 21));

        Page<?> page = queryService.campaignEvents(VIEWER, "C1", EngagementEventType.CLICK, 1, 20);

        assertEquals(21, page.getTotalElements());
        assertEquals(1, page.getContent().size());
    }

    @Test
    void pageSizeIsBounded() {
        when(directoryService.resolveCampaignTenant("C1")).thenReturn(Optional.of("tenant-1"));

        assertThrows(IllegalArgumentException.class, () -> queryService.campaignEvents(VIEWER, "C1", null, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> queryService.campaignEvents(VIEWER, "C1", null, 0, 201));
        assertThrows(IllegalArgumentException.class, () -> queryService.campaignEvents(VIEWER, "C1", null, -1, 20));
    }

    @Test
    void recipientHistoryStartsAtMidnightOfFirstDay() {
        when(eventRepository.findByTenantIdAndRecipientHashAndOccurredAtGreaterThanEqualOrderByOccurredAtDesc(
            "tenant-1", RECIPIENT_HASH, LocalDateTime.parse("2024-05-04T00:00:00"))).thenReturn(List.of());

        assertTrue(queryService.recipientHistory(VIEWER, RECIPIENT_HASH, 7).isEmpty());
    }

    @Test
    void recipientHistoryRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> queryService.recipientHistory(VIEWER, "user@example.com", 7));
        assertThrows(IllegalArgumentException.class, () -> queryService.recipientHistory(VIEWER, RECIPIENT_HASH, 0));
        assertThrows(IllegalArgumentException.class, () -> queryService.recipientHistory(VIEWER, RECIPIENT_HASH, 401));
        verifyNoInteractions(eventRepository);
    }

    @Test
    void analyticsListsEveryEventTypeAndGroupsUnknownDevices() {
        LocalDateTime since = LocalDateTime.parse("2024-05-10T00:00:00");
        when(eventRepository.countByType("tenant-1", null, since)).thenReturn(List.of(typeCount(EngagementEventType.OPEN, 3)));
        when(eventRepository.countByDevice("tenant-1", null, since))
            .thenReturn(List.of(deviceCount(null, 2), deviceCount("mobile", 1)));
        when(eventRepository.countByDay("tenant-1", null, since)).thenReturn(List.of(dailyCount("2024-05-10", "OPEN", 3)));

        EngagementAnalyticsResponse analytics = queryService.analytics(VIEWER, null, 1);

        assertEquals(3L, analytics.getByEventType().get("OPEN"));
        assertEquals(0L, analytics.getByEventType().get("COMPLAINT"));
        assertEquals(EngagementEventType.values().length, analytics.getByEventType().size());
        assertEquals(2L, analytics.getByDeviceType().get("unknown"));
        assertEquals(1L, analytics.getByDeviceType().get("mobile"));
        assertEquals(1, analytics.getByDay().size());
        assertEquals(3L, analytics.getByDay().get(0).getCounts().get("OPEN"));
        verify(directoryService, never()).resolveCampaignTenant(any());
    }

    private static TrackingEventRepository.TypeCount typeCount(EngagementEventType type, long total) {
        return new TrackingEventRepository.TypeCount() {
            public EngagementEventType getEventType() { return type; }
            public Long getTotal() { return total; }
        };
    }

    private static TrackingEventRepository.DeviceCount deviceCount(String device, long total) {
        return new TrackingEventRepository.DeviceCount() {
            public String getDeviceType() { return device; }
            public Long getTotal() { return total; }
        };
    }

    private static TrackingEventRepository.DailyCount dailyCount(String day, String type, long total) {
        return new TrackingEventRepository.DailyCount() {
            public String getDay() { return day; }
            public String getEventType() { return type; }
            public Long getTotal() { return total; }
        };
    }
}
