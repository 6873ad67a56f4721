package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.CampaignFlagsView;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.entity.CampaignTrackingSettings;
import com.clapgrow.tracking.api.entity.TrackedMessage;
import com.clapgrow.tracking.api.repository.CampaignTrackingSettingsRepository;
import com.clapgrow.tracking.api.repository.OptOutRecordRepository;
import com.clapgrow.tracking.api.repository.TrackedMessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrackingDirectoryServiceTest {

    private static final LocalDateTime SENT_AT = LocalDateTime.of(2024, 5, 1, 9, 0);

    @Mock
    private TrackedMessageRepository trackedMessageRepository;

    @Mock
    private CampaignTrackingSettingsRepository settingsRepository;

    @Mock
    private OptOutRecordRepository optOutRecordRepository;

    private TrackingDirectoryService directoryService;

    @BeforeEach
    void setUp() {
        directoryService = new TrackingDirectoryService(trackedMessageRepository, settingsRepository, optOutRecordRepository);
    }

    @Test
    void testCampaignWithoutSettingsTracksEverything() {
        when(settingsRepository.findById("C1")).thenReturn(Optional.empty());

        CampaignFlagsView flags = directoryService.campaignFlags("C1");

        assertTrue(flags.openTrackingEnabled());
        assertTrue(flags.clickTrackingEnabled());
    }

    @Test
    void testCampaignFlagsComeFromSettings() {
        CampaignTrackingSettings settings = settings("C1", "tenant-1");
        settings.setOpenTrackingEnabled(false);
        when(settingsRepository.findById("C1")).thenReturn(Optional.of(settings));

        CampaignFlagsView flags = directoryService.campaignFlags("C1");

        assertFalse(flags.openTrackingEnabled());
        assertTrue(flags.clickTrackingEnabled());
    }

    @Test
    void testRegisterNewMessage() {
        when(trackedMessageRepository.findById("M1")).thenReturn(Optional.empty());
        when(trackedMessageRepository.save(any(TrackedMessage.class))).thenAnswer(inv -> inv.getArgument(0));

        TrackedMessageView view = directoryService.registerMessage("M1", "C1", "tenant-1", "hash-1", SENT_AT);

        assertEquals("M1", view.messageId());
        assertEquals("C1", view.campaignId());
        assertEquals("tenant-1", view.tenantId());
        assertEquals(SENT_AT, view.sentAt());
    }

    @Test
    void testRegisterAgainFillsMissingSendTimeOnly() {
        TrackedMessage existing = new TrackedMessage("M1", "C1", "tenant-1", "hash-1", null);
        when(trackedMessageRepository.findById("M1")).thenReturn(Optional.of(existing));
        when(trackedMessageRepository.save(existing)).thenReturn(existing);

        directoryService.registerMessage("M1", "C1", "tenant-1", "hash-1", SENT_AT);
        assertEquals(SENT_AT, existing.getSentAt());

        directoryService.registerMessage("M1", "C1", "tenant-1", "hash-1", SENT_AT.plusDays(1));
        assertEquals(SENT_AT, existing.getSentAt());
    }

    @Test
    void testRegisterUnderAnotherCampaignIsRefused() {
        TrackedMessage existing = new TrackedMessage("M1", "C1", "tenant-1", "hash-1", SENT_AT);
        when(trackedMessageRepository.findById("M1")).thenReturn(Optional.of(existing));

        assertThrows(IllegalStateException.class,
            () -> directoryService.registerMessage("M1", "C2", "tenant-1", "hash-1", SENT_AT));
        assertThrows(IllegalStateException.class,
            () -> directoryService.registerMessage("M1", "C1", "tenant-1", "hash-2", SENT_AT));
        verify(trackedMessageRepository, never()).save(any());
    }

    @Test
    void testUpsertCreatesSettings() {
        when(settingsRepository.findById("C1")).thenReturn(Optional.empty());

        CampaignFlagsView flags = directoryService.upsertCampaignSettings("C1", "tenant-1", true, false);

        ArgumentCaptor<CampaignTrackingSettings> captor = ArgumentCaptor.forClass(CampaignTrackingSettings.class);
        verify(settingsRepository).save(captor.capture());
        assertEquals("tenant-1", captor.getValue().getTenantId());
        assertTrue(captor.getValue().getOpenTrackingEnabled());
        assertFalse(captor.getValue().getClickTrackingEnabled());
        assertFalse(flags.clickTrackingEnabled());
    }

    @Test
    void testUpsertFromAnotherTenantIsRefused() {
        when(settingsRepository.findById("C1")).thenReturn(Optional.of(settings("C1", "tenant-1")));

        assertThrows(IllegalStateException.class,
            () -> directoryService.upsertCampaignSettings("C1", "tenant-2", false, false));
        verify(settingsRepository, never()).save(any());
    }

    @Test
    void testResolveTenantFallsBackToMessages() {
        when(settingsRepository.findById("C1")).thenReturn(Optional.empty());
        when(trackedMessageRepository.findFirstByCampaignId("C1"))
            .thenReturn(Optional.of(new TrackedMessage("M1", "C1", "tenant-1", "hash-1", SENT_AT)));

        assertEquals(Optional.of("tenant-1"), directoryService.resolveCampaignTenant("C1"));
    }

    private static CampaignTrackingSettings settings(String campaignId, String tenantId) {
        CampaignTrackingSettings settings = new CampaignTrackingSettings();
        settings.setCampaignId(campaignId);
        settings.setTenantId(tenantId);
        return settings;
    }
}
