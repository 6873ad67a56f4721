package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.config.CacheConfig;
import com.clapgrow.tracking.api.dto.CampaignFlagsView;
import com.clapgrow.tracking.api.dto.SuppressionView;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import com.clapgrow.tracking.api.entity.CampaignTrackingSettings;
import com.clapgrow.tracking.api.entity.TrackedMessage;
import com.clapgrow.tracking.api.repository.CampaignTrackingSettingsRepository;
import com.clapgrow.tracking.api.repository.OptOutRecordRepository;
import com.clapgrow.tracking.api.repository.TrackedMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Local mirrors of the campaign and message data owned by other systems, plus the
 * opt-out lookup. Reads on the tracking hot path go through the Redis caches.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingDirectoryService {

    private final TrackedMessageRepository trackedMessageRepository;
    private final CampaignTrackingSettingsRepository settingsRepository;
    private final OptOutRecordRepository optOutRecordRepository;

    @Cacheable(value = CacheConfig.TRACKED_MESSAGES, key = "#messageId", unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<TrackedMessageView> findMessage(String messageId) {
        return trackedMessageRepository.findById(messageId).map(TrackingDirectoryService::toView);
    }

    @Cacheable(value = CacheConfig.CAMPAIGN_SETTINGS, key = "#campaignId")
    @Transactional(readOnly = true)
    public CampaignFlagsView campaignFlags(String campaignId) {
        return settingsRepository.findById(campaignId)
            .map(s -> new CampaignFlagsView(campaignId,
                Boolean.TRUE.equals(s.getOpenTrackingEnabled()),
                Boolean.TRUE.equals(s.getClickTrackingEnabled())))
            .orElseGet(() -> CampaignFlagsView.defaults(campaignId));
    }

    @Cacheable(value = CacheConfig.OPT_OUTS, key = "#recipientHash")
    @Transactional(readOnly = true)
    public SuppressionView suppression(String recipientHash) {
        return optOutRecordRepository.findByRecipientHash(recipientHash)
            .map(record -> new SuppressionView(record.suppressedCopy()))
            .orElseGet(SuppressionView::none);
    }

    /**
     * Registers a message at send time. Registering the same message again for the same
     * campaign is a no-op apart from filling a missing send time.
     *
     * @throws IllegalStateException when the id is already registered to another campaign or tenant
     */
    @CacheEvict(value = CacheConfig.TRACKED_MESSAGES, key = "#messageId")
    @Transactional
    public TrackedMessageView registerMessage(String messageId, String campaignId, String tenantId,
                                              String recipientHash, LocalDateTime sentAt) {
        TrackedMessage message = trackedMessageRepository.findById(messageId).orElse(null);
        if (message == null) {
            message = new TrackedMessage(messageId, campaignId, tenantId, recipientHash, sentAt);
            log.debug("Registered message {} for campaign {}", messageId, campaignId);
        } else {
            if (!message.getCampaignId().equals(campaignId) || !message.getTenantId().equals(tenantId)) {
                throw new IllegalStateException("Message " + messageId + " is already registered to another campaign");
            }
            if (!message.getRecipientHash().equals(recipientHash)) {
                throw new IllegalStateException("Message " + messageId + " is already registered to another recipient");
            }
            if (message.getSentAt() == null && sentAt != null) {
                message.setSentAt(sentAt);
            }
        }
        return toView(trackedMessageRepository.save(message));
    }

    @CacheEvict(value = CacheConfig.CAMPAIGN_SETTINGS, key = "#campaignId")
    @Transactional
    public CampaignFlagsView upsertCampaignSettings(String campaignId, String tenantId,
                                                    boolean openTrackingEnabled, boolean clickTrackingEnabled) {
        CampaignTrackingSettings settings = settingsRepository.findById(campaignId).orElseGet(() -> {
            CampaignTrackingSettings created = new CampaignTrackingSettings();
            created.setCampaignId(campaignId);
            created.setTenantId(tenantId);
            return created;
        });
        if (!settings.getTenantId().equals(tenantId)) {
            throw new IllegalStateException("Campaign " + campaignId + " belongs to another tenant");
        }
        settings.setOpenTrackingEnabled(openTrackingEnabled);
        settings.setClickTrackingEnabled(clickTrackingEnabled);
        settingsRepository.save(settings);
        log.info("Campaign {} tracking settings: open={}, click={}", campaignId, openTrackingEnabled, clickTrackingEnabled);
        return new CampaignFlagsView(campaignId, openTrackingEnabled, clickTrackingEnabled);
    }

    /**
     * Tenant that owns a campaign, taken from its settings or from any registered message.
     */
    @Transactional(readOnly = true)
    public Optional<String> resolveCampaignTenant(String campaignId) {
        return settingsRepository.findById(campaignId)
            .map(CampaignTrackingSettings::getTenantId)
            .or(() -> trackedMessageRepository.findFirstByCampaignId(campaignId).map(TrackedMessage::getTenantId));
    }

    private static TrackedMessageView toView(TrackedMessage message) {
        return new TrackedMessageView(message.getMessageId(), message.getCampaignId(), message.getTenantId(),
            message.getRecipientHash(), message.getSentAt());
    }
}
