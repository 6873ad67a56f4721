package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.InstrumentMessageRequest;
import com.clapgrow.tracking.api.dto.InstrumentMessageResponse;
import com.clapgrow.tracking.api.dto.TrackedMessageView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Send-time hook: registers the message and returns its markup with signed links and the
 * open beacon.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstrumentationService {

    private final RecipientHasher recipientHasher;
    private final TrackingDirectoryService directoryService;
    private final LinkRewriter linkRewriter;

    public InstrumentMessageResponse instrument(String messageId, InstrumentMessageRequest request) {
        String recipientHash = resolveRecipientHash(request.getRecipient(), request.getRecipientHash());
        LocalDateTime sentAt = request.getSentAt() == null
            ? null
            : LocalDateTime.ofInstant(request.getSentAt(), ZoneOffset.UTC);

        TrackedMessageView message = directoryService.registerMessage(
            messageId, request.getCampaignId(), request.getTenantId(), recipientHash, sentAt);
        String html = linkRewriter.rewrite(request.getHtml(), message.messageId());

        log.debug("Instrumented message {} of campaign {}", messageId, message.campaignId());
        return new InstrumentMessageResponse(message.messageId(), recipientHash, html);
    }

    /**
     * Hash of the raw address when given, otherwise the supplied hash after a format check.
     */
    public String resolveRecipientHash(String recipient, String recipientHash) {
        if (recipient != null && !recipient.isBlank()) {
            return recipientHasher.hash(recipient);
        }
        if (recipientHash != null && RecipientHasher.isHash(recipientHash)) {
            return recipientHash;
        }
        throw new IllegalArgumentException("Either recipient or a 64 character hex recipientHash is required");
    }
}
