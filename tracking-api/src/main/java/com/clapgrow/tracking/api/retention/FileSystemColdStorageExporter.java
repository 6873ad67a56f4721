package com.clapgrow.tracking.api.retention;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.api.exception.ColdStorageException;
import com.clapgrow.tracking.common.event.EngagementEventType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Writes each batch as JSON lines to {@code {archiveDir}/{batchKey}.jsonl}. The file is
 * written under a temporary name and moved into place, so a reader never sees a partial
 * batch and a re-export replaces the previous file.
 */
@Component
@Slf4j
public class FileSystemColdStorageExporter implements ColdStorageExporter {

    private final Path archiveDir;
    private final ObjectMapper objectMapper;

    public FileSystemColdStorageExporter(TrackingProperties trackingProperties, ObjectMapper objectMapper) {
        this.archiveDir = Paths.get(trackingProperties.getRetention().getArchiveDir()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;

        try {
            Files.createDirectories(this.archiveDir);
            log.info("Cold storage archive directory initialized: {}", this.archiveDir);
        } catch (IOException e) {
            log.error("Could not create archive directory: {}", this.archiveDir, e);
            throw new IllegalStateException("Could not create archive directory " + this.archiveDir, e);
        }
    }

    @Override
    public void export(String batchKey, List<TrackingEvent> events) throws ColdStorageException {
        if (batchKey == null || !batchKey.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("Invalid batch key: " + batchKey);
        }
        Path target = archiveDir.resolve(batchKey + ".jsonl");
        Path temp = archiveDir.resolve(batchKey + ".jsonl.tmp");

        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (TrackingEvent event : events) {
                    writer.write(objectMapper.writeValueAsString(ArchivedEvent.from(event)));
                    writer.newLine();
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new ColdStorageException("Failed to export batch " + batchKey + " to " + target, e);
        }
        log.debug("Exported {} events to {}", events.size(), target);
    }

    Path archiveDir() {
        return archiveDir;
    }

    /**
     * Archive line. Keeps everything stored for the event, raw headers included.
     */
    record ArchivedEvent(
        UUID id,
        String messageId,
        String campaignId,
        String tenantId,
        String recipientHash,
        EngagementEventType eventType,
        String url,
        LocalDateTime occurredAt,
        String sourceIp,
        String classificationLabel,
        Double classificationConfidence,
        String classificationRule,
        boolean automated,
        String deviceType,
        String clientName,
        String rawClientHeaders,
        boolean anonymized,
        LocalDateTime createdAt
    ) {
        static ArchivedEvent from(TrackingEvent event) {
            return new ArchivedEvent(
                event.getId(),
                event.getMessageId(),
                event.getCampaignId(),
                event.getTenantId(),
                event.getRecipientHash(),
                event.getEventType(),
                event.getUrl(),
                event.getOccurredAt(),
                event.getSourceIp(),
                event.getClassificationLabel(),
                event.getClassificationConfidence(),
                event.getClassificationRule(),
                event.isAutomated(),
                event.getDeviceType(),
                event.getClientName(),
                event.getRawClientHeaders(),
                event.isAnonymized(),
                event.getCreatedAt()
            );
        }
    }
}
