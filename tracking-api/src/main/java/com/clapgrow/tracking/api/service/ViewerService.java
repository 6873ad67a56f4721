package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.ViewerRegistrationResponse;
import com.clapgrow.tracking.api.entity.TrackingViewer;
import com.clapgrow.tracking.api.exception.TrackingNotFoundException;
import com.clapgrow.tracking.api.repository.TrackingViewerRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Viewer credentials and the in-memory roster of active viewers.
 *
 * The roster answers the per-delivery authorization check of the live feed without a
 * database round trip. Changes made on this instance apply immediately; changes made on
 * another instance apply at the next roster refresh.
 */
@Service
@Slf4j
public class ViewerService {

    private final TrackingViewerRepository viewerRepository;
    private final ApiKeyService apiKeyService;

    private final Map<UUID, RosterEntry> roster = new ConcurrentHashMap<>();

    public ViewerService(TrackingViewerRepository viewerRepository, ApiKeyService apiKeyService) {
        this.viewerRepository = viewerRepository;
        this.apiKeyService = apiKeyService;
    }

    @PostConstruct
    public void init() {
        refreshRoster();
    }

    /**
     * Creates a viewer for the tenant. The returned key is the only copy of it.
     */
    @Transactional
    public ViewerRegistrationResponse register(String tenantId, String name) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Viewer name is required");
        }

        UUID viewerId = UUID.randomUUID();
        String apiKey = apiKeyService.generateApiKey(viewerId);

        TrackingViewer viewer = new TrackingViewer();
        viewer.setId(viewerId);
        viewer.setTenantId(tenantId.trim());
        viewer.setName(name.trim());
        viewer.setApiKeyHash(apiKeyService.hashApiKey(apiKey));
        viewer.setIsActive(true);
        viewerRepository.save(viewer);

        roster.put(viewerId, RosterEntry.of(viewer));
        log.info("Registered viewer {} for tenant {}", viewerId, viewer.getTenantId());
        return new ViewerRegistrationResponse(viewerId, viewer.getTenantId(), viewer.getName(), apiKey);
    }

    /**
     * Deactivates a viewer. Live subscribers of this viewer stop receiving frames at the
     * next published event.
     */
    @Transactional
    public void revoke(UUID viewerId) {
        TrackingViewer viewer = viewerRepository.findById(viewerId)
            .orElseThrow(() -> new TrackingNotFoundException("Viewer not found: " + viewerId));
        viewer.setIsActive(false);
        viewerRepository.save(viewer);
        roster.remove(viewerId);
        log.info("Revoked viewer {} of tenant {}", viewerId, viewer.getTenantId());
    }

    /**
     * Resolves a presented key to its viewer.
     *
     * @throws SecurityException when the key is missing, malformed, unknown, revoked or wrong
     */
    public ViewerPrincipal authenticate(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new SecurityException("Viewer key required");
        }
        UUID viewerId = apiKeyService.extractViewerId(rawApiKey.trim());
        RosterEntry entry = viewerId == null ? null : roster.get(viewerId);
        if (entry == null || !apiKeyService.validateApiKey(rawApiKey.trim(), entry.apiKeyHash())) {
            log.warn("Rejected viewer key (viewer id {})", viewerId);
            throw new SecurityException("Invalid viewer key");
        }
        return entry.principal();
    }

    public boolean isAuthorized(UUID viewerId, String tenantId) {
        RosterEntry entry = roster.get(viewerId);
        return entry != null && entry.principal().tenantId().equals(tenantId);
    }

    public List<TrackingViewer> listViewers(String tenantId) {
        return viewerRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
    }

    /**
     * Replaces the roster with the active viewers in the database. A failed refresh keeps
     * the previous roster.
     */
    @Scheduled(initialDelayString = "#{@trackingProperties.broadcast.rosterRefreshInterval.toMillis()}",
               fixedDelayString = "#{@trackingProperties.broadcast.rosterRefreshInterval.toMillis()}")
    public void refreshRoster() {
        List<TrackingViewer> active;
        try {
            active = viewerRepository.findByIsActiveTrue();
        } catch (DataAccessException e) {
            log.error("Viewer roster refresh failed; keeping {} cached viewers", roster.size(), e);
            return;
        }
        Map<UUID, RosterEntry> fresh = new HashMap<>();
        for (TrackingViewer viewer : active) {
            fresh.put(viewer.getId(), RosterEntry.of(viewer));
        }
        roster.keySet().retainAll(fresh.keySet());
        roster.putAll(fresh);
        log.debug("Viewer roster refreshed: {} active viewers", fresh.size());
    }

    int rosterSize() {
        return roster.size();
    }

    private record RosterEntry(ViewerPrincipal principal, String apiKeyHash) {
        static RosterEntry of(TrackingViewer viewer) {
            return new RosterEntry(
                new ViewerPrincipal(viewer.getId(), viewer.getTenantId(), viewer.getName()),
                viewer.getApiKeyHash());
        }
    }
}
