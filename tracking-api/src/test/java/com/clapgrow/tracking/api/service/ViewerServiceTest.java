package com.clapgrow.tracking.api.service;

import com.clapgrow.tracking.api.dto.ViewerRegistrationResponse;
import com.clapgrow.tracking.api.entity.TrackingViewer;
import com.clapgrow.tracking.api.exception.TrackingNotFoundException;
import com.clapgrow.tracking.api.repository.TrackingViewerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ViewerServiceTest {

    @Mock
    private TrackingViewerRepository viewerRepository;

    private ApiKeyService apiKeyService;
    private ViewerService viewerService;

    @BeforeEach
    void setUp() {
        apiKeyService = new ApiKeyService(new BCryptPasswordEncoder(4));
        viewerService = new ViewerService(viewerRepository, apiKeyService);
    }

    @Test
    void registeredViewerCanAuthenticateImmediately() {
        when(viewerRepository.save(any(TrackingViewer.class))).thenAnswer(inv -> inv.getArgument(0));

        ViewerRegistrationResponse registration = viewerService.register(" tenant-1 ", "Dashboard");

        ViewerPrincipal principal = viewerService.authenticate(registration.getApiKey());
        assertEquals(registration.getViewerId(), principal.viewerId());
        assertEquals("tenant-1", principal.tenantId());
        assertTrue(viewerService.isAuthorized(principal.viewerId(), "tenant-1"));
        assertFalse(viewerService.isAuthorized(principal.viewerId(), "tenant-2"));
    }

    @Test
    void revokedViewerIsNoLongerAuthorized() {
        when(viewerRepository.save(any(TrackingViewer.class))).thenAnswer(inv -> inv.getArgument(0));
        ViewerRegistrationResponse registration = viewerService.register("tenant-1", "Dashboard");
        TrackingViewer stored = viewer(registration.getViewerId(), "tenant-1", apiKeyService.hashApiKey(registration.getApiKey()));
        when(viewerRepository.findById(registration.getViewerId())).thenReturn(Optional.of(stored));

        viewerService.revoke(registration.getViewerId());

        assertFalse(stored.getIsActive());
        assertFalse(viewerService.isAuthorized(registration.getViewerId(), "tenant-1"));
        assertThrows(SecurityException.class, () -> viewerService.authenticate(registration.getApiKey()));
    }

    @Test
    void revokingUnknownViewerIsNotFound() {
        UUID viewerId = UUID.randomUUID();
        when(viewerRepository.findById(viewerId)).thenReturn(Optional.empty());

        assertThrows(TrackingNotFoundException.class, () -> viewerService.revoke(viewerId));
    }

    @Test
    void rejectsMissingMalformedAndWrongKeys() {
        UUID viewerId = UUID.randomUUID();
        String key = apiKeyService.generateApiKey(viewerId);
        when(viewerRepository.findByIsActiveTrue())
            .thenReturn(List.of(viewer(viewerId, "tenant-1", apiKeyService.hashApiKey(key))));
        viewerService.refreshRoster();

        assertThrows(SecurityException.class, () -> viewerService.authenticate(null));
        assertThrows(SecurityException.class, () -> viewerService.authenticate("garbage"));
        assertThrows(SecurityException.class, () -> viewerService.authenticate(viewerId + ".wrong-secret"));
        assertEquals(viewerId, viewerService.authenticate(key).viewerId());
    }

    @Test
    void refreshDropsViewersDeactivatedElsewhere() {
        UUID keep = UUID.randomUUID();
        UUID drop = UUID.randomUUID();
        when(viewerRepository.findByIsActiveTrue())
            .thenReturn(List.of(viewer(keep, "tenant-1", "h1"), viewer(drop, "tenant-1", "h2")))
            .thenReturn(List.of(viewer(keep, "tenant-1", "h1")));

        viewerService.refreshRoster();
        assertEquals(2, viewerService.rosterSize());

        viewerService.refreshRoster();
        assertEquals(1, viewerService.rosterSize());
        assertTrue(viewerService.isAuthorized(keep, "tenant-1"));
        assertFalse(viewerService.isAuthorized(drop, "tenant-1"));
    }

    @Test
    void failedRefreshKeepsPreviousRoster() {
        UUID viewerId = UUID.randomUUID();
        when(viewerRepository.findByIsActiveTrue())
            .thenReturn(List.of(viewer(viewerId, "tenant-1", "h1")))
            .thenThrow(new DataAccessResourceFailureException("database unavailable"));

        viewerService.refreshRoster();
        viewerService.refreshRoster();

        assertTrue(viewerService.isAuthorized(viewerId, "tenant-1"));
    }

    @Test
    void blankTenantOrNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> viewerService.register(" ", "Dashboard"));
        assertThrows(IllegalArgumentException.class, () -> viewerService.register("tenant-1", null));
        verifyNoInteractions(viewerRepository);
    }

    private static TrackingViewer viewer(UUID id, String tenantId, String apiKeyHash) {
        TrackingViewer viewer = new TrackingViewer();
        viewer.setId(id);
        viewer.setTenantId(tenantId);
        viewer.setName("viewer");
        viewer.setApiKeyHash(apiKeyHash);
        viewer.setIsActive(true);
        return viewer;
    }
}
