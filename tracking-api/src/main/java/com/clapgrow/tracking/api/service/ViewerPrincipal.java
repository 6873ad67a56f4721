package com.clapgrow.tracking.api.service;

import java.util.UUID;

/**
 * Authenticated viewer. Everything a viewer reads is limited to {@link #tenantId}.
 */
public record ViewerPrincipal(UUID viewerId, String tenantId, String name) {
}
