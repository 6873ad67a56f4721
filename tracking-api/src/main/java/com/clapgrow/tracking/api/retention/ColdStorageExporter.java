package com.clapgrow.tracking.api.retention;

import com.clapgrow.tracking.api.entity.TrackingEvent;
import com.clapgrow.tracking.api.exception.ColdStorageException;

import java.util.List;

/**
 * Write-only archive for purged events.
 *
 * Exports are keyed by batch: exporting the same key again must replace the earlier export,
 * never add a second copy.
 */
public interface ColdStorageExporter {

    void export(String batchKey, List<TrackingEvent> events) throws ColdStorageException;
}
