package com.clapgrow.tracking.api.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

/**
 * Outcome of {@link EventRecorder#record}: the stored event id, or the reason it was not stored.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecordResult {

    private final UUID eventId;
    private final RecordError error;

    public static RecordResult success(UUID eventId) {
        return new RecordResult(eventId, null);
    }

    public static RecordResult failure(RecordError error) {
        return new RecordResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
