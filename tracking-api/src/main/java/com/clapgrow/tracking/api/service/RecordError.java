package com.clapgrow.tracking.api.service;

/**
 * Why an event was not recorded.
 *
 * @param retryable whether handing the same event to the recorder again may succeed
 */
public record RecordError(Kind kind, String message, boolean retryable) {

    public enum Kind {
        /** Payload is missing required data; retrying cannot help. */
        INVALID_EVENT,
        /** Same event id already stored (redelivery); nothing to do. */
        DUPLICATE,
        /** Database unavailable or write failed. */
        PERSISTENCE_FAILURE
    }

    public static RecordError invalid(String message) {
        return new RecordError(Kind.INVALID_EVENT, message, false);
    }

    public static RecordError duplicate(String message) {
        return new RecordError(Kind.DUPLICATE, message, false);
    }

    public static RecordError persistence(String message) {
        return new RecordError(Kind.PERSISTENCE_FAILURE, message, true);
    }
}
