package com.clapgrow.tracking.api.exception;

/**
 * Malformed or missing tracking request parameters. Raised before anything is recorded
 * and answered with 400.
 */
public class TrackingProtocolException extends RuntimeException {

    public TrackingProtocolException(String message) {
        super(message);
    }
}
