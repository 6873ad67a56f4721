package com.clapgrow.tracking.api.exception;

public class TrackingNotFoundException extends RuntimeException {

    public TrackingNotFoundException(String message) {
        super(message);
    }
}
