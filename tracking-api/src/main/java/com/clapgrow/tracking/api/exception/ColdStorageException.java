package com.clapgrow.tracking.api.exception;

/**
 * Cold storage export failed for a batch.
 */
public class ColdStorageException extends Exception {

    public ColdStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
