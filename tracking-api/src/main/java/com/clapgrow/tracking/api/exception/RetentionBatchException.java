package com.clapgrow.tracking.api.exception;

/**
 * A retention batch failed. Its transaction has been rolled back, so the batch has no
 * ledger row and is picked up again by the next run.
 */
public class RetentionBatchException extends RuntimeException {

    private final String batchKey;

    public RetentionBatchException(String batchKey, String message, Throwable cause) {
        super(message, cause);
        this.batchKey = batchKey;
    }

    public String getBatchKey() {
        return batchKey;
    }
}
