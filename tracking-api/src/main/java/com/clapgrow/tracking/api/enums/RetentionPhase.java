package com.clapgrow.tracking.api.enums;

/**
 * Stage of the retention pass a batch belongs to.
 */
public enum RetentionPhase {
    ANONYMIZE,  // source address and client headers cleared
    PURGE       // archived to cold storage, then deleted
}
