package com.clapgrow.tracking.api.classifier;

/**
 * Rule kinds understood by the classifier. The table is data; this set is the
 * entire interpreter vocabulary.
 */
public enum RuleKind {
    /** User-Agent contains one of the rule's patterns (case-insensitive). */
    USER_AGENT_MATCH,
    /** Time between send and this request is below the rule's threshold. */
    TIMING,
    /** Requests from the source network in the current window exceed the rule's limit. */
    RATE
}
