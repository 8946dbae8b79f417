package io.mailagenda.core;

/**
 * How jobs found IN_FLIGHT at startup (the process died mid-attempt) are recovered.
 */
public enum InFlightRecoveryPolicy {
    /**
     * Return the job to PENDING, due immediately. The recorded attempt still counts.
     */
    REQUEUE,
    /**
     * Treat the interrupted attempt as a transient failure: backoff and retry budget apply.
     */
    FAIL_TRANSIENT,
    /**
     * Give up on the job. Use when a duplicate delivery is worse than a lost one.
     */
    FAIL_PERMANENT
}
