package io.mailagenda.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one dispatch attempt, applied to an {@code IN_FLIGHT} job by
 * {@link JobStore#recordResult(String, JobOutcome, Instant)}.
 *
 * @param state     target state: SENT, FAILED_TRANSIENT or FAILED_PERMANENT
 * @param messageId transport message id for SENT, otherwise null
 * @param error     failure detail, null for SENT
 * @param retryAt   next eligible instant for FAILED_TRANSIENT, otherwise null
 */
public record JobOutcome(JobState state, String messageId, String error, Instant retryAt) {

    public JobOutcome {
        Objects.requireNonNull(state, "state must not be null");
        switch (state) {
            case SENT -> {
            }
            case FAILED_TRANSIENT -> Objects.requireNonNull(retryAt, "retryAt is required for a transient failure");
            case FAILED_PERMANENT -> {
            }
            default -> throw new IllegalArgumentException("Not an attempt outcome: " + state);
        }
    }

    public static JobOutcome sent(String messageId) {
        return new JobOutcome(JobState.SENT, messageId, null, null);
    }

    public static JobOutcome transientFailure(String error, Instant retryAt) {
        return new JobOutcome(JobState.FAILED_TRANSIENT, null, error, retryAt);
    }

    public static JobOutcome permanentFailure(String error) {
        return new JobOutcome(JobState.FAILED_PERMANENT, null, error, null);
    }
}
