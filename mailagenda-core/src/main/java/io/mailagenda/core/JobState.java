package io.mailagenda.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link MailJob}.
 *
 * <p>Legal transitions:
 * <pre>
 * PENDING          -> IN_FLIGHT, CANCELLED
 * IN_FLIGHT        -> SENT, FAILED_TRANSIENT, FAILED_PERMANENT, PENDING (claim released before the attempt)
 * FAILED_TRANSIENT -> PENDING
 * </pre>
 * SENT, FAILED_PERMANENT and CANCELLED are terminal.
 */
public enum JobState {

    PENDING {
        @Override
        public Set<JobState> successors() {
            return EnumSet.of(IN_FLIGHT, CANCELLED);
        }
    },
    IN_FLIGHT {
        @Override
        public Set<JobState> successors() {
            return EnumSet.of(SENT, FAILED_TRANSIENT, FAILED_PERMANENT, PENDING);
        }
    },
    SENT,
    FAILED_TRANSIENT {
        @Override
        public Set<JobState> successors() {
            return EnumSet.of(PENDING);
        }
    },
    FAILED_PERMANENT,
    CANCELLED;

    /**
     * States reachable in one step. Empty for terminal states.
     */
    public Set<JobState> successors() {
        return EnumSet.noneOf(JobState.class);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    public boolean canTransitionTo(JobState next) {
        return next != null && successors().contains(next);
    }

    /**
     * Throws {@link SchedulerInvariantViolation} unless {@code this -> next} is a legal transition.
     */
    public void checkTransition(String jobId, JobState next) {
        if (!canTransitionTo(next)) {
            throw new SchedulerInvariantViolation(jobId, this, next);
        }
    }
}
