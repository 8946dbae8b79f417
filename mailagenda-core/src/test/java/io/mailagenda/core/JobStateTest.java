package io.mailagenda.core;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStateTest {

    @Test
    void terminalStatesShouldHaveNoSuccessors() {
        for (JobState s : EnumSet.of(JobState.SENT, JobState.FAILED_PERMANENT, JobState.CANCELLED)) {
            assertTrue(s.isTerminal(), s.name());
            for (JobState next : JobState.values()) {
                assertFalse(s.canTransitionTo(next), s + " -> " + next);
            }
        }
    }

    @Test
    void pendingShouldOnlyMoveToInFlightOrCancelled() {
        assertEquals(EnumSet.of(JobState.IN_FLIGHT, JobState.CANCELLED), JobState.PENDING.successors());
        assertFalse(JobState.PENDING.canTransitionTo(JobState.SENT));
    }

    @Test
    void inFlightMayBeReleasedBackToPending() {
        assertTrue(JobState.IN_FLIGHT.canTransitionTo(JobState.PENDING));
        assertFalse(JobState.IN_FLIGHT.canTransitionTo(JobState.CANCELLED));
    }

    @Test
    void failedTransientShouldOnlyBeRequeued() {
        assertEquals(EnumSet.of(JobState.PENDING), JobState.FAILED_TRANSIENT.successors());
    }

    @Test
    void checkTransitionShouldReportIllegalMove() {
        SchedulerInvariantViolation e = assertThrows(SchedulerInvariantViolation.class,
                () -> JobState.SENT.checkTransition("job-1", JobState.PENDING));

        assertEquals("job-1", e.jobId());
        assertEquals(JobState.SENT, e.from());
        assertEquals(JobState.PENDING, e.to());
    }
}
