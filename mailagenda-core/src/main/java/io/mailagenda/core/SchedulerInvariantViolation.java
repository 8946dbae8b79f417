package io.mailagenda.core;

/**
 * An illegal state transition was attempted.
 *
 * <p>Indicates a concurrency or logic bug. The dispatch engine never catches it: the running
 * scheduling pass is aborted.
 */
public class SchedulerInvariantViolation extends IllegalStateException {

    private final String jobId;
    private final JobState from;
    private final JobState to;

    public SchedulerInvariantViolation(String jobId, JobState from, JobState to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public SchedulerInvariantViolation(String message) {
        super(message);
        this.jobId = null;
        this.from = null;
        this.to = null;
    }

    public String jobId() {
        return jobId;
    }

    public JobState from() {
        return from;
    }

    public JobState to() {
        return to;
    }
}
