package io.mailagenda.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable table of delivery jobs; the single source of truth for job state.
 *
 * <p>Every state-changing method is a single conditional update on (id, expected state). Two
 * dispatchers racing on the same job cannot both win {@link #markInFlight(String, Instant)}.
 *
 * <p>Ordering of {@link #fetchDue(Instant, int)}: {@code notBefore} ascending, then
 * {@code createdAt} ascending, then id.
 */
public interface JobStore {

    /**
     * Persist a validated spec as a new PENDING job and return its id. Ids are never reused.
     */
    String create(JobSpec spec, Instant now);

    /**
     * Persist a spec that failed validation as a FAILED_PERMANENT job carrying {@code error}.
     * The {@code JobSpec} is stored as given, even with a blank recipient.
     */
    String createRejected(JobSpec spec, String error, Instant now);

    Optional<MailJob> find(String id);

    /**
     * PENDING jobs with {@code notBefore <= now}, oldest due first, at most {@code limit}.
     */
    List<MailJob> fetchDue(Instant now, int limit);

    /**
     * PENDING to IN_FLIGHT. Returns false when the job is no longer PENDING.
     */
    boolean markInFlight(String id, Instant now);

    /**
     * Count one dispatch attempt on an IN_FLIGHT job. Called immediately before the attempt.
     *
     * @return the job after the increment
     * @throws SchedulerInvariantViolation if the job is not IN_FLIGHT
     */
    MailJob recordAttempt(String id, Instant now);

    /**
     * Apply the outcome of an attempt to an IN_FLIGHT job.
     *
     * @throws SchedulerInvariantViolation if the job is not IN_FLIGHT
     */
    void recordResult(String id, JobOutcome outcome, Instant now);

    /**
     * FAILED_TRANSIENT to PENDING, keeping the {@code notBefore} chosen by the transient outcome.
     */
    boolean requeue(String id, Instant now);

    /**
     * IN_FLIGHT to PENDING for a claim whose attempt was never issued.
     */
    boolean release(String id, Instant now);

    /**
     * PENDING to CANCELLED. Returns false for any other state.
     */
    boolean cancel(String id, Instant now);

    List<MailJob> list(JobFilter filter);

    /**
     * Number of jobs per state, restricted to one campaign when {@code campaignId} is not null.
     */
    Map<JobState, Long> countByState(String campaignId);
}
