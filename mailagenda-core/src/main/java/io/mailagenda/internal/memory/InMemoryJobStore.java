package io.mailagenda.internal.memory;

import io.mailagenda.core.JobFilter;
import io.mailagenda.core.JobOutcome;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.JobState;
import io.mailagenda.core.JobStore;
import io.mailagenda.core.MailJob;
import io.mailagenda.core.SchedulerInvariantViolation;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local {@link io.mailagenda.core.JobStore}. Not durable: jobs are lost with the JVM.
 *
 * <p>Each transition is a single {@link ConcurrentHashMap#compute} on the job id, so the check of
 * the expected state and the write happen atomically.
 */
public class InMemoryJobStore implements JobStore {

    static final Comparator<MailJob> DUE_ORDER = Comparator
            .comparing(MailJob::notBefore)
            .thenComparing(MailJob::createdAt)
            .thenComparing(MailJob::id);

    private static final Comparator<MailJob> CREATION_ORDER = Comparator
            .comparing(MailJob::createdAt)
            .thenComparing(MailJob::id);

    private final ConcurrentHashMap<String, MailJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String create(JobSpec spec, Instant now) {
        return insert(spec, JobState.PENDING, null, now);
    }

    @Override
    public String createRejected(JobSpec spec, String error, Instant now) {
        return insert(spec, JobState.FAILED_PERMANENT, error, now);
    }

    private String insert(JobSpec spec, JobState state, String error, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(now, "now must not be null");

        // zero-padded so that lexical id order is creation order
        String id = String.format("job-%012d", sequence.incrementAndGet());
        MailJob job = new MailJob(
                id,
                spec.recipient(),
                spec.cc(),
                spec.bcc(),
                spec.subjectTemplate(),
                spec.bodyTemplate(),
                spec.variables(),
                spec.attachments(),
                spec.notBefore() != null ? spec.notBefore() : now,
                state,
                0,
                null,
                error,
                null,
                spec.campaignId(),
                now,
                now
        );
        jobs.put(id, job);
        return id;
    }

    @Override
    public Optional<MailJob> find(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<MailJob> fetchDue(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }
        return jobs.values().stream()
                .filter(j -> j.isDue(now))
                .sorted(DUE_ORDER)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public boolean markInFlight(String id, Instant now) {
        return transitionIf(id, JobState.PENDING, JobState.IN_FLIGHT, now);
    }

    @Override
    public MailJob recordAttempt(String id, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        MailJob updated = jobs.computeIfPresent(id, (k, job) -> {
            if (job.state() != JobState.IN_FLIGHT) {
                throw new SchedulerInvariantViolation(
                        "Attempt recorded for job " + id + " in state " + job.state() + ", expected IN_FLIGHT");
            }
            return copy(job, JobState.IN_FLIGHT, job.notBefore(), job.attemptCount() + 1, now,
                    job.lastError(), job.messageId(), now);
        });
        if (updated == null) {
            throw new SchedulerInvariantViolation("Attempt recorded for unknown job " + id);
        }
        return updated;
    }

    @Override
    public void recordResult(String id, JobOutcome outcome, Instant now) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(now, "now must not be null");
        MailJob updated = jobs.computeIfPresent(id, (k, job) -> {
            job.state().checkTransition(id, outcome.state());
            return switch (outcome.state()) {
                case SENT -> copy(job, JobState.SENT, job.notBefore(), job.attemptCount(), job.lastAttemptAt(),
                        job.lastError(), outcome.messageId(), now);
                case FAILED_TRANSIENT -> {
                    if (job.lastAttemptAt() != null && !outcome.retryAt().isAfter(job.lastAttemptAt())) {
                        throw new SchedulerInvariantViolation("Retry of job " + id + " at " + outcome.retryAt()
                                + " is not after its last attempt at " + job.lastAttemptAt());
                    }
                    yield copy(job, JobState.FAILED_TRANSIENT, outcome.retryAt(), job.attemptCount(),
                            job.lastAttemptAt(), outcome.error(), null, now);
                }
                case FAILED_PERMANENT -> copy(job, JobState.FAILED_PERMANENT, job.notBefore(), job.attemptCount(),
                        job.lastAttemptAt(), outcome.error(), null, now);
                default -> throw new SchedulerInvariantViolation(id, job.state(), outcome.state());
            };
        });
        if (updated == null) {
            throw new SchedulerInvariantViolation("Result recorded for unknown job " + id);
        }
    }

    @Override
    public boolean requeue(String id, Instant now) {
        return transitionIf(id, JobState.FAILED_TRANSIENT, JobState.PENDING, now);
    }

    @Override
    public boolean release(String id, Instant now) {
        return transitionIf(id, JobState.IN_FLIGHT, JobState.PENDING, now);
    }

    @Override
    public boolean cancel(String id, Instant now) {
        return transitionIf(id, JobState.PENDING, JobState.CANCELLED, now);
    }

    @Override
    public List<MailJob> list(JobFilter filter) {
        JobFilter f = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
                .filter(f::matches)
                .sorted(CREATION_ORDER)
                .limit(f.limit())
                .collect(Collectors.toList());
    }

    @Override
    public Map<JobState, Long> countByState(String campaignId) {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (MailJob job : jobs.values()) {
            if (campaignId == null || campaignId.equals(job.campaignId())) {
                counts.merge(job.state(), 1L, Long::sum);
            }
        }
        return counts;
    }

    private boolean transitionIf(String id, JobState expected, JobState next, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");
        AtomicBoolean changed = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (k, job) -> {
            if (job.state() != expected) {
                return job;
            }
            changed.set(true);
            return copy(job, next, job.notBefore(), job.attemptCount(), job.lastAttemptAt(),
                    job.lastError(), job.messageId(), now);
        });
        return changed.get();
    }

    private static MailJob copy(MailJob job, JobState state, Instant notBefore, int attemptCount,
                                Instant lastAttemptAt, String lastError, String messageId, Instant updatedAt) {
        return new MailJob(
                job.id(),
                job.recipient(),
                job.cc(),
                job.bcc(),
                job.subjectTemplate(),
                job.bodyTemplate(),
                job.variables(),
                job.attachments(),
                notBefore,
                state,
                attemptCount,
                lastAttemptAt,
                lastError,
                messageId,
                job.campaignId(),
                job.createdAt(),
                updatedAt
        );
    }
}
