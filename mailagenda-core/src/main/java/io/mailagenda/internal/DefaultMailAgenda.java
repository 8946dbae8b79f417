package io.mailagenda.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mailagenda.MailAgenda;
import io.mailagenda.MailJobBuilder;
import io.mailagenda.MailTransport;
import io.mailagenda.Renderer;
import io.mailagenda.TimeParser;
import io.mailagenda.config.MailAgendaProperties;
import io.mailagenda.core.CampaignRequest;
import io.mailagenda.core.CampaignResult;
import io.mailagenda.core.CampaignSummary;
import io.mailagenda.core.DeliveryResult;
import io.mailagenda.core.InFlightRecoveryPolicy;
import io.mailagenda.core.JobFilter;
import io.mailagenda.core.JobOutcome;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.JobState;
import io.mailagenda.core.JobStore;
import io.mailagenda.core.MailJob;
import io.mailagenda.core.MailMessage;
import io.mailagenda.core.PassResult;
import io.mailagenda.core.PermanentDeliveryException;
import io.mailagenda.core.RateLimiter;
import io.mailagenda.core.RenderException;
import io.mailagenda.core.SchedulerInvariantViolation;
import io.mailagenda.core.TransientDeliveryException;
import io.mailagenda.utils.AttachmentValidator;
import io.mailagenda.utils.DefaultTimeParser;
import io.mailagenda.utils.EmailAddressValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Store-agnostic scheduler and dispatcher.
 *
 * <p>A scheduling pass fetches a bounded batch of due jobs, oldest due first, and for each one:
 * claims it (PENDING to IN_FLIGHT), waits for a rate-limit slot, counts the attempt, renders the
 * templates and hands the message to the {@link MailTransport}. The transport's answer is
 * classified into SENT, FAILED_TRANSIENT (requeued with backoff while the retry budget lasts) or
 * FAILED_PERMANENT. Failure of one job never affects the others.
 *
 * <p>Typical usage:
 * <pre>{@code
 * agenda.start();
 *
 * agenda.compose("ada@example.com")
 *       .subject("Hello {{ name }}")
 *       .body("Hi {{ name }}, see you tomorrow.")
 *       .variable("name", "Ada")
 *       .schedule("tomorrow 9am")
 *       .submit();
 *
 * agenda.stop();
 * }</pre>
 */
public class DefaultMailAgenda implements MailAgenda {
    private static final Logger log = LoggerFactory.getLogger(DefaultMailAgenda.class);

    private static final int MAX_SYSTEM_ERRORS = 30;

    private final MailAgendaProperties props;
    private final JobStore jobStore;
    private final MailTransport transport;
    private final Renderer renderer;
    private final TimeParser timeParser;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final JobSpecValidator validator;
    private final CampaignExpander campaignExpander;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ReentrantLock passLock = new ReentrantLock();

    private volatile CountDownLatch shutdownSignal = new CountDownLatch(1);
    private ExecutorService workerPool;
    private Semaphore workerSem;
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DefaultMailAgenda(MailAgendaProperties props,
                             JobStore jobStore,
                             MailTransport transport,
                             Renderer renderer,
                             TimeParser timeParser,
                             RateLimiter rateLimiter,
                             RetryPolicy retryPolicy,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.timeParser = Objects.requireNonNull(timeParser, "timeParser must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.validator = new JobSpecValidator(renderer);
        this.campaignExpander = new CampaignExpander(
                jobStore,
                validator,
                Objects.requireNonNull(objectMapper, "objectMapper must not be null"),
                props.getInvalidRowPolicy()
        );
        if (props.getBatchSize() <= 0) {
            throw new IllegalArgumentException("mail-agenda.batch-size must be a positive number");
        }
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("mail-agenda.max-concurrency must be a positive number");
        }
    }

    /**
     * Wire the default collaborators: placeholder templates, the configured timezone, a sliding
     * window rate limiter and the configured retry policy.
     */
    public DefaultMailAgenda(MailAgendaProperties props, JobStore jobStore, MailTransport transport, Clock clock) {
        this(
                props,
                jobStore,
                transport,
                new PlaceholderRenderer(),
                new DefaultTimeParser(props.getTimezone()),
                SlidingWindowRateLimiter.from(props, clock),
                RetryPolicy.from(props),
                new ObjectMapper(),
                clock
        );
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "mail-agenda.process-every must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("mail-agenda.process-every must be a positive duration");
        }

        log.info("MailAgenda starting with processEvery={}, batchSize={}, maxConcurrency={}, ratePerWindow={}, rateWindow={}, maxAttempts={}, inFlightRecovery={}",
                props.getProcessEvery(),
                props.getBatchSize(),
                props.getMaxConcurrency(),
                props.getRatePerWindow(),
                props.getRateWindow(),
                retryPolicy.maxAttempts(),
                props.getInFlightRecovery());

        shutdownSignal = new CountDownLatch(1);
        systemErrorCount = 0;
        try {
            recover();

            if (pollerThread == null) {
                pollerThread = new Thread(this::pollerLoop);
                pollerThread.setName("mail-agenda.poller");
                pollerThread.setDaemon(true);
                pollerThread.start();
            }
        } catch (RuntimeException e) {
            started.set(false);
            log.error("MailAgenda failed to start msg={}", e.getMessage(), e);
            throw e;
        }
        log.info("MailAgenda started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("MailAgenda stopping...");
        shutdownSignal.countDown();

        Duration timeout = props.getShutdownTimeout();
        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null && poller != Thread.currentThread()) {
            try {
                poller.join(timeout.toMillis());
                if (poller.isAlive()) {
                    log.warn("MailAgenda poller did not finish within shutdownTimeout={}, interrupting", timeout);
                    poller.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                poller.interrupt();
            }
        }

        synchronized (this) {
            if (workerPool != null) {
                workerPool.shutdown();
                try {
                    if (!workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                        workerPool.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    workerPool.shutdownNow();
                } finally {
                    workerPool = null;
                    workerSem = null;
                }
            }
        }
        // the poller is gone; runOnce() may still be driven directly
        shutdownSignal = new CountDownLatch(1);
        log.info("MailAgenda stopped successfully.");
    }

    /**
     * Create a builder for one email. Nothing is persisted until submit() is called.
     */
    @Override
    public MailJobBuilder compose(String recipient) {
        return new SimpleMailJobBuilder(recipient, timeParser, clock, this::submit);
    }

    @Override
    public String submit(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        validator.check(spec);

        Instant now = clock.instant();
        String id = jobStore.create(spec, now);
        log.info("MailAgenda job submitted id={} recipient={} notBefore={} campaignId={}",
                id,
                EmailAddressValidator.mask(spec.recipient()),
                spec.notBefore() != null ? spec.notBefore() : now,
                spec.campaignId());
        return id;
    }

    @Override
    public CampaignResult submitCampaign(CampaignRequest request) {
        return campaignExpander.expand(request, clock.instant());
    }

    @Override
    public List<MailJob> list(JobFilter filter) {
        return jobStore.list(filter == null ? JobFilter.all() : filter);
    }

    @Override
    public Optional<MailJob> find(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return jobStore.find(jobId);
    }

    @Override
    public boolean cancel(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        boolean cancelled = jobStore.cancel(jobId, clock.instant());
        if (cancelled) {
            log.info("MailAgenda job cancelled id={}", jobId);
        } else {
            log.debug("MailAgenda job not cancellable id={}", jobId);
        }
        return cancelled;
    }

    @Override
    public CampaignSummary summarize(String campaignId) {
        Objects.requireNonNull(campaignId, "campaignId must not be null");
        return new CampaignSummary(campaignId, jobStore.countByState(campaignId));
    }

    @Override
    public Map<JobState, Long> stats() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            counts.put(s, 0L);
        }
        counts.putAll(jobStore.countByState(null));
        return counts;
    }

    @Override
    public PassResult runOnce() {
        passLock.lock();
        try {
            return runPass();
        } finally {
            passLock.unlock();
        }
    }

    @Override
    public int recover() {
        passLock.lock();
        try {
            Instant now = clock.instant();
            Set<String> recovered = new LinkedHashSet<>();

            for (MailJob job : jobStore.list(JobFilter.byState(JobState.IN_FLIGHT))) {
                if (recoverInFlight(job, now)) {
                    recovered.add(job.id());
                }
            }
            for (MailJob job : jobStore.list(JobFilter.byState(JobState.FAILED_TRANSIENT))) {
                if (jobStore.requeue(job.id(), now)) {
                    recovered.add(job.id());
                }
            }

            if (!recovered.isEmpty()) {
                log.info("MailAgenda recovered jobs count={} policy={}", recovered.size(), props.getInFlightRecovery());
            }
            return recovered.size();
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Wait for {@code wait} before the next attempt. Returns false when shutdown was requested
     * during the wait, in which case the attempt must not be made.
     */
    protected boolean pause(Duration wait) {
        try {
            return !shutdownSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean recoverInFlight(MailJob job, Instant now) {
        InFlightRecoveryPolicy policy = props.getInFlightRecovery();
        // no attempt was made before the crash: nothing to charge against the budget
        if (policy == InFlightRecoveryPolicy.REQUEUE || job.attemptCount() == 0) {
            boolean released = jobStore.release(job.id(), now);
            log.info("MailAgenda in-flight job released id={} attempts={}", job.id(), job.attemptCount());
            return released;
        }

        String error = "Attempt interrupted by restart";
        JobOutcome outcome;
        if (policy == InFlightRecoveryPolicy.FAIL_PERMANENT) {
            outcome = JobOutcome.permanentFailure(error);
        } else {
            Instant failedAt = job.lastAttemptAt() != null && job.lastAttemptAt().isAfter(now)
                    ? job.lastAttemptAt()
                    : now;
            outcome = transientOrExhausted(job, error, failedAt);
        }
        jobStore.recordResult(job.id(), outcome, now);
        log.warn("MailAgenda in-flight job recovered id={} attempts={} state={}", job.id(), job.attemptCount(), outcome.state());
        return true;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                PassResult result = runOnce();
                backlog = result.fetched() >= props.getBatchSize() && result.released() == 0;
                systemErrorCount = 0;
            } catch (SchedulerInvariantViolation e) {
                log.error("MailAgenda scheduling pass aborted by invariant violation msg={}", e.getMessage(), e);
                backlog = false;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("MailAgenda pass failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("MailAgenda stopped due to repeated system failures...");
                    pollerThread = null;
                    stop();
                    break;
                }

                Duration sleep = (systemErrorCount >= 10) ? Duration.ofSeconds(60) : backoff(systemErrorCount);
                if (!sleepUnlessStopped(sleep)) {
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }
            if (backlog) {
                continue;
            }
            if (!sleepUnlessStopped(props.getProcessEvery())) {
                break;
            }
        }
    }

    private boolean sleepUnlessStopped(Duration sleep) {
        try {
            return !shutdownSignal.await(sleep.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Exponential backoff for repeated pass failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private PassResult runPass() {
        Instant now = clock.instant();
        List<MailJob> due = jobStore.fetchDue(now, props.getBatchSize());
        if (due.isEmpty()) {
            return PassResult.empty();
        }
        log.debug("MailAgenda fetched due jobs count={} now={}", due.size(), now);

        Tally tally = new Tally(due.size());
        List<Future<?>> pending = new ArrayList<>();

        for (MailJob job : due) {
            if (!jobStore.markInFlight(job.id(), clock.instant())) {
                log.debug("MailAgenda job already claimed id={}", job.id());
                continue;
            }
            tally.claimed.incrementAndGet();

            Duration wait = rateLimiter.acquire();
            boolean proceed = wait.isZero() ? shutdownSignal.getCount() > 0 : pause(wait);
            if (!proceed) {
                jobStore.release(job.id(), clock.instant());
                tally.released.incrementAndGet();
                log.info("MailAgenda shutdown requested, claim released id={}", job.id());
                break;
            }

            if (props.getMaxConcurrency() <= 1) {
                tally.count(attempt(job));
            } else {
                pending.add(submitToWorker(job, tally));
            }
        }

        awaitAll(pending);
        PassResult result = tally.toResult();
        log.info("MailAgenda pass finished fetched={} claimed={} sent={} retried={} failed={} released={}",
                result.fetched(), result.claimed(), result.sent(), result.retried(), result.failed(), result.released());
        return result;
    }

    private Future<?> submitToWorker(MailJob job, Tally tally) {
        ExecutorService pool;
        Semaphore sem;
        synchronized (this) {
            if (workerPool == null) {
                workerSem = new Semaphore(props.getMaxConcurrency());
                workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                    Thread t = new Thread(r);
                    t.setName("mail-agenda.worker");
                    t.setDaemon(true);
                    return t;
                });
            }
            pool = workerPool;
            sem = workerSem;
        }

        sem.acquireUninterruptibly();
        try {
            return pool.submit(() -> {
                try {
                    tally.count(attempt(job));
                } finally {
                    sem.release();
                }
            });
        } catch (RuntimeException e) {
            sem.release();
            throw e;
        }
    }

    private void awaitAll(List<Future<?>> futures) {
        RuntimeException failure = null;
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for deliveries", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                RuntimeException rte = cause instanceof RuntimeException re
                        ? re
                        : new IllegalStateException(cause);
                if (failure == null) {
                    failure = rte;
                } else {
                    failure.addSuppressed(rte);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * One attempt on a claimed job. Returns the state the job ended in.
     */
    private JobState attempt(MailJob claimed) {
        MailJob job = jobStore.recordAttempt(claimed.id(), clock.instant());
        String recipient = EmailAddressValidator.mask(job.recipient());
        log.debug("MailAgenda attempt started id={} recipient={} attempt={}", job.id(), recipient, job.attemptCount());

        JobOutcome outcome = deliver(job);
        jobStore.recordResult(job.id(), outcome, clock.instant());

        switch (outcome.state()) {
            case SENT -> log.info("MailAgenda job sent id={} recipient={} attempt={} messageId={}",
                    job.id(), recipient, job.attemptCount(), outcome.messageId());
            case FAILED_TRANSIENT -> {
                log.warn("MailAgenda job failed transiently id={} recipient={} attempt={} retryAt={} msg={}",
                        job.id(), recipient, job.attemptCount(), outcome.retryAt(), outcome.error());
                jobStore.requeue(job.id(), clock.instant());
            }
            default -> log.error("MailAgenda job failed permanently id={} recipient={} attempt={} msg={}",
                    job.id(), recipient, job.attemptCount(), outcome.error());
        }
        return outcome.state();
    }

    private JobOutcome deliver(MailJob job) {
        try {
            String subject = renderer.render(job.subjectTemplate(), job.variables());
            String body = renderer.render(job.bodyTemplate(), job.variables());
            MailMessage message = new MailMessage(
                    job.id(),
                    job.cc(),
                    job.bcc(),
                    subject,
                    body,
                    renderer.isHtml(body),
                    resolveAttachments(job)
            );

            DeliveryResult result = transport.deliver(message, job.recipient());
            if (result == null) {
                return JobOutcome.permanentFailure("Transport returned no result");
            }
            return switch (result.status()) {
                case OK -> JobOutcome.sent(result.messageId());
                case TRANSIENT_ERROR -> transientOrExhausted(job, result.error(), clock.instant());
                case PERMANENT_ERROR -> JobOutcome.permanentFailure(result.error());
            };
        } catch (SchedulerInvariantViolation e) {
            throw e;
        } catch (RenderException e) {
            return JobOutcome.permanentFailure("Render failed (" + e.reason() + "): " + e.getMessage());
        } catch (TransientDeliveryException e) {
            return transientOrExhausted(job, e.getMessage(), clock.instant());
        } catch (PermanentDeliveryException e) {
            return JobOutcome.permanentFailure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("MailAgenda transport raised an unexpected error id={} msg={}", job.id(), e.getMessage(), e);
            return JobOutcome.permanentFailure("Unexpected delivery error: " + e);
        }
    }

    private List<Path> resolveAttachments(MailJob job) {
        List<Path> files = new ArrayList<>(job.attachments().size());
        for (String file : job.attachments()) {
            var problem = AttachmentValidator.validate(file);
            if (problem.isPresent()) {
                throw new PermanentDeliveryException("Attachment unavailable: " + problem.get().message());
            }
            files.add(Path.of(file));
        }
        return files;
    }

    private JobOutcome transientOrExhausted(MailJob job, String error, Instant failedAt) {
        if (retryPolicy.hasAttemptsLeft(job.attemptCount())) {
            return JobOutcome.transientFailure(error, retryPolicy.nextAttemptAt(job.attemptCount(), failedAt));
        }
        return JobOutcome.permanentFailure(
                "Retry budget exhausted after " + job.attemptCount() + " attempts: " + error);
    }

    private static final class Tally {
        private final int fetched;
        private final AtomicInteger claimed = new AtomicInteger();
        private final AtomicInteger sent = new AtomicInteger();
        private final AtomicInteger retried = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger released = new AtomicInteger();

        private Tally(int fetched) {
            this.fetched = fetched;
        }

        private void count(JobState state) {
            switch (state) {
                case SENT -> sent.incrementAndGet();
                case FAILED_TRANSIENT -> retried.incrementAndGet();
                default -> failed.incrementAndGet();
            }
        }

        private PassResult toResult() {
            return new PassResult(fetched, claimed.get(), sent.get(), retried.get(), failed.get(), released.get());
        }
    }
}
