package io.mailagenda.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mailagenda.MailTransport;
import io.mailagenda.MutableClock;
import io.mailagenda.config.MailAgendaProperties;
import io.mailagenda.core.CampaignRequest;
import io.mailagenda.core.CampaignResult;
import io.mailagenda.core.CampaignSummary;
import io.mailagenda.core.DeliveryResult;
import io.mailagenda.core.InFlightRecoveryPolicy;
import io.mailagenda.core.JobFilter;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.JobState;
import io.mailagenda.core.MailJob;
import io.mailagenda.core.MailMessage;
import io.mailagenda.core.PassResult;
import io.mailagenda.core.TransientDeliveryException;
import io.mailagenda.core.ValidationException;
import io.mailagenda.internal.memory.InMemoryJobStore;
import io.mailagenda.utils.DefaultTimeParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultMailAgendaTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore store;
    private RecordingTransport transport;
    private MailAgendaProperties props;
    private TestAgenda agenda;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryJobStore();
        transport = new RecordingTransport(clock);
        props = new MailAgendaProperties();
    }

    @AfterEach
    void tearDown() {
        if (agenda != null) {
            agenda.stop();
        }
    }

    private TestAgenda agenda() {
        agenda = new TestAgenda(props, store, transport, clock);
        return agenda;
    }

    private String submitTo(String recipient) {
        return agenda.compose(recipient)
                .subject("Hi {{ name }}")
                .body("Hello {{ name }}, see you soon.")
                .variable("name", "Ada")
                .submit();
    }

    @Test
    void dueJobShouldBeSentOnFirstAttempt() {
        agenda();
        String id = submitTo("ada@example.com");

        PassResult result = agenda.runOnce();

        assertEquals(1, result.sent());
        assertEquals(1, result.claimed());
        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.SENT, job.state());
        assertEquals(1, job.attemptCount());
        assertEquals("<" + id + "@test>", job.messageId());

        Delivery delivery = transport.deliveries.get(0);
        assertEquals("ada@example.com", delivery.recipient());
        assertEquals("Hi Ada", delivery.message().subject());
        assertEquals("Hello Ada, see you soon.", delivery.message().body());
        assertFalse(delivery.message().html());
    }

    @Test
    void sentJobShouldNeverBeAttemptedAgain() {
        agenda();
        submitTo("ada@example.com");
        agenda.runOnce();

        clock.advance(Duration.ofDays(1));
        PassResult again = agenda.runOnce();

        assertEquals(0, again.fetched());
        assertEquals(1, transport.deliveries.size());
    }

    @Test
    void transientFailuresShouldBeRetriedWithGrowingBackoff() {
        agenda();
        String id = submitTo("ada@example.com");
        transport.script("ada@example.com",
                DeliveryResult.transientError("421 try again later"),
                new TransientDeliveryException("connection reset"));

        List<Instant> notBefores = new ArrayList<>();
        notBefores.add(agenda.find(id).orElseThrow().notBefore());
        for (int i = 0; i < 3; i++) {
            clock.set(agenda.find(id).orElseThrow().notBefore());
            agenda.runOnce();
            MailJob job = agenda.find(id).orElseThrow();
            if (job.state() == JobState.PENDING) {
                notBefores.add(job.notBefore());
            }
        }

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.SENT, job.state());
        assertEquals(3, job.attemptCount());
        assertEquals(List.of(T0, T0.plusSeconds(60), T0.plusSeconds(180)), notBefores);
        assertEquals(3, transport.deliveries.size());
    }

    @Test
    void transientJobShouldNotBeAttemptedBeforeBackoffElapses() {
        agenda();
        String id = submitTo("ada@example.com");
        transport.script("ada@example.com", DeliveryResult.transientError("busy"));

        PassResult first = agenda.runOnce();
        clock.advance(Duration.ofSeconds(59));
        PassResult early = agenda.runOnce();

        assertEquals(1, first.retried());
        assertEquals(0, early.fetched());
        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.PENDING, job.state());
        assertEquals("busy", job.lastError());
    }

    @Test
    void exhaustedRetryBudgetShouldFailPermanently() {
        props.setMaxAttempts(2);
        agenda();
        String id = submitTo("ada@example.com");
        transport.script("ada@example.com",
                DeliveryResult.transientError("451 greylisted"),
                DeliveryResult.transientError("451 greylisted"),
                DeliveryResult.ok("never"));

        agenda.runOnce();
        clock.set(agenda.find(id).orElseThrow().notBefore());
        PassResult last = agenda.runOnce();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(1, last.failed());
        assertEquals(JobState.FAILED_PERMANENT, job.state());
        assertEquals(2, job.attemptCount());
        assertEquals("Retry budget exhausted after 2 attempts: 451 greylisted", job.lastError());

        clock.advance(Duration.ofDays(1));
        agenda.runOnce();
        assertEquals(2, transport.deliveries.size());
    }

    @Test
    void permanentFailureShouldNotBeRetried() {
        agenda();
        String id = submitTo("ada@example.com");
        transport.script("ada@example.com", DeliveryResult.permanentError("550 mailbox unavailable"));

        agenda.runOnce();
        clock.advance(Duration.ofHours(2));
        agenda.runOnce();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.FAILED_PERMANENT, job.state());
        assertEquals("550 mailbox unavailable", job.lastError());
        assertEquals(1, transport.deliveries.size());
    }

    @Test
    void unexpectedTransportErrorShouldFailPermanently() {
        agenda();
        String id = submitTo("ada@example.com");
        transport.script("ada@example.com", new IllegalStateException("boom"));

        PassResult result = agenda.runOnce();

        assertEquals(1, result.failed());
        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.FAILED_PERMANENT, job.state());
        assertTrue(job.lastError().contains("boom"));
    }

    @Test
    void renderFailureAtDispatchShouldFailWithoutCallingTransport() {
        agenda();
        // bypasses submit-time validation
        String id = store.create(new JobSpec("ada@example.com", List.of(), List.of(), "Hi {{ name }}", "Hello",
                Map.of(), List.of(), T0, null), T0);

        agenda.runOnce();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.FAILED_PERMANENT, job.state());
        assertEquals(1, job.attemptCount());
        assertTrue(job.lastError().contains("MISSING_VARIABLE"));
        assertTrue(transport.deliveries.isEmpty());
    }

    @Test
    void vanishedAttachmentShouldFailPermanently() {
        agenda();
        String id = store.create(new JobSpec("ada@example.com", List.of(), List.of(), "Hi", "Hello",
                Map.of(), List.of("/no/such/report.pdf"), T0, null), T0);

        agenda.runOnce();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.FAILED_PERMANENT, job.state());
        assertTrue(job.lastError().startsWith("Attachment unavailable"));
        assertTrue(transport.deliveries.isEmpty());
    }

    @Test
    void invalidSubmissionShouldBeRejectedBeforeCreation() {
        agenda();

        ValidationException badAddress = assertThrows(ValidationException.class,
                () -> agenda.compose("ada@gamil.com").subject("Hi").body("Hello").submit());
        assertEquals("recipient", badAddress.problems().get(0).field());

        assertThrows(ValidationException.class,
                () -> agenda.compose("ada@example.com").subject("Hi {{ name }}").body("Hello").submit());

        assertTrue(agenda.list(null).isEmpty());
    }

    @Test
    void futureJobShouldWaitUntilDue() {
        agenda();
        String id = agenda.compose("ada@example.com")
                .subject("Reminder")
                .body("Meeting in one hour")
                .schedule("in 2 hours")
                .submit();

        assertEquals(0, agenda.runOnce().fetched());

        clock.advance(Duration.ofHours(2));
        agenda.runOnce();

        assertEquals(JobState.SENT, agenda.find(id).orElseThrow().state());
    }

    @Test
    void cancelledJobShouldNeverBeSent() {
        agenda();
        String id = agenda.compose("ada@example.com")
                .subject("Reminder")
                .body("Later")
                .schedule(T0.plus(Duration.ofHours(1)))
                .submit();

        assertTrue(agenda.cancel(id));
        assertFalse(agenda.cancel(id));
        assertFalse(agenda.cancel("unknown-job"));

        clock.advance(Duration.ofHours(2));
        agenda.runOnce();

        assertEquals(JobState.CANCELLED, agenda.find(id).orElseThrow().state());
        assertTrue(transport.deliveries.isEmpty());
    }

    @Test
    void oneFailingJobShouldNotAffectOthers() {
        agenda();
        String a = submitTo("a@example.com");
        String b = submitTo("b@example.com");
        String c = submitTo("c@example.com");
        transport.script("b@example.com", new RuntimeException("socket closed"));

        PassResult result = agenda.runOnce();

        assertEquals(2, result.sent());
        assertEquals(1, result.failed());
        assertEquals(JobState.SENT, agenda.find(a).orElseThrow().state());
        assertEquals(JobState.FAILED_PERMANENT, agenda.find(b).orElseThrow().state());
        assertEquals(JobState.SENT, agenda.find(c).orElseThrow().state());
    }

    @Test
    void dueJobsShouldBeAttemptedOldestFirst() {
        agenda();
        store.create(spec("late@example.com", T0.minusSeconds(10)), T0);
        store.create(spec("early@example.com", T0.minusSeconds(300)), T0);
        store.create(spec("middle@example.com", T0.minusSeconds(60)), T0);

        agenda.runOnce();

        assertEquals(List.of("early@example.com", "middle@example.com", "late@example.com"),
                transport.deliveries.stream().map(Delivery::recipient).toList());
    }

    @Test
    void sendsShouldRespectRateLimitWindow() {
        agenda();
        for (int i = 0; i < 10; i++) {
            store.create(spec("user" + i + "@example.com", T0), T0);
        }

        PassResult result = agenda.runOnce();

        assertEquals(10, result.sent());
        assertEquals(List.of(Duration.ofSeconds(60)), agenda.pauses);
        List<Instant> sentAt = transport.deliveries.stream().map(Delivery::at).toList();
        for (int i = 0; i + 8 < sentAt.size(); i++) {
            assertTrue(Duration.between(sentAt.get(i), sentAt.get(i + 8)).compareTo(Duration.ofSeconds(60)) >= 0);
        }
    }

    @Test
    void batchSizeShouldBoundOnePass() {
        props.setBatchSize(3);
        agenda();
        for (int i = 0; i < 5; i++) {
            store.create(spec("user" + i + "@example.com", T0), T0);
        }

        assertEquals(3, agenda.runOnce().fetched());
        assertEquals(2, agenda.runOnce().fetched());
    }

    @Test
    void shutdownDuringRateLimitWaitShouldReleaseClaim() {
        props.setRatePerWindow(1);
        agenda();
        String first = submitTo("a@example.com");
        String second = submitTo("b@example.com");
        agenda.abortPauses = true;

        PassResult result = agenda.runOnce();

        assertEquals(1, result.sent());
        assertEquals(1, result.released());
        assertEquals(JobState.SENT, agenda.find(first).orElseThrow().state());
        MailJob released = agenda.find(second).orElseThrow();
        assertEquals(JobState.PENDING, released.state());
        assertEquals(0, released.attemptCount());
    }

    @Test
    void recoveryShouldRetryInterruptedAttemptByDefault() {
        agenda();
        String attempted = store.create(spec("a@example.com", T0), T0);
        store.markInFlight(attempted, T0);
        store.recordAttempt(attempted, T0);
        String claimedOnly = store.create(spec("b@example.com", T0), T0);
        store.markInFlight(claimedOnly, T0);
        clock.advance(Duration.ofMinutes(5));

        int recovered = agenda.recover();

        assertEquals(2, recovered);
        MailJob retried = agenda.find(attempted).orElseThrow();
        assertEquals(JobState.PENDING, retried.state());
        assertEquals(1, retried.attemptCount());
        assertEquals(clock.instant().plusSeconds(60), retried.notBefore());
        assertEquals("Attempt interrupted by restart", retried.lastError());

        MailJob released = agenda.find(claimedOnly).orElseThrow();
        assertEquals(JobState.PENDING, released.state());
        assertEquals(0, released.attemptCount());
    }

    @Test
    void recoveryWithRequeuePolicyShouldKeepSchedule() {
        props.setInFlightRecovery(InFlightRecoveryPolicy.REQUEUE);
        agenda();
        String id = store.create(spec("a@example.com", T0), T0);
        store.markInFlight(id, T0);
        store.recordAttempt(id, T0);

        agenda.recover();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.PENDING, job.state());
        assertEquals(T0, job.notBefore());
    }

    @Test
    void recoveryWithFailPermanentPolicyShouldCloseAttemptedJobs() {
        props.setInFlightRecovery(InFlightRecoveryPolicy.FAIL_PERMANENT);
        agenda();
        String id = store.create(spec("a@example.com", T0), T0);
        store.markInFlight(id, T0);
        store.recordAttempt(id, T0);

        agenda.recover();

        assertEquals(JobState.FAILED_PERMANENT, agenda.find(id).orElseThrow().state());
    }

    @Test
    void recoveryShouldRespectRetryBudget() {
        props.setMaxAttempts(1);
        agenda();
        String id = store.create(spec("a@example.com", T0), T0);
        store.markInFlight(id, T0);
        store.recordAttempt(id, T0);

        agenda.recover();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals(JobState.FAILED_PERMANENT, job.state());
        assertTrue(job.lastError().startsWith("Retry budget exhausted after 1 attempts"));
    }

    @Test
    void campaignSummaryShouldCountOutcomes() {
        agenda();
        CampaignResult campaign = agenda.submitCampaign(CampaignRequest.of(
                "Hi {{ name }}",
                "Hello {{ name }}",
                List.of(
                        Map.of("email", "a@example.com", "name", "A"),
                        Map.of("email", "b@example.com", "name", "B"),
                        Map.of("name", "Nobody"))
        ).withCampaignId("launch"));
        transport.script("b@example.com", DeliveryResult.permanentError("550 rejected"));

        CampaignSummary before = agenda.summarize("launch");
        agenda.runOnce();
        CampaignSummary after = agenda.summarize("launch");

        assertEquals(2, campaign.acceptedJobs().size());
        assertEquals(2, before.pending());
        assertFalse(before.isComplete());
        assertEquals(1, after.sent());
        assertEquals(2, after.failed());
        assertEquals(3, after.total());
        assertTrue(after.isComplete());

        Map<JobState, Long> stats = agenda.stats();
        assertEquals(1L, stats.get(JobState.SENT));
        assertEquals(0L, stats.get(JobState.CANCELLED));
    }

    @Test
    void workerPoolShouldDeliverEveryJob() {
        props.setMaxConcurrency(4);
        props.setRatePerWindow(100);
        agenda();
        for (int i = 0; i < 12; i++) {
            store.create(spec("user" + i + "@example.com", T0), T0);
        }

        PassResult result = agenda.runOnce();

        assertEquals(12, result.sent());
        assertEquals(12, transport.deliveries.size());
        assertEquals(12L, agenda.stats().get(JobState.SENT));
    }

    @Test
    void startedAgendaShouldDeliverInBackground() throws Exception {
        props.setProcessEvery(Duration.ofMillis(20));
        agenda();
        String id = submitTo("ada@example.com");

        agenda.start();
        agenda.start();

        boolean reached = waitUntil(5, TimeUnit.SECONDS, () -> !transport.deliveries.isEmpty());
        agenda.stop();
        agenda.stop();

        assertTrue(reached);
        assertEquals(JobState.SENT, agenda.find(id).orElseThrow().state());
    }

    @Test
    void failedStartShouldLeaveAgendaRestartable() throws Exception {
        props.setProcessEvery(Duration.ofMillis(20));
        store = new UnreachableOnceStore();
        agenda();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> agenda.start());
        assertEquals("store unreachable", e.getMessage());

        agenda.start();
        String id = submitTo("ada@example.com");

        boolean reached = waitUntil(5, TimeUnit.SECONDS, () -> !transport.deliveries.isEmpty());
        agenda.stop();

        assertTrue(reached);
        assertEquals(JobState.SENT, agenda.find(id).orElseThrow().state());
    }

    @Test
    void runOnceAfterStopShouldStillDeliver() {
        agenda();
        agenda.start();
        agenda.stop();

        String id = submitTo("ada@example.com");
        PassResult result = agenda.runOnce();

        assertEquals(1, result.sent());
        assertEquals(0, result.released());
        assertEquals(JobState.SENT, agenda.find(id).orElseThrow().state());
    }

    @Test
    void addressesShouldBeStoredAndDeliveredTrimmed() {
        agenda();
        String id = agenda.compose(" ada@example.com ")
                .cc("\tgrace@example.com ")
                .bcc(" linus@example.com")
                .subject("Hi")
                .body("Hello")
                .submit();

        MailJob job = agenda.find(id).orElseThrow();
        assertEquals("ada@example.com", job.recipient());

        agenda.runOnce();

        Delivery delivery = transport.deliveries.get(0);
        assertEquals("ada@example.com", delivery.recipient());
        assertEquals(List.of("grace@example.com"), delivery.message().cc());
        assertEquals(List.of("linus@example.com"), delivery.message().bcc());
    }

    private static JobSpec spec(String recipient, Instant notBefore) {
        return new JobSpec(recipient, List.of(), List.of(), "Hi", "Hello", Map.of(), List.of(), notBefore, null);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }

    /**
     * Advances the test clock instead of sleeping.
     */
    static final class TestAgenda extends DefaultMailAgenda {
        private final MutableClock clock;
        final List<Duration> pauses = new CopyOnWriteArrayList<>();
        volatile boolean abortPauses;

        TestAgenda(MailAgendaProperties props, InMemoryJobStore store, MailTransport transport, MutableClock clock) {
            super(props,
                    store,
                    transport,
                    new PlaceholderRenderer(),
                    new DefaultTimeParser(ZoneOffset.UTC),
                    SlidingWindowRateLimiter.from(props, clock),
                    new RetryPolicy(props.getMaxAttempts(), props.getInitialRetryDelay(), props.getRetryMultiplier(),
                            props.getMaxRetryDelay(), props.getRetryJitter(), () -> 0.0),
                    new ObjectMapper(),
                    clock);
            this.clock = clock;
        }

        @Override
        protected boolean pause(Duration wait) {
            pauses.add(wait);
            if (abortPauses) {
                return false;
            }
            clock.advance(wait);
            return true;
        }
    }

    /**
     * Fails the first listing, as a store that is down while the agenda starts.
     */
    static final class UnreachableOnceStore extends InMemoryJobStore {
        private final AtomicBoolean failed = new AtomicBoolean();

        @Override
        public List<MailJob> list(JobFilter filter) {
            if (failed.compareAndSet(false, true)) {
                throw new IllegalStateException("store unreachable");
            }
            return super.list(filter);
        }
    }

    record Delivery(String recipient, MailMessage message, Instant at) {
    }

    /**
     * Answers each recipient from its script, then with success.
     */
    static final class RecordingTransport implements MailTransport {
        private final MutableClock clock;
        private final Map<String, Deque<Object>> scripts = new ConcurrentHashMap<>();
        final List<Delivery> deliveries = new CopyOnWriteArrayList<>();

        RecordingTransport(MutableClock clock) {
            this.clock = clock;
        }

        void script(String recipient, Object... answers) {
            scripts.put(recipient, new ArrayDeque<>(List.of(answers)));
        }

        @Override
        public DeliveryResult deliver(MailMessage message, String recipient) {
            assertNotNull(message.jobId());
            deliveries.add(new Delivery(recipient, message, clock.instant()));
            Deque<Object> script = scripts.get(recipient);
            Object answer = script == null ? null : script.pollFirst();
            if (answer instanceof RuntimeException e) {
                throw e;
            }
            if (answer instanceof DeliveryResult r) {
                return r;
            }
            return DeliveryResult.ok("<" + message.jobId() + "@test>");
        }
    }
}
