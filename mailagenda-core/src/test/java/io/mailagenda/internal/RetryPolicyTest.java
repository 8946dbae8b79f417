package io.mailagenda.internal;

import io.mailagenda.config.MailAgendaProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private static RetryPolicy withRandom(double r) {
        return new RetryPolicy(4, Duration.ofMinutes(1), 2.0, Duration.ofHours(1), 0.2, () -> r);
    }

    @Test
    void defaultsShouldAllowFourAttempts() {
        RetryPolicy policy = RetryPolicy.from(new MailAgendaProperties());

        assertEquals(4, policy.maxAttempts());
        assertTrue(policy.hasAttemptsLeft(3));
        assertFalse(policy.hasAttemptsLeft(4));
    }

    @Test
    void baseDelayShouldDoubleUntilCapped() {
        RetryPolicy policy = withRandom(0.0);

        assertEquals(Duration.ofMinutes(1), policy.baseDelay(1));
        assertEquals(Duration.ofMinutes(2), policy.baseDelay(2));
        assertEquals(Duration.ofMinutes(4), policy.baseDelay(3));
        assertEquals(Duration.ofHours(1), policy.baseDelay(10));
        assertEquals(Duration.ofHours(1), policy.baseDelay(500));
    }

    @Test
    void baseDelayShouldNeverDecrease() {
        RetryPolicy policy = withRandom(0.0);
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 100; attempt++) {
            Duration d = policy.baseDelay(attempt);
            assertTrue(d.compareTo(previous) >= 0, "attempt " + attempt);
            previous = d;
        }
    }

    @Test
    void jitterShouldStayWithinBoundsAndCap() {
        assertEquals(Duration.ofMinutes(1), withRandom(0.0).delay(1));
        assertEquals(Duration.ofSeconds(72), withRandom(1.0).delay(1));
        assertEquals(Duration.ofHours(1), withRandom(1.0).delay(8));
    }

    @Test
    void nextAttemptShouldBeStrictlyAfterFailure() {
        Instant failedAt = Instant.parse("2026-03-02T08:00:00Z");

        assertEquals(failedAt.plusSeconds(120), withRandom(0.0).nextAttemptAt(2, failedAt));
        assertTrue(withRandom(0.5).nextAttemptAt(1, failedAt).isAfter(failedAt));
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), 0.0, () -> 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ofSeconds(10), 0.0, () -> 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(20), 2.0, Duration.ofSeconds(10), 0.0, () -> 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(10), 0.0, () -> 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), 1.5, () -> 0.0));
    }
}
