package io.mailagenda.internal;

import io.mailagenda.config.MailAgendaProperties;
import io.mailagenda.core.RateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Rolling-window admission control with an optional burst ceiling.
 *
 * <p>Every {@link #acquire()} reserves a slot instant. Slots are handed out monotonically by a
 * single owner (this object's monitor), and any half-open window of length {@code window} holds
 * at most {@code cap} slots. When {@code burst} is set, slots are additionally spaced by
 * {@code window / cap} once {@code burst} back-to-back slots have been used.
 *
 * <p>The limiter never refuses: it only tells the caller how long to wait.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private final int cap;
    private final Duration window;
    private final int burst;
    private final Duration spacing;
    private final Clock clock;

    // last `cap` reserved slots, oldest first
    private final Deque<Instant> slots = new ArrayDeque<>();
    private Instant lastSlot;
    private Instant theoreticalArrival;

    public SlidingWindowRateLimiter(int cap, Duration window, int burst, Clock clock) {
        if (cap <= 0) {
            throw new IllegalArgumentException("cap must be a positive number");
        }
        Objects.requireNonNull(window, "window must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be a positive duration");
        }
        if (burst < 0 || burst > cap) {
            throw new IllegalArgumentException("burst must be within [0, cap]");
        }
        this.cap = cap;
        this.window = window;
        this.burst = burst;
        this.spacing = window.dividedBy(cap);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static SlidingWindowRateLimiter from(MailAgendaProperties props, Clock clock) {
        return new SlidingWindowRateLimiter(props.getRatePerWindow(), props.getRateWindow(), props.getBurst(), clock);
    }

    @Override
    public Duration acquire() {
        Instant now = clock.instant();
        Instant slot = reserve(now);
        Duration wait = Duration.between(now, slot);
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    /**
     * Reserve and return the next slot at or after {@code now}.
     */
    synchronized Instant reserve(Instant now) {
        Instant slot = now;
        if (lastSlot != null && lastSlot.isAfter(slot)) {
            slot = lastSlot;
        }

        if (slots.size() >= cap) {
            Instant windowOpensAt = slots.peekFirst().plus(window);
            if (windowOpensAt.isAfter(slot)) {
                slot = windowOpensAt;
            }
        }

        if (burst > 0 && theoreticalArrival != null) {
            Instant earliest = theoreticalArrival.minus(spacing.multipliedBy(burst - 1L));
            if (earliest.isAfter(slot)) {
                slot = earliest;
            }
        }

        slots.addLast(slot);
        if (slots.size() > cap) {
            slots.pollFirst();
        }
        lastSlot = slot;
        if (burst > 0) {
            Instant base = (theoreticalArrival == null || theoreticalArrival.isBefore(slot)) ? slot : theoreticalArrival;
            theoreticalArrival = base.plus(spacing);
        }
        return slot;
    }

    public int cap() {
        return cap;
    }

    public Duration window() {
        return window;
    }
}
