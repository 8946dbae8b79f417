package io.mailagenda.core;

import java.time.Duration;

/**
 * Admission control shared by every dispatch attempt.
 */
public interface RateLimiter {

    /**
     * Reserve the next attempt slot.
     *
     * @return how long the caller must wait before issuing the attempt; never negative
     */
    Duration acquire();
}
