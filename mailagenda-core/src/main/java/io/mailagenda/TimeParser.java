package io.mailagenda;

import java.time.Instant;

/**
 * Resolves a human time expression ("in 2 hours", "tomorrow 9am", an ISO timestamp) to an
 * absolute instant.
 */
public interface TimeParser {

    /**
     * @param expression    the text to parse
     * @param referenceNow  instant that relative expressions are anchored to
     * @throws io.mailagenda.core.UnparseableTimeException if no supported form matches
     */
    Instant parse(String expression, Instant referenceNow);
}
