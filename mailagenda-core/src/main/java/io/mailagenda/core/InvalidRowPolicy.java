package io.mailagenda.core;

/**
 * What the campaign expander does with a recipient row that fails validation.
 */
public enum InvalidRowPolicy {
    /**
     * Persist a synthetic FAILED_PERMANENT job carrying the validation error.
     */
    RECORD_FAILED,
    /**
     * Report the row in the campaign result and persist nothing.
     */
    SKIP
}
