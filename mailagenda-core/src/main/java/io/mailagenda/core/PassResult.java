package io.mailagenda.core;

/**
 * Counters of one scheduling pass.
 *
 * fetched  : due jobs returned by the store
 * claimed  : jobs moved to IN_FLIGHT by this pass
 * sent     : attempts that ended SENT
 * retried  : attempts that ended FAILED_TRANSIENT and were requeued
 * failed   : attempts that ended FAILED_PERMANENT
 * released : claims returned to PENDING without an attempt (shutdown)
 */
public record PassResult(
        int fetched,
        int claimed,
        int sent,
        int retried,
        int failed,
        int released
) {

    public static PassResult empty() {
        return new PassResult(0, 0, 0, 0, 0, 0);
    }

    public int attempted() {
        return sent + retried + failed;
    }
}
