package io.mailagenda.core;

import java.util.Objects;

/**
 * Answer of a {@code MailTransport} for a single delivery attempt.
 */
public record DeliveryResult(Status status, String messageId, String error) {

    public enum Status {
        OK,
        TRANSIENT_ERROR,
        PERMANENT_ERROR
    }

    public DeliveryResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static DeliveryResult ok(String messageId) {
        return new DeliveryResult(Status.OK, messageId, null);
    }

    public static DeliveryResult transientError(String error) {
        return new DeliveryResult(Status.TRANSIENT_ERROR, null, error);
    }

    public static DeliveryResult permanentError(String error) {
        return new DeliveryResult(Status.PERMANENT_ERROR, null, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
