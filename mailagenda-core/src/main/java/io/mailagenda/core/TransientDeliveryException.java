package io.mailagenda.core;

/**
 * Delivery failed in a way that may succeed later (timeout, throttling, SMTP 4xx).
 */
public class TransientDeliveryException extends MailAgendaException {

    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
