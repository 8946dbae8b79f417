package io.mailagenda.core;

/**
 * Delivery failed and will fail again on retry (invalid recipient, SMTP 5xx, rejected content).
 */
public class PermanentDeliveryException extends MailAgendaException {

    public PermanentDeliveryException(String message) {
        super(message);
    }

    public PermanentDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
