package io.mailagenda.core;

/**
 * Base type of every error raised by the scheduler.
 */
public class MailAgendaException extends RuntimeException {

    public MailAgendaException(String message) {
        super(message);
    }

    public MailAgendaException(String message, Throwable cause) {
        super(message, cause);
    }
}
