package io.mailagenda.core;

/**
 * A template could not be rendered, either because a placeholder has no value or because the
 * template itself is malformed. Never retried.
 */
public class RenderException extends MailAgendaException {

    public enum Reason {
        MISSING_VARIABLE,
        SYNTAX_ERROR
    }

    private final Reason reason;

    public RenderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
