package io.mailagenda.core;

/**
 * A time expression did not match any supported form.
 */
public class UnparseableTimeException extends IllegalArgumentException {

    private final String expression;

    public UnparseableTimeException(String expression, String message) {
        super(message + ": " + expression);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
