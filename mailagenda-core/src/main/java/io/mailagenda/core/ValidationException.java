package io.mailagenda.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Input rejected before a job was created.
 */
public class ValidationException extends MailAgendaException {

    /**
     * One problem found in the input. {@code suggestion} is a hint for the operator and may be null.
     */
    public record Problem(String field, String message, String suggestion) {

        public static Problem of(String field, String message) {
            return new Problem(field, message, null);
        }

        @Override
        public String toString() {
            return suggestion == null
                    ? field + ": " + message
                    : field + ": " + message + " " + suggestion;
        }
    }

    private final List<Problem> problems;

    public ValidationException(List<Problem> problems) {
        super(describe(problems));
        this.problems = List.copyOf(problems);
    }

    public ValidationException(String field, String message) {
        this(List.of(Problem.of(field, message)));
    }

    public List<Problem> problems() {
        return problems;
    }

    private static String describe(List<Problem> problems) {
        if (problems == null || problems.isEmpty()) {
            throw new IllegalArgumentException("problems must not be empty");
        }
        return problems.stream().map(Problem::toString).collect(Collectors.joining("; "));
    }
}
