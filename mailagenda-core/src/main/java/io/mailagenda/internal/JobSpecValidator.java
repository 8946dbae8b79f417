package io.mailagenda.internal;

import io.mailagenda.Renderer;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.RenderException;
import io.mailagenda.core.ValidationException;
import io.mailagenda.core.ValidationException.Problem;
import io.mailagenda.utils.AttachmentValidator;
import io.mailagenda.utils.EmailAddressValidator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a {@link JobSpec} before it is persisted: addresses, attachments, and that every
 * placeholder of the subject and body has a value in the variable mapping.
 */
public class JobSpecValidator {

    private final Renderer renderer;

    public JobSpecValidator(Renderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    public List<Problem> validate(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        List<Problem> problems = new ArrayList<>();

        EmailAddressValidator.validate("recipient", spec.recipient()).ifPresent(problems::add);
        for (String cc : spec.cc()) {
            EmailAddressValidator.validate("cc", cc).ifPresent(problems::add);
        }
        for (String bcc : spec.bcc()) {
            EmailAddressValidator.validate("bcc", bcc).ifPresent(problems::add);
        }

        if (spec.bodyTemplate() == null || spec.bodyTemplate().isBlank()) {
            problems.add(Problem.of("body", "Email must have a body."));
        }

        for (String file : spec.attachments()) {
            AttachmentValidator.validate(file).ifPresent(problems::add);
        }

        Set<String> required = new LinkedHashSet<>();
        try {
            required.addAll(renderer.requiredVariables(spec.subjectTemplate()));
            required.addAll(renderer.requiredVariables(spec.bodyTemplate()));
        } catch (RenderException e) {
            problems.add(Problem.of("template", e.getMessage()));
        }
        for (String name : required) {
            if (!spec.variables().containsKey(name)) {
                problems.add(Problem.of("variables", "Missing template variable '" + name + "'"));
            }
        }
        return problems;
    }

    /**
     * @throws ValidationException if {@link #validate(JobSpec)} reports any problem
     */
    public void check(JobSpec spec) {
        List<Problem> problems = validate(spec);
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }
}
