package io.mailagenda.internal;

import io.mailagenda.MailJobBuilder;
import io.mailagenda.TimeParser;
import io.mailagenda.core.JobSpec;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link MailJobBuilder} implementation.
 */
public class SimpleMailJobBuilder implements MailJobBuilder {

    private final String recipient;
    private final TimeParser timeParser;
    private final Clock clock;
    private final Function<JobSpec, String> submitter;

    private String subjectTemplate;
    private String bodyTemplate;
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final List<String> cc = new ArrayList<>();
    private final List<String> bcc = new ArrayList<>();
    private final List<String> attachments = new ArrayList<>();
    private Instant notBefore;

    public SimpleMailJobBuilder(String recipient, TimeParser timeParser, Clock clock, Function<JobSpec, String> submitter) {
        this.recipient = recipient;
        this.timeParser = Objects.requireNonNull(timeParser, "timeParser must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
    }

    @Override
    public MailJobBuilder subject(String subjectTemplate) {
        this.subjectTemplate = subjectTemplate;
        return this;
    }

    @Override
    public MailJobBuilder body(String bodyTemplate) {
        this.bodyTemplate = bodyTemplate;
        return this;
    }

    @Override
    public MailJobBuilder variable(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        Objects.requireNonNull(value, "value must not be null for key: " + key);
        this.variables.put(key, value);
        return this;
    }

    @Override
    public MailJobBuilder variables(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables must not be null");
        variables.forEach(this::variable);
        return this;
    }

    @Override
    public MailJobBuilder cc(String address) {
        Objects.requireNonNull(address, "address must not be null");
        this.cc.add(address);
        return this;
    }

    @Override
    public MailJobBuilder bcc(String address) {
        Objects.requireNonNull(address, "address must not be null");
        this.bcc.add(address);
        return this;
    }

    @Override
    public MailJobBuilder attach(String file) {
        Objects.requireNonNull(file, "file must not be null");
        this.attachments.add(file);
        return this;
    }

    @Override
    public MailJobBuilder attachments(List<String> files) {
        Objects.requireNonNull(files, "files must not be null");
        files.forEach(this::attach);
        return this;
    }

    @Override
    public MailJobBuilder schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.notBefore = time;
        return this;
    }

    @Override
    public MailJobBuilder schedule(String expression) {
        this.notBefore = timeParser.parse(expression, clock.instant());
        return this;
    }

    @Override
    public JobSpec build() {
        return new JobSpec(
                recipient,
                cc,
                bcc,
                subjectTemplate,
                bodyTemplate,
                variables,
                attachments,
                notBefore,
                null
        );
    }

    @Override
    public String submit() {
        return submitter.apply(build());
    }
}
