package io.mailagenda;

import io.mailagenda.core.JobSpec;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for configuring a single email before submitting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>submit(): build() + validate + persist as PENDING</li>
 * </ul>
 */
public interface MailJobBuilder {

    MailJobBuilder subject(String subjectTemplate);

    MailJobBuilder body(String bodyTemplate);

    /**
     * Add one template variable. Keys are case-sensitive.
     */
    MailJobBuilder variable(String key, String value);

    MailJobBuilder variables(Map<String, String> variables);

    MailJobBuilder cc(String address);

    MailJobBuilder bcc(String address);

    MailJobBuilder attach(String file);

    MailJobBuilder attachments(List<String> files);

    /**
     * Defer the job until the given instant. Without a schedule the job is due immediately.
     */
    MailJobBuilder schedule(Instant time);

    /**
     * Defer the job until a human time expression such as "tomorrow 9am" or "in 2 hours".
     *
     * @throws io.mailagenda.core.UnparseableTimeException if the expression is not understood
     */
    MailJobBuilder schedule(String expression);

    /**
     * Build an immutable job spec (not persisted).
     */
    JobSpec build();

    /**
     * Build + validate + persist. Returns the job id.
     */
    String submit();
}
