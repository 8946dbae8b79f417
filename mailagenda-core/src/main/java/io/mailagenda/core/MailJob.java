package io.mailagenda.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a persisted delivery job as read from a {@link JobStore}.
 */
public record MailJob(
        String id,
        String recipient,
        List<String> cc,
        List<String> bcc,
        String subjectTemplate,
        String bodyTemplate,
        Map<String, String> variables,
        List<String> attachments,
        Instant notBefore,
        JobState state,
        int attemptCount,
        Instant lastAttemptAt,
        String lastError,
        String messageId,
        String campaignId,
        Instant createdAt,
        Instant updatedAt
) {
    public MailJob {
        cc = cc == null ? List.of() : List.copyOf(cc);
        bcc = bcc == null ? List.of() : List.copyOf(bcc);
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public boolean isDue(Instant now) {
        return state == JobState.PENDING && !notBefore.isAfter(now);
    }
}
