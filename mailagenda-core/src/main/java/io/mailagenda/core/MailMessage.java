package io.mailagenda.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Fully rendered message handed to a {@code MailTransport}.
 */
public record MailMessage(
        String jobId,
        List<String> cc,
        List<String> bcc,
        String subject,
        String body,
        boolean html,
        List<Path> attachments
) {
    public MailMessage {
        cc = cc == null ? List.of() : List.copyOf(cc);
        bcc = bcc == null ? List.of() : List.copyOf(bcc);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
