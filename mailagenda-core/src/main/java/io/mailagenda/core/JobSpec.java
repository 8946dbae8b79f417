package io.mailagenda.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable job definition produced by {@code MailJobBuilder.build()} or by the campaign expander.
 * This is a pure data object with no persistence logic.
 *
 * <p>{@code subjectTemplate} and {@code bodyTemplate} are either literal content or a template
 * reference; the configured {@code Renderer} decides which.
 */
public record JobSpec(

        // addressing
        String recipient,
        List<String> cc,
        List<String> bcc,

        // content
        String subjectTemplate,
        String bodyTemplate,
        Map<String, String> variables,
        List<String> attachments,

        // scheduling
        Instant notBefore,

        // reporting only
        String campaignId
) {
    public JobSpec {
        recipient = trim(recipient);
        cc = trimAll(cc);
        bcc = trimAll(bcc);
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    private static String trim(String address) {
        return address == null ? null : address.trim();
    }

    private static List<String> trimAll(List<String> addresses) {
        return addresses == null ? List.of() : List.copyOf(addresses.stream().map(JobSpec::trim).toList());
    }
}
