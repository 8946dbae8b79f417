package io.mailagenda.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A bulk request: one template, one list of recipient rows.
 *
 * <p>Each row is either a {@code Map} of column name to value or a bean; beans are flattened to
 * their properties. The column holding the address is matched case-insensitively against
 * {@code "email"}; every other column becomes a template variable of that row's job.
 *
 * @param campaignId      tag for the produced jobs; generated when null
 * @param subjectTemplate shared subject template, may reference row variables
 * @param bodyTemplate    shared body template
 * @param rows            recipient rows, in order
 * @param attachments     attachments added to every job
 * @param notBefore       earliest send instant; null means now
 * @param invalidRows     policy for rows that fail validation; null means the configured default
 */
public record CampaignRequest(
        String campaignId,
        String subjectTemplate,
        String bodyTemplate,
        List<?> rows,
        List<String> attachments,
        Instant notBefore,
        InvalidRowPolicy invalidRows
) {
    public CampaignRequest {
        Objects.requireNonNull(rows, "rows must not be null");
        rows = List.copyOf(rows);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static CampaignRequest of(String subjectTemplate, String bodyTemplate, List<?> rows) {
        return new CampaignRequest(null, subjectTemplate, bodyTemplate, rows, List.of(), null, null);
    }

    public CampaignRequest withCampaignId(String id) {
        return new CampaignRequest(id, subjectTemplate, bodyTemplate, rows, attachments, notBefore, invalidRows);
    }

    public CampaignRequest withNotBefore(Instant time) {
        return new CampaignRequest(campaignId, subjectTemplate, bodyTemplate, rows, attachments, time, invalidRows);
    }

    public CampaignRequest withInvalidRows(InvalidRowPolicy policy) {
        return new CampaignRequest(campaignId, subjectTemplate, bodyTemplate, rows, attachments, notBefore, policy);
    }

    public CampaignRequest withAttachments(List<String> files) {
        return new CampaignRequest(campaignId, subjectTemplate, bodyTemplate, rows, files, notBefore, invalidRows);
    }
}
