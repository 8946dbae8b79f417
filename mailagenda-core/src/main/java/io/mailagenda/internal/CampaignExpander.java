package io.mailagenda.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mailagenda.core.CampaignRequest;
import io.mailagenda.core.CampaignResult;
import io.mailagenda.core.CampaignResult.RejectedRow;
import io.mailagenda.core.InvalidRowPolicy;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.JobStore;
import io.mailagenda.core.ValidationException.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Expands a bulk request into one independent job per recipient row.
 *
 * <p>A bad row never aborts the campaign: it is either stored as a FAILED_PERMANENT job or
 * reported and skipped, depending on the {@link InvalidRowPolicy}.
 */
public class CampaignExpander {
    private static final Logger log = LoggerFactory.getLogger(CampaignExpander.class);

    static final String EMAIL_COLUMN = "email";

    private final JobStore jobStore;
    private final JobSpecValidator validator;
    private final ObjectMapper objectMapper;
    private final InvalidRowPolicy defaultPolicy;

    public CampaignExpander(JobStore jobStore, JobSpecValidator validator, ObjectMapper objectMapper,
                            InvalidRowPolicy defaultPolicy) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy must not be null");
    }

    public CampaignResult expand(CampaignRequest request, Instant now) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(now, "now must not be null");

        String campaignId = (request.campaignId() == null || request.campaignId().isBlank())
                ? UUID.randomUUID().toString()
                : request.campaignId();
        InvalidRowPolicy policy = request.invalidRows() != null ? request.invalidRows() : defaultPolicy;
        Instant notBefore = request.notBefore() != null ? request.notBefore() : now;

        List<String> accepted = new ArrayList<>(request.rows().size());
        List<RejectedRow> rejected = new ArrayList<>();

        for (int i = 0; i < request.rows().size(); i++) {
            Map<String, String> columns = flatten(request.rows().get(i));
            String emailColumn = findEmailColumn(columns);
            String email = emailColumn == null ? null : columns.get(emailColumn).trim();

            Map<String, String> variables = new LinkedHashMap<>(columns);
            if (emailColumn != null) {
                variables.remove(emailColumn);
            }

            JobSpec spec = new JobSpec(
                    email,
                    List.of(),
                    List.of(),
                    request.subjectTemplate(),
                    request.bodyTemplate(),
                    variables,
                    request.attachments(),
                    notBefore,
                    campaignId
            );

            List<Problem> problems = (email == null || email.isEmpty())
                    ? List.of(Problem.of(EMAIL_COLUMN, "Row has no email value."))
                    : validator.validate(spec);

            if (problems.isEmpty()) {
                accepted.add(jobStore.create(spec, now));
                continue;
            }

            String reason = problems.stream().map(Problem::toString).collect(Collectors.joining("; "));
            String jobId = policy == InvalidRowPolicy.RECORD_FAILED
                    ? jobStore.createRejected(spec, reason, now)
                    : null;
            rejected.add(new RejectedRow(i, reason, jobId));
            log.warn("Campaign row rejected campaignId={} row={} policy={} reason={}", campaignId, i, policy, reason);
        }

        log.info("Campaign expanded campaignId={} rows={} accepted={} rejected={} notBefore={}",
                campaignId, request.rows().size(), accepted.size(), rejected.size(), notBefore);
        return new CampaignResult(campaignId, accepted, rejected);
    }

    private Map<String, String> flatten(Object row) {
        Map<String, String> columns = new LinkedHashMap<>();
        if (row == null) {
            return columns;
        }
        Map<?, ?> raw = (row instanceof Map<?, ?> map)
                ? map
                : objectMapper.convertValue(row, new TypeReference<Map<String, Object>>() {
                });
        for (var e : raw.entrySet()) {
            if (e.getKey() == null) {
                continue;
            }
            String key = e.getKey().toString().trim();
            if (key.isEmpty()) {
                continue;
            }
            columns.put(key, e.getValue() == null ? "" : e.getValue().toString());
        }
        return columns;
    }

    private static String findEmailColumn(Map<String, String> columns) {
        for (String key : columns.keySet()) {
            if (key.equalsIgnoreCase(EMAIL_COLUMN)) {
                return key;
            }
        }
        return null;
    }
}
