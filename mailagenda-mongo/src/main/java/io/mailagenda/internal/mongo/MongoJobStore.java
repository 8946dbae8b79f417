package io.mailagenda.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.mailagenda.core.JobFilter;
import io.mailagenda.core.JobOutcome;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.JobState;
import io.mailagenda.core.JobStore;
import io.mailagenda.core.MailJob;
import io.mailagenda.core.SchedulerInvariantViolation;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for mail jobs.
 *
 * <p>Every transition is one {@code updateFirst} or {@code findAndModify} whose filter pins both
 * the id and the expected state, so two schedulers sharing the collection cannot both claim, or
 * both finish, the same job.
 */
public class MongoJobStore implements JobStore {

    private static final Sort DUE_ORDER = Sort.by(
            Sort.Order.asc("notBefore"),
            Sort.Order.asc("createdAt"),
            Sort.Order.asc("_id"));

    private static final Sort CREATION_ORDER = Sort.by(
            Sort.Order.asc("createdAt"),
            Sort.Order.asc("_id"));

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public String create(JobSpec spec, Instant now) {
        return insert(spec, JobState.PENDING, null, now);
    }

    @Override
    public String createRejected(JobSpec spec, String error, Instant now) {
        return insert(spec, JobState.FAILED_PERMANENT, error, now);
    }

    private String insert(JobSpec spec, JobState state, String error, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(now, "now must not be null");

        MailJobDocument doc = new MailJobDocument();
        doc.setRecipient(spec.recipient());
        doc.setCc(spec.cc());
        doc.setBcc(spec.bcc());
        doc.setSubjectTemplate(spec.subjectTemplate());
        doc.setBodyTemplate(spec.bodyTemplate());
        doc.setVariables(spec.variables());
        doc.setAttachments(spec.attachments());
        doc.setNotBefore(spec.notBefore() != null ? spec.notBefore() : now);
        doc.setState(state);
        doc.setAttemptCount(0);
        doc.setLastError(error);
        doc.setCampaignId(spec.campaignId());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        return mongoTemplate.insert(doc).getId();
    }

    @Override
    public Optional<MailJob> find(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, MailJobDocument.class)).map(MongoJobStore::toJob);
    }

    /**
     * Reads due jobs without claiming them; the claim is {@link #markInFlight(String, Instant)}.
     */
    @Override
    public List<MailJob> fetchDue(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }

        Query q = new Query(
                Criteria.where("state").is(JobState.PENDING)
                        .and("notBefore").lte(now)
        );
        q.with(DUE_ORDER);
        q.limit(limit);

        return toJobs(mongoTemplate.find(q, MailJobDocument.class));
    }

    @Override
    public boolean markInFlight(String id, Instant now) {
        return transitionIf(id, JobState.PENDING, JobState.IN_FLIGHT, now);
    }

    @Override
    public MailJob recordAttempt(String id, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("state").is(JobState.IN_FLIGHT));
        Update u = new Update()
                .inc("attemptCount", 1)
                .set("lastAttemptAt", now)
                .set("updatedAt", now);

        MailJobDocument doc = mongoTemplate.findAndModify(
                q, u, FindAndModifyOptions.options().returnNew(true), MailJobDocument.class);
        if (doc == null) {
            throw new SchedulerInvariantViolation(
                    "Attempt recorded for job " + id + " in state " + currentState(id) + ", expected IN_FLIGHT");
        }
        return toJob(doc);
    }

    @Override
    public void recordResult(String id, JobOutcome outcome, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Criteria c = Criteria.where("_id").is(id).and("state").is(JobState.IN_FLIGHT);
        Update u = new Update()
                .set("state", outcome.state())
                .set("updatedAt", now);

        switch (outcome.state()) {
            case SENT -> u.set("messageId", outcome.messageId());
            case FAILED_TRANSIENT -> {
                // the retry must lie strictly after the attempt it follows
                c = c.orOperator(
                        Criteria.where("lastAttemptAt").is(null),
                        Criteria.where("lastAttemptAt").lt(outcome.retryAt()));
                u.set("notBefore", outcome.retryAt())
                        .set("lastError", outcome.error())
                        .unset("messageId");
            }
            case FAILED_PERMANENT -> u.set("lastError", outcome.error()).unset("messageId");
            default -> throw new SchedulerInvariantViolation(id, JobState.IN_FLIGHT, outcome.state());
        }

        UpdateResult r = mongoTemplate.updateFirst(new Query(c), u, MailJobDocument.class);
        if (r.getMatchedCount() == 0) {
            JobState current = currentState(id);
            if (current == JobState.IN_FLIGHT) {
                throw new SchedulerInvariantViolation("Retry of job " + id + " at " + outcome.retryAt()
                        + " is not after its last attempt");
            }
            throw new SchedulerInvariantViolation(id, current, outcome.state());
        }
    }

    @Override
    public boolean requeue(String id, Instant now) {
        return transitionIf(id, JobState.FAILED_TRANSIENT, JobState.PENDING, now);
    }

    @Override
    public boolean release(String id, Instant now) {
        return transitionIf(id, JobState.IN_FLIGHT, JobState.PENDING, now);
    }

    @Override
    public boolean cancel(String id, Instant now) {
        return transitionIf(id, JobState.PENDING, JobState.CANCELLED, now);
    }

    @Override
    public List<MailJob> list(JobFilter filter) {
        JobFilter f = filter == null ? JobFilter.all() : filter;

        Query q = new Query();
        if (!f.states().isEmpty()) {
            q.addCriteria(Criteria.where("state").in(f.states()));
        }
        if (f.campaignId() != null) {
            q.addCriteria(Criteria.where("campaignId").is(f.campaignId()));
        }
        q.with(CREATION_ORDER);
        if (f.limit() != Integer.MAX_VALUE) {
            q.limit(f.limit());
        }

        return toJobs(mongoTemplate.find(q, MailJobDocument.class));
    }

    @Override
    public Map<JobState, Long> countByState(String campaignId) {
        List<AggregationOperation> stages = new ArrayList<>(2);
        if (campaignId != null) {
            stages.add(Aggregation.match(Criteria.where("campaignId").is(campaignId)));
        }
        stages.add(Aggregation.group("state").count().as("count"));

        List<Document> rows = mongoTemplate.aggregate(
                Aggregation.newAggregation(stages), MailJobDocument.class, Document.class
        ).getMappedResults();

        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (Document row : rows) {
            Object state = row.get("_id");
            Number count = (Number) row.get("count");
            if (state != null && count != null) {
                counts.put(JobState.valueOf(state.toString()), count.longValue());
            }
        }
        return counts;
    }

    private boolean transitionIf(String id, JobState expected, JobState next, Instant now) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("state").is(expected));
        Update u = new Update()
                .set("state", next)
                .set("updatedAt", now);

        return mongoTemplate.updateFirst(q, u, MailJobDocument.class).getModifiedCount() > 0;
    }

    private JobState currentState(String id) {
        Query q = new Query(Criteria.where("_id").is(id));
        q.fields().include("state");
        MailJobDocument doc = mongoTemplate.findOne(q, MailJobDocument.class);
        return doc == null ? null : doc.getState();
    }

    private static List<MailJob> toJobs(List<MailJobDocument> docs) {
        List<MailJob> jobs = new ArrayList<>(docs.size());
        for (MailJobDocument d : docs) {
            jobs.add(toJob(d));
        }
        return jobs;
    }

    static MailJob toJob(MailJobDocument doc) {
        return new MailJob(
                doc.getId(),
                doc.getRecipient(),
                doc.getCc(),
                doc.getBcc(),
                doc.getSubjectTemplate(),
                doc.getBodyTemplate(),
                doc.getVariables(),
                doc.getAttachments(),
                doc.getNotBefore(),
                doc.getState(),
                doc.getAttemptCount(),
                doc.getLastAttemptAt(),
                doc.getLastError(),
                doc.getMessageId(),
                doc.getCampaignId(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
