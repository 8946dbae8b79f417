package io.mailagenda.internal.mongo;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.List;
import java.util.Objects;

/**
 * MongoDB index definitions for the mail job collection.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code mail-agenda.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code mail_jobs})</h3>
 * <ul>
 *   <li><b>idx_due</b>: { state: 1, notBefore: 1, createdAt: 1 }
 *       <br/>Used by the scheduling pass to fetch due PENDING jobs oldest first.</li>
 *   <li><b>idx_campaign_state</b>: { campaignId: 1, state: 1 }
 *       <br/>Used by campaign summaries and filtered listing.</li>
 *   <li><b>idx_created</b>: { createdAt: 1 }
 *       <br/>Used by listing in creation order.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.mail_jobs.createIndex({ state: 1, notBefore: 1, createdAt: 1 }, { name: "idx_due" });
 * db.mail_jobs.createIndex({ campaignId: 1, state: 1 }, { name: "idx_campaign_state" });
 * db.mail_jobs.createIndex({ createdAt: 1 }, { name: "idx_created" });
 * </pre>
 */
public class MailJobIndexes {

    public static final String IDX_DUE = "idx_due";
    public static final String IDX_CAMPAIGN_STATE = "idx_campaign_state";
    public static final String IDX_CREATED = "idx_created";

    private final MongoTemplate mongoTemplate;

    public MailJobIndexes(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(MailJobDocument.class);
        for (Index index : required()) {
            ops.ensureIndex(index);
        }
    }

    public static List<Index> required() {
        return List.of(dueIndex(), campaignStateIndex(), createdIndex());
    }

    /**
     * Keys: state ASC, notBefore ASC, createdAt ASC
     */
    public static Index dueIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("notBefore", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    /**
     * Keys: campaignId ASC, state ASC
     */
    public static Index campaignStateIndex() {
        return new Index()
                .on("campaignId", Sort.Direction.ASC)
                .on("state", Sort.Direction.ASC)
                .named(IDX_CAMPAIGN_STATE);
    }

    /**
     * Keys: createdAt ASC
     */
    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED);
    }
}
