package io.mailagenda;

import io.mailagenda.core.CampaignRequest;
import io.mailagenda.core.CampaignResult;
import io.mailagenda.core.CampaignSummary;
import io.mailagenda.core.JobFilter;
import io.mailagenda.core.JobSpec;
import io.mailagenda.core.JobState;
import io.mailagenda.core.MailJob;
import io.mailagenda.core.PassResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Jobs are submitted individually ({@link #compose(String)}, {@link #submit(JobSpec)}) or in
 * bulk ({@link #submitCampaign(CampaignRequest)}). They are delivered by a background poller once
 * {@link #start()} has been called, or one pass at a time through {@link #runOnce()}.
 */
public interface MailAgenda {

    /**
     * Recover jobs left in flight by a previous process, then start polling. Idempotent.
     */
    void start();

    /**
     * Stop polling and wait for deliveries in progress. Idempotent.
     */
    void stop();

    /**
     * Start a builder for one email to {@code recipient}. Nothing is persisted until submit().
     */
    MailJobBuilder compose(String recipient);

    /**
     * Validate and persist a job in PENDING.
     *
     * @return the new job id
     * @throws io.mailagenda.core.ValidationException if the recipient, an attachment or a
     *                                                required template variable is invalid
     */
    String submit(JobSpec spec);

    /**
     * Expand a bulk request into one job per recipient row.
     */
    CampaignResult submitCampaign(CampaignRequest request);

    List<MailJob> list(JobFilter filter);

    Optional<MailJob> find(String jobId);

    /**
     * Cancel a PENDING job. Returns false when the job is unknown, in flight or terminal.
     */
    boolean cancel(String jobId);

    CampaignSummary summarize(String campaignId);

    /**
     * Number of jobs per state across all campaigns.
     */
    Map<JobState, Long> stats();

    /**
     * Run one scheduling pass: fetch a bounded batch of due jobs and attempt each, oldest due first.
     */
    PassResult runOnce();

    /**
     * Apply the in-flight recovery policy and requeue jobs waiting in FAILED_TRANSIENT.
     *
     * @return number of jobs recovered
     */
    int recover();
}
