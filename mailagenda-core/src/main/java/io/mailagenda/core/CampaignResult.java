package io.mailagenda.core;

import java.util.List;

/**
 * Outcome of expanding a campaign into jobs.
 *
 * @param campaignId   tag carried by every produced job
 * @param acceptedJobs ids of the PENDING jobs, in row order
 * @param rejected     rows that failed validation, in row order
 */
public record CampaignResult(String campaignId, List<String> acceptedJobs, List<RejectedRow> rejected) {

    /**
     * A recipient row that did not become a deliverable job.
     *
     * @param index  zero-based row index
     * @param reason validation message
     * @param jobId  id of the synthetic FAILED_PERMANENT job, or null when the row was skipped
     */
    public record RejectedRow(int index, String reason, String jobId) {
    }

    public CampaignResult {
        acceptedJobs = List.copyOf(acceptedJobs);
        rejected = List.copyOf(rejected);
    }

    public int totalRows() {
        return acceptedJobs.size() + rejected.size();
    }
}
