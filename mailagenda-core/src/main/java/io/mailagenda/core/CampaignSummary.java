package io.mailagenda.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated per-state counts of the jobs tagged with one campaign id.
 */
public record CampaignSummary(String campaignId, Map<JobState, Long> counts) {

    public CampaignSummary {
        EnumMap<JobState, Long> copy = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            copy.put(s, 0L);
        }
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public long count(JobState state) {
        return counts.get(state);
    }

    public long sent() {
        return count(JobState.SENT);
    }

    public long failed() {
        return count(JobState.FAILED_PERMANENT);
    }

    /**
     * Jobs that may still be delivered: PENDING, IN_FLIGHT or waiting for a retry.
     */
    public long pending() {
        return count(JobState.PENDING) + count(JobState.IN_FLIGHT) + count(JobState.FAILED_TRANSIENT);
    }

    public long cancelled() {
        return count(JobState.CANCELLED);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean isComplete() {
        return pending() == 0;
    }
}
