package io.mailagenda.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * JobFilter describes which jobs to list.
 *
 * <p>This is an API-layer object, not a database query. Each store translates it into its own
 * query. An empty filter matches every job.
 */
public final class JobFilter {

    private final Set<JobState> states;
    private final String campaignId;
    private final int limit;

    private JobFilter(Set<JobState> states, String campaignId, int limit) {
        this.states = states.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(states));
        this.campaignId = (campaignId == null || campaignId.isBlank()) ? null : campaignId;
        this.limit = limit;
    }

    /**
     * States to include; empty means any state.
     */
    public Set<JobState> states() {
        return states;
    }

    /**
     * Campaign tag to match, or null.
     */
    public String campaignId() {
        return campaignId;
    }

    /**
     * Maximum number of jobs returned; {@code Integer.MAX_VALUE} for no limit.
     */
    public int limit() {
        return limit;
    }

    public boolean matches(MailJob job) {
        if (!states.isEmpty() && !states.contains(job.state())) {
            return false;
        }
        return campaignId == null || campaignId.equals(job.campaignId());
    }

    public static JobFilter all() {
        return builder().build();
    }

    public static JobFilter byState(JobState state) {
        return builder().state(state).build();
    }

    public static JobFilter byCampaign(String campaignId) {
        return builder().campaignId(campaignId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<JobState> states = EnumSet.noneOf(JobState.class);
        private String campaignId;
        private int limit = Integer.MAX_VALUE;

        public Builder state(JobState state) {
            if (state != null) {
                this.states.add(state);
            }
            return this;
        }

        public Builder states(Set<JobState> states) {
            if (states != null) {
                this.states.addAll(states);
            }
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be a positive number");
            }
            this.limit = limit;
            return this;
        }

        public JobFilter build() {
            return new JobFilter(states, campaignId, limit);
        }
    }
}
