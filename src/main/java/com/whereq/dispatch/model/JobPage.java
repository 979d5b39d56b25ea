package com.whereq.dispatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One page of a job listing
 */
@Value
@Builder
public class JobPage {
    @Singular
    List<JobSummary> jobs;

    /**
     * Total number of jobs on the server. Without a paging object in the response this is
     * only offset plus page size.
     */
    long total;

    /**
     * Whether the server reported {@link #getTotal()}
     */
    boolean totalReported;

    long offset;

    long perPage;

    public boolean hasMore() {
        if (totalReported) {
            return offset + jobs.size() < total;
        }
        return perPage > 0 && jobs.size() >= perPage;
    }
}
