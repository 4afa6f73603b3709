package com.communityintel.insights.model;

import java.time.Instant;

/** One row of /data/{source}/history. */
public record RunSummary(String runId, Instant generatedAt, FetchWindow window, DateRange dateRange,
                         int numPosts, int numInsights, boolean current) {

    public static RunSummary of(RunMetadata meta, boolean current) {
        return new RunSummary(
                meta.getRunId(),
                meta.getGeneratedAt(),
                meta.getWindow(),
                meta.getDateRange() != null ? meta.getDateRange() : DateRange.EMPTY,
                meta.getNumPosts(),
                meta.getNumInsights(),
                current);
    }
}
