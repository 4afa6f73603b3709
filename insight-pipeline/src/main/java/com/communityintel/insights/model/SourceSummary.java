package com.communityintel.insights.model;

import java.time.Instant;

/** One row of /sources. */
public record SourceSummary(String name, String latestRunId, Instant generatedAt, int numPosts,
                            FetchWindow window, DateRange dateRange, int runCount) {
}
