package com.communityintel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RunMetadata {

    private String runId;           // {source}_{yyyyMMdd_HHmmss}, assigned on publish
    private String source;
    private String jobId;
    private RunMode mode;
    private Instant generatedAt;
    private FetchWindow window;
    private DateRange dateRange;    // span of the fetched posts
    private int numPosts;
    private int numClassified;
    private int numUnclassified;
    private int numCategories;
    private int numInsights;
    private boolean categoriesProvided;
    private int failedBatches;
    private int minClusterSize;
}
