package com.communityintel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Narrative view of a theme within a category, served by /data/{source}/insights.
 * Only categories that reached minClusterSize get insights; with theme clustering on,
 * each cluster of at least minClusterSize posts gets its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryInsight {

    private String id;              // insight-{category slug}[-{cluster}|-all|-fallback], unique per run
    private String category;
    private String theme;           // null when the insight covers the whole category
    private int clusterSize;
    private String narrative;
    private NarrativeStatus status;
    private int postCount;
    private double avgSentiment;
    private long totalEngagement;
    private DateRange timeRange;
    private List<String> linkedPosts;
    private List<PostRef> linkedPostsFull;
}
