package com.communityintel.insights.service;

import com.communityintel.insights.model.CategoryStatistics;
import com.communityintel.insights.model.ClassificationResult;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.PostDigest;
import com.communityintel.insights.model.ThemeCluster;

import java.util.List;

/**
 * The language-model calls the pipeline depends on. Implementations do prompt construction
 * and response parsing; callers validate what comes back.
 */
public interface LanguageModel {

    /** One digest per post in {@code batch}; missing entries are tolerated by the caller. */
    List<PostDigest> summarize(List<Post> batch);

    /** Up to {@code desiredCount} category names describing the sample. */
    List<String> discoverCategories(List<Post> sample, int desiredCount);

    /** One result per post in {@code batch}, each naming one of {@code categories}. */
    List<ClassificationResult> classify(List<Post> batch, List<String> categories);

    /** Free-text narrative for one category. */
    String summarizeCategory(String category, CategoryStatistics statistics, List<Post> sample);

    /**
     * Groups the posts of one category by theme. Every post id appears in exactly one cluster;
     * clusters smaller than {@code minClusterSize} may be returned and are dropped by the caller.
     */
    List<ThemeCluster> clusterCategory(String category, List<Post> posts, int minClusterSize);

    /** Free-text narrative for one theme cluster inside a category. */
    String summarizeTheme(String category, String theme, CategoryStatistics statistics, List<Post> sample);
}
