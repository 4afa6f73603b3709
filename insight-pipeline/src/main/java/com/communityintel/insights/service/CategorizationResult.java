package com.communityintel.insights.service;

import com.communityintel.insights.model.Post;

import java.util.List;

/**
 * Output of {@link CategorizationEngine#categorize}: the category set and every post,
 * in fetch order, with its assignment (null category when its batch failed).
 */
public record CategorizationResult(List<String> categories, List<Post> posts, int failedBatches,
                                   boolean categoriesProvided) {

    public long unclassifiedCount() {
        return posts.stream().filter(p -> !p.isClassified()).count();
    }
}
