package com.communityintel.insights.model;

/** One model answer for one post: which category, and how sure. */
public record ClassificationResult(String postId, String category, double confidence) {
}
