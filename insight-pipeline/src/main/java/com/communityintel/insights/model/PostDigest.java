package com.communityintel.insights.model;

/** Summary and sentiment label the model produced for one post. */
public record PostDigest(String postId, String summary, String sentimentLabel) {
}
