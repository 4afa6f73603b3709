package com.communityintel.insights.model;

import java.time.Instant;

/** Compact reference to a post, used for top posts and insight drill-down. */
public record PostRef(String id, String title, long score, long numComments,
                      SentimentBucket sentiment, Instant createdAt, String permalink) {

    public static PostRef of(Post post) {
        return new PostRef(
                post.getId(),
                post.getTitle(),
                post.getScore(),
                post.getNumComments(),
                post.getSentiment() != null ? post.getSentiment().bucket() : SentimentBucket.NEUTRAL,
                post.getCreatedAt(),
                post.getPermalink());
    }
}
