package com.communityintel.insights.service;

import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.RedditApiListing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Maps raw reddit submissions to the normalised Post model.
 */
@Component
@Slf4j
public class RedditPostMapper {

    private static final String REDDIT_HOST = "https://www.reddit.com";

    /**
     * @param raw    submission as returned by the listing endpoint
     * @param source the source the listing was read from, used when the payload omits it
     * @return the mapped post, or null when the submission lacks an id or a timestamp
     */
    public Post map(RedditApiListing.Submission raw, String source) {
        if (raw == null || raw.getId() == null || raw.getCreatedUtc() == null) {
            log.debug("Skipping submission without id or timestamp");
            return null;
        }
        return Post.builder()
                .id(raw.getId())
                .source(raw.getSubreddit() != null ? raw.getSubreddit() : source)
                .permalink(absolutePermalink(raw.getPermalink()))
                .title(emptyToNull(raw.getTitle()))
                .body(emptyToNull(raw.getSelftext()))
                .author(raw.getAuthor())
                .flair(emptyToNull(raw.getLinkFlairText()))
                .createdAt(toInstant(raw.getCreatedUtc()))
                .score(raw.getScore() != null ? raw.getScore() : 0L)
                .numComments(raw.getNumComments() != null ? raw.getNumComments() : 0L)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Instant toInstant(double epochSeconds) {
        long seconds = (long) epochSeconds;
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private String absolutePermalink(String permalink) {
        if (permalink == null || permalink.isBlank()) return null;
        return permalink.startsWith("http") ? permalink : REDDIT_HOST + permalink;
    }

    private String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
