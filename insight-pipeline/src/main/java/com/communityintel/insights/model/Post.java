package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Normalised post as it flows through the pipeline and lands in posts.jsonl.
 *
 *  - category and categoryConfidence stay null when the post could not be classified
 *  - sentiment is optional; when present it is already normalised to a score in [-1, 1]
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Post {

    // ── Source identifiers ──────────────────────────────────────────────────
    private String id;
    private String source;
    private String permalink;

    // ── Content ─────────────────────────────────────────────────────────────
    private String title;
    private String body;
    private String author;
    private String flair;
    private Instant createdAt;

    // ── Engagement ──────────────────────────────────────────────────────────
    private long score;
    private long numComments;

    // ── Enrichment / classification ─────────────────────────────────────────
    /** Short LLM summary, falls back to the title */
    private String summary;
    private Sentiment sentiment;
    private String category;
    private Double categoryConfidence;

    @JsonIgnore
    public long engagement() {
        return score + numComments;
    }

    @JsonIgnore
    public boolean isClassified() {
        return category != null;
    }

    /** First {@code maxChars} of the body, used when building prompts. */
    public String excerpt(int maxChars) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return trimmed.length() <= maxChars ? trimmed : trimmed.substring(0, maxChars) + "...";
    }
}
