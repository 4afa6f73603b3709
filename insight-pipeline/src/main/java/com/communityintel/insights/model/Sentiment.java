package com.communityintel.insights.model;

import java.util.Locale;

/**
 * Single representation for post sentiment. Labels and numeric values are both folded
 * into a score in [-1, 1] at ingestion, and the bucket is derived from the score.
 */
public record Sentiment(double score, SentimentBucket bucket) {

    private static final double NEUTRAL_BAND = 0.05;

    public static final Sentiment NEUTRAL = new Sentiment(0.0, SentimentBucket.NEUTRAL);

    public Sentiment {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Sentiment score must be a number");
        }
        score = Math.max(-1.0, Math.min(1.0, score));
        if (bucket == null) {
            bucket = bucketFor(score);
        }
    }

    public static Sentiment ofScore(double score) {
        double clamped = Math.max(-1.0, Math.min(1.0, score));
        return new Sentiment(clamped, bucketFor(clamped));
    }

    /**
     * "positive" → +1, "negative" → -1, anything else → 0.
     * Matching is by prefix so "Pos", "NEGATIVE" or "negative." all work.
     */
    public static Sentiment ofLabel(String label) {
        if (label == null) {
            return NEUTRAL;
        }
        String s = label.strip().toLowerCase(Locale.ROOT);
        if (s.startsWith("pos")) {
            return new Sentiment(1.0, SentimentBucket.POSITIVE);
        }
        if (s.startsWith("neg")) {
            return new Sentiment(-1.0, SentimentBucket.NEGATIVE);
        }
        return NEUTRAL;
    }

    private static SentimentBucket bucketFor(double score) {
        if (score > NEUTRAL_BAND) return SentimentBucket.POSITIVE;
        if (score < -NEUTRAL_BAND) return SentimentBucket.NEGATIVE;
        return SentimentBucket.NEUTRAL;
    }
}
