package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SentimentBucket {
    POSITIVE, NEUTRAL, NEGATIVE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SentimentBucket fromLabel(String label) {
        return Sentiment.ofLabel(label).bucket();
    }
}
