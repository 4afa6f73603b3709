package com.communityintel.insights.model;

import java.time.Duration;
import java.time.Instant;

/** Half-open fetch window [start, end). */
public record FetchWindow(Instant start, Instant end) {

    public boolean contains(Instant t) {
        return t != null && !t.isBefore(start) && t.isBefore(end);
    }

    public long days() {
        return Duration.between(start, end).toDays();
    }
}
