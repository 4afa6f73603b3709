package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/** Inclusive range of post timestamps; both ends null when there are no posts. */
public record DateRange(Instant start, Instant end) {

    public static final DateRange EMPTY = new DateRange(null, null);

    public static DateRange of(Collection<Post> posts) {
        Instant min = null;
        Instant max = null;
        for (Post p : posts) {
            Instant t = p.getCreatedAt();
            if (t == null) continue;
            if (min == null || t.isBefore(min)) min = t;
            if (max == null || t.isAfter(max)) max = t;
        }
        return min == null ? EMPTY : new DateRange(min, max);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return Objects.isNull(start);
    }
}
