package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum RunMode {
    /** Window supplied by the caller (lookbackDays back from now). */
    NEW,
    /** Window computed from the source's latest run plus a fixed overlap. */
    UPDATE;

    @JsonCreator
    public static RunMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return NEW;
        }
        return RunMode.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
