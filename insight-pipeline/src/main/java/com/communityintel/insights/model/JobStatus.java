package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * queued → running → completed | failed. Terminal states never change.
 */
public enum JobStatus {
    QUEUED, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
