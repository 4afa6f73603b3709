package com.communityintel.insights.model;

public enum NarrativeStatus {
    GENERATED,
    /** The model failed or returned nothing; a placeholder text is stored instead. */
    GENERATION_FAILED,
    /** Fewer posts than minClusterSize, so no narrative was requested. */
    INSUFFICIENT_DATA
}
