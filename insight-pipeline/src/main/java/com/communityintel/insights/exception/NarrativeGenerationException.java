package com.communityintel.insights.exception;

public class NarrativeGenerationException extends PipelineException {

    public NarrativeGenerationException(String category, String message) {
        super("NARRATIVE_FAILED", "Narrative for '" + category + "' failed: " + message);
    }

    public NarrativeGenerationException(String category, Throwable cause) {
        super("NARRATIVE_FAILED", "Narrative for '" + category + "' failed: " + cause.getMessage(), cause);
    }
}
