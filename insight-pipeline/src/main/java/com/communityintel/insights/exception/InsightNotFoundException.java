package com.communityintel.insights.exception;

public class InsightNotFoundException extends PipelineException {

    public InsightNotFoundException(String source, String insightId) {
        super("INSIGHT_NOT_FOUND", "Insight '" + insightId + "' not found for '" + source + "'");
    }
}
