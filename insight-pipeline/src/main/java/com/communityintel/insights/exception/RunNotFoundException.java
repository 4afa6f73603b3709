package com.communityintel.insights.exception;

public class RunNotFoundException extends PipelineException {

    public RunNotFoundException(String message) {
        super("RUN_NOT_FOUND", message);
    }

    public static RunNotFoundException forSource(String source) {
        return new RunNotFoundException("No data found for '" + source + "'");
    }

    public static RunNotFoundException forRun(String source, String runId) {
        return new RunNotFoundException("Run '" + runId + "' not found for '" + source + "'");
    }
}
