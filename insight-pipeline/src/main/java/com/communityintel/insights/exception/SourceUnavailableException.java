package com.communityintel.insights.exception;

public class SourceUnavailableException extends PipelineException {

    public SourceUnavailableException(String message) {
        super("SOURCE_UNAVAILABLE", message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super("SOURCE_UNAVAILABLE", message, cause);
    }

    public static SourceUnavailableException httpStatus(String source, int status) {
        return new SourceUnavailableException("Content source returned HTTP " + status + " for '" + source + "'");
    }
}
