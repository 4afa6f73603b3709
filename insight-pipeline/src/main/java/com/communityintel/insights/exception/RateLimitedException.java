package com.communityintel.insights.exception;

public class RateLimitedException extends PipelineException {

    public RateLimitedException(String message) {
        super("RATE_LIMITED", message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super("RATE_LIMITED", message, cause);
    }
}
