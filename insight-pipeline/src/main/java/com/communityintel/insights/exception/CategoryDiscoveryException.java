package com.communityintel.insights.exception;

public class CategoryDiscoveryException extends PipelineException {

    public CategoryDiscoveryException(String message) {
        super("DISCOVERY_FAILED", message);
    }

    public CategoryDiscoveryException(String message, Throwable cause) {
        super("DISCOVERY_FAILED", message, cause);
    }
}
