package com.communityintel.insights.exception;

public class PublishException extends PipelineException {

    public PublishException(String message) {
        super("PUBLISH_FAILED", message);
    }

    public PublishException(String message, Throwable cause) {
        super("PUBLISH_FAILED", message, cause);
    }
}
