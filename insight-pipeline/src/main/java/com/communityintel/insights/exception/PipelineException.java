package com.communityintel.insights.exception;

import lombok.Getter;

/**
 * Base type for everything the pipeline raises on purpose.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final String errorCode;

    public PipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
