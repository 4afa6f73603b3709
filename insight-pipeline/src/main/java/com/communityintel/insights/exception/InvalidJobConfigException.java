package com.communityintel.insights.exception;

/**
 * Rejected job parameters. Raised synchronously at submission; no job is created.
 */
public class InvalidJobConfigException extends PipelineException {

    public InvalidJobConfigException(String message) {
        super("INVALID_CONFIG", message);
    }

    public static InvalidJobConfigException outOfRange(String field, Object value, int min, int max) {
        return new InvalidJobConfigException(
                String.format("%s must be between %d and %d (got %s)", field, min, max, value));
    }
}
