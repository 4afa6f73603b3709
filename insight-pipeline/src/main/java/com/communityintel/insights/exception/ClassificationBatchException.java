package com.communityintel.insights.exception;

import lombok.Getter;

/**
 * A classification batch that failed on both attempts. Never aborts a job:
 * the batch's posts are left unclassified.
 */
@Getter
public class ClassificationBatchException extends PipelineException {

    private final int batchIndex;

    public ClassificationBatchException(int batchIndex, String message) {
        super("CLASSIFICATION_BATCH_FAILED", message);
        this.batchIndex = batchIndex;
    }

    public ClassificationBatchException(int batchIndex, String message, Throwable cause) {
        super("CLASSIFICATION_BATCH_FAILED", message, cause);
        this.batchIndex = batchIndex;
    }

    public static ClassificationBatchException malformed(int batchIndex, String reason) {
        return new ClassificationBatchException(batchIndex, "Malformed classification response: " + reason);
    }
}
