package com.communityintel.insights.exception;

public class JobNotFoundException extends PipelineException {

    public JobNotFoundException(String jobId) {
        super("JOB_NOT_FOUND", "Job not found: " + jobId);
    }
}
