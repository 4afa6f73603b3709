package com.communityintel.insights.exception;

public class SchedulerSaturatedException extends PipelineException {

    public SchedulerSaturatedException(String message, Throwable cause) {
        super("SCHEDULER_SATURATED", message, cause);
    }
}
