package com.communityintel.insights.exception;

public class NoPriorRunException extends PipelineException {

    public NoPriorRunException(String source) {
        super("NO_PRIOR_RUN", "Update requested for '" + source + "' but it has no published run");
    }
}
