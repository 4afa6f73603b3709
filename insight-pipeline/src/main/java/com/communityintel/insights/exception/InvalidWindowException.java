package com.communityintel.insights.exception;

import java.time.Instant;

public class InvalidWindowException extends PipelineException {

    public InvalidWindowException(String source, Instant start, Instant end) {
        super("INVALID_WINDOW",
                String.format("Computed fetch window for '%s' is empty: start %s is not before end %s",
                        source, start, end));
    }
}
