package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One pipeline execution, from submission to its terminal state.
 * Instances handed out by the registry are copies; mutating them changes nothing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineJob {

    private String jobId;
    private String source;
    private RunMode mode;
    private JobRequest request;
    private JobStatus status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String error;           // null unless failed
    private FetchWindow window;     // set once the window is computed
    private String runId;           // set once published
    private int postsFetched;

    /** The dashboard still reads the old field name. */
    @JsonProperty("subreddit")
    public String getSubreddit() {
        return source;
    }

    public PipelineJob copy() {
        return toBuilder().request(request != null ? request.copy() : null).build();
    }
}
