package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.config.InsightPipelineProperties.Scheduler.SameSourcePolicy;
import com.communityintel.insights.exception.InvalidJobConfigException;
import com.communityintel.insights.exception.SchedulerSaturatedException;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.RunMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Accepts job requests and hands them to the worker pool.
 *
 * Submission validates synchronously and returns as soon as the job is queued.
 * Under the SERIALIZE policy a job for a source that already has one pending is chained
 * behind it and only handed to the pool once it finishes, so an update job always sees
 * the run published before it and no worker sits waiting on another job.
 */
@Service
@Slf4j
public class PipelineJobScheduler {

    static final Pattern SOURCE_NAME = Pattern.compile("[A-Za-z0-9_]{1,64}");

    private final PipelineJobRegistry registry;
    private final InsightPipelineService pipelineService;
    private final TaskExecutor executor;
    private final SameSourcePolicy policy;

    /** Completion of the newest job per source under SERIALIZE. Get-and-replace guarded by itself. */
    private final Map<String, CompletableFuture<PipelineJob>> sourceTails = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<PipelineJob>> completions = new ConcurrentHashMap<>();

    public PipelineJobScheduler(PipelineJobRegistry registry,
                                InsightPipelineService pipelineService,
                                @Qualifier("pipelineExecutor") TaskExecutor executor,
                                InsightPipelineProperties properties) {
        this.registry = registry;
        this.pipelineService = pipelineService;
        this.executor = executor;
        this.policy = properties.getScheduler().getSameSourcePolicy();
    }

    /**
     * Validates and queues a job.
     *
     * @return the new job's id
     * @throws InvalidJobConfigException   when the request is rejected; no job is created
     * @throws SchedulerSaturatedException when the worker queue is full; no job is kept
     */
    public String submit(JobRequest request) {
        JobRequest normalized = validate(request);
        PipelineJob job = registry.register(normalized);
        String jobId = job.getJobId();
        CompletableFuture<PipelineJob> done = new CompletableFuture<>();
        completions.put(jobId, done);

        try {
            if (policy == SameSourcePolicy.SERIALIZE) {
                enqueueBehindSource(jobId, job.getSource(), done);
            } else {
                executor.execute(() -> run(jobId, done));
            }
        } catch (TaskRejectedException e) {
            completions.remove(jobId);
            registry.remove(jobId);
            throw new SchedulerSaturatedException("Job queue is full, try again later", e);
        }

        log.info("Queued job {} for {} ({})", jobId, job.getSource(), job.getMode());
        return jobId;
    }

    public PipelineJob getStatus(String jobId) {
        return registry.get(jobId);
    }

    public List<PipelineJob> list() {
        return registry.list();
    }

    /**
     * Completes with the job's terminal state.
     */
    public CompletableFuture<PipelineJob> awaitCompletion(String jobId) {
        CompletableFuture<PipelineJob> pending = completions.get(jobId);
        if (pending != null) {
            return pending;
        }
        // Already finished and released; the registry holds the final state.
        return CompletableFuture.completedFuture(registry.get(jobId));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Runs the job now when nothing is pending for the source, otherwise once the current tail
     * finishes. Only the immediate dispatch can be rejected back to the caller.
     */
    private void enqueueBehindSource(String jobId, String source, CompletableFuture<PipelineJob> done) {
        synchronized (sourceTails) {
            CompletableFuture<PipelineJob> previous = sourceTails.get(source);
            if (previous == null || previous.isDone()) {
                executor.execute(() -> run(jobId, done));
            } else {
                log.debug("Job {} waits for the pending job on {}", jobId, source);
                previous.whenComplete((result, error) -> dispatch(jobId, done));
            }
            sourceTails.put(source, done);
        }
        done.whenComplete((result, error) -> sourceTails.remove(source, done));
    }

    private void dispatch(String jobId, CompletableFuture<PipelineJob> done) {
        try {
            executor.execute(() -> run(jobId, done));
        } catch (TaskRejectedException e) {
            log.warn("Job {} rejected by the worker pool after waiting for its source", jobId);
            completions.remove(jobId);
            done.complete(registry.markFailed(jobId, "Job queue is full, try again later"));
        }
    }

    private void run(String jobId, CompletableFuture<PipelineJob> done) {
        try {
            done.complete(pipelineService.execute(jobId));
        } catch (RuntimeException e) {
            log.error("Job {} aborted outside the pipeline: {}", jobId, e.getMessage(), e);
            done.completeExceptionally(e);
        } finally {
            completions.remove(jobId);
        }
    }

    JobRequest validate(JobRequest request) {
        if (request == null) {
            throw new InvalidJobConfigException("Request body is required");
        }
        String source = request.getSource() == null ? null : request.getSource().strip();
        if (source == null || source.isEmpty()) {
            throw new InvalidJobConfigException("source is required");
        }
        if (!SOURCE_NAME.matcher(source).matches()) {
            throw new InvalidJobConfigException(
                    "source must be 1-64 letters, digits or underscores (got '" + source + "')");
        }

        int maxItems = request.getMaxItems() != null ? request.getMaxItems() : 700;
        checkRange("maxItems", maxItems, 10, 5000);

        int minClusterSize = request.getMinClusterSize() != null ? request.getMinClusterSize() : 3;
        checkRange("minClusterSize", minClusterSize, 2, 50);

        if (request.getLookbackDays() != null && request.getLookbackDays() < 1) {
            throw new InvalidJobConfigException("lookbackDays must be at least 1 (got " + request.getLookbackDays() + ")");
        }
        if (request.getCategoryCount() != null) {
            checkRange("categoryCount", request.getCategoryCount(), 2, 20);
        }
        if (request.getCategories() != null && !request.getCategories().isEmpty()) {
            Set<String> seen = new HashSet<>();
            for (String c : request.getCategories()) {
                if (c == null || c.isBlank()) {
                    throw new InvalidJobConfigException("categories must not contain blank names");
                }
                if (!seen.add(c.strip().toLowerCase(Locale.ROOT))) {
                    throw new InvalidJobConfigException("duplicate category '" + c.strip() + "'");
                }
            }
        }

        return JobRequest.builder()
                .source(source)
                .mode(request.getMode() != null ? request.getMode() : RunMode.NEW)
                .lookbackDays(request.getLookbackDays())
                .maxItems(maxItems)
                .minClusterSize(minClusterSize)
                .categoryCount(request.getCategoryCount())
                .categories(request.getCategories() != null ? List.copyOf(request.getCategories()) : null)
                .build();
    }

    private static void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw InvalidJobConfigException.outOfRange(field, value, min, max);
        }
    }
}
