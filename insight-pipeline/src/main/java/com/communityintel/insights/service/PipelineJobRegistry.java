package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.JobNotFoundException;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.JobStatus;
import com.communityintel.insights.model.PipelineJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Single owner of job records. Every read returns a copy and every write goes through
 * a named transition, all under one lock.
 *
 * Terminal jobs beyond the retention limit are evicted oldest first; active jobs are kept.
 */
@Component
@Slf4j
public class PipelineJobRegistry {

    private final Object lock = new Object();
    private final Map<String, PipelineJob> jobs = new LinkedHashMap<>();
    private final int maxRetainedJobs;
    private final Clock clock;

    public PipelineJobRegistry(InsightPipelineProperties properties, Clock clock) {
        this.maxRetainedJobs = Math.max(1, properties.getScheduler().getMaxRetainedJobs());
        this.clock = clock;
    }

    public PipelineJob register(JobRequest request) {
        PipelineJob job = PipelineJob.builder()
                .jobId(UUID.randomUUID().toString())
                .source(request.getSource())
                .mode(request.getMode())
                .request(request.copy())
                .status(JobStatus.QUEUED)
                .createdAt(clock.instant())
                .build();
        synchronized (lock) {
            jobs.put(job.getJobId(), job);
            evictFinished();
        }
        return job.copy();
    }

    /** Drops a job that never reached the worker pool. */
    public void remove(String jobId) {
        synchronized (lock) {
            jobs.remove(jobId);
        }
    }

    public PipelineJob get(String jobId) {
        synchronized (lock) {
            PipelineJob job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            return job.copy();
        }
    }

    /** Newest first; insertion order breaks ties on equal creation times. */
    public List<PipelineJob> list() {
        List<PipelineJob> copies;
        synchronized (lock) {
            copies = new ArrayList<>(jobs.size());
            jobs.values().forEach(j -> copies.add(j.copy()));
        }
        List<PipelineJob> newestFirst = new ArrayList<>(copies.size());
        for (int i = copies.size() - 1; i >= 0; i--) {
            newestFirst.add(copies.get(i));
        }
        newestFirst.sort((a, b) -> b.getCreatedAt().compareTo(a.getCreatedAt()));
        return newestFirst;
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    public PipelineJob markRunning(String jobId) {
        return transition(jobId, JobStatus.RUNNING, j -> j.setStartedAt(clock.instant()));
    }

    public PipelineJob markCompleted(String jobId, String runId, int postsFetched) {
        return transition(jobId, JobStatus.COMPLETED, j -> {
            j.setRunId(runId);
            j.setPostsFetched(postsFetched);
            j.setCompletedAt(clock.instant());
        });
    }

    public PipelineJob markFailed(String jobId, String error) {
        return transition(jobId, JobStatus.FAILED, j -> {
            j.setError(error);
            j.setCompletedAt(clock.instant());
        });
    }

    public PipelineJob recordWindow(String jobId, FetchWindow window) {
        return update(jobId, j -> j.setWindow(window));
    }

    public PipelineJob recordPostsFetched(String jobId, int postsFetched) {
        return update(jobId, j -> j.setPostsFetched(postsFetched));
    }

    private PipelineJob transition(String jobId, JobStatus next, Consumer<PipelineJob> change) {
        synchronized (lock) {
            PipelineJob job = find(jobId);
            if (!job.getStatus().canTransitionTo(next)) {
                throw new IllegalStateException(String.format(
                        "Job %s cannot move from %s to %s", jobId, job.getStatus(), next));
            }
            job.setStatus(next);
            change.accept(job);
            if (next.isTerminal()) {
                evictFinished();
            }
            return job.copy();
        }
    }

    private PipelineJob update(String jobId, Consumer<PipelineJob> change) {
        synchronized (lock) {
            PipelineJob job = find(jobId);
            if (job.getStatus().isTerminal()) {
                throw new IllegalStateException("Job " + jobId + " is already " + job.getStatus());
            }
            change.accept(job);
            return job.copy();
        }
    }

    private PipelineJob find(String jobId) {
        PipelineJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    // Caller holds the lock.
    private void evictFinished() {
        long finished = jobs.values().stream().filter(j -> j.getStatus().isTerminal()).count();
        Iterator<PipelineJob> it = jobs.values().iterator();
        while (finished > maxRetainedJobs && it.hasNext()) {
            PipelineJob job = it.next();
            if (job.getStatus().isTerminal()) {
                it.remove();
                finished--;
                log.debug("Evicted finished job {} ({})", job.getJobId(), job.getStatus());
            }
        }
    }

    int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }
}
