package com.communityintel.insights.service;

import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.output.RunOutputWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Runs one job through every stage, strictly in order:
 *   window → fetch → categorize → aggregate → write and publish
 *
 * Whatever goes wrong, the job ends in a terminal state and its staging directory is gone.
 * Nothing becomes visible to readers unless publish succeeded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InsightPipelineService {

    private final PipelineJobRegistry registry;
    private final DateRangeCalculator dateRangeCalculator;
    private final ContentSource contentSource;
    private final CategorizationEngine categorizationEngine;
    private final InsightAggregator insightAggregator;
    private final RunVersionStore runVersionStore;
    private final RunOutputWriter outputWriter;
    private final Clock clock;

    public PipelineJob execute(String jobId) {
        PipelineJob job = registry.markRunning(jobId);
        JobRequest request = job.getRequest();
        String source = job.getSource();
        log.info("Job {} started: source={}, mode={}", jobId, source, job.getMode());

        RunSnapshot published = null;
        Path staging = null;
        try {
            FetchWindow window = dateRangeCalculator.computeWindow(source, job.getMode(),
                    request.getLookbackDays(), runVersionStore.history(source), clock.instant());
            registry.recordWindow(jobId, window);
            log.info("Job {} window: {} → {} ({} days)", jobId, window.start(), window.end(), window.days());

            List<Post> posts = contentSource.fetch(source, window, request.getMaxItems());
            registry.recordPostsFetched(jobId, posts.size());
            log.info("Job {} fetched {} posts from {}", jobId, posts.size(), source);

            CategorizationResult categorized = categorizationEngine.categorize(posts, request);
            List<CategorySummary> categories = insightAggregator.summarize(categorized, request.getMinClusterSize());
            RunSnapshot snapshot = insightAggregator.assemble(job, window, categorized, categories, clock.instant());

            staging = runVersionStore.stage(jobId);
            published = runVersionStore.publish(snapshot, staging, outputWriter);
            staging = null;

            job = registry.markCompleted(jobId, published.getMetadata().getRunId(), posts.size());
            log.info("Job {} completed: run {}", jobId, job.getRunId());

        } catch (Exception e) {
            log.error("Job {} failed for {}: {}", jobId, source, e.getMessage(), e);
            job = registry.markFailed(jobId, describe(e));
        } finally {
            runVersionStore.discard(staging);
        }

        outputWriter.writeJob(job, published);
        return job;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
