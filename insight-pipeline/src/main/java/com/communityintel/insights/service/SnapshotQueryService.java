package com.communityintel.insights.service;

import com.communityintel.insights.exception.InsightNotFoundException;
import com.communityintel.insights.exception.RunNotFoundException;
import com.communityintel.insights.model.CategoryInsight;
import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.DateRange;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.RunSummary;
import com.communityintel.insights.model.SourceSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over published runs. Only ever sees what the store has published,
 * so a run that is still being written is invisible here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SnapshotQueryService {

    private final RunVersionStore store;

    public List<SourceSummary> sources() {
        List<SourceSummary> result = new ArrayList<>();
        for (String source : store.list()) {
            store.latest(source).ifPresent(snapshot -> {
                RunMetadata meta = snapshot.getMetadata();
                result.add(new SourceSummary(
                        source,
                        meta.getRunId(),
                        meta.getGeneratedAt(),
                        meta.getNumPosts(),
                        meta.getWindow(),
                        DateRange.of(snapshot.getPosts()),
                        store.history(source).size()));
            });
        }
        return result;
    }

    public RunSnapshot snapshot(String source) {
        return store.latest(source).orElseThrow(() -> RunNotFoundException.forSource(source));
    }

    public RunMetadata metadata(String source) {
        return snapshot(source).getMetadata();
    }

    public List<CategorySummary> categories(String source) {
        return snapshot(source).getCategories();
    }

    public List<CategoryInsight> insights(String source) {
        return snapshot(source).getInsights();
    }

    public CategoryInsight insight(String source, String insightId) {
        return insights(source).stream()
                .filter(i -> i.getId().equals(insightId))
                .findFirst()
                .orElseThrow(() -> new InsightNotFoundException(source, insightId));
    }

    /** Oldest first. */
    public List<RunSummary> history(String source) {
        List<RunSummary> runs = store.history(source);
        if (runs.isEmpty()) {
            throw RunNotFoundException.forSource(source);
        }
        return runs;
    }

    public RunSnapshot run(String source, String runId) {
        return store.load(source, runId).orElseThrow(() -> RunNotFoundException.forRun(source, runId));
    }
}
