package com.communityintel.insights.config;

import com.communityintel.insights.model.CategoryInsight;
import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.RunSummary;
import com.communityintel.insights.model.SourceSummary;
import com.communityintel.insights.service.SnapshotQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read API over published runs. Every {@code /data/{source}} endpoint serves the source's latest run
 * unless a run id is given.
 */
@RestController
@RequiredArgsConstructor
public class SnapshotController {

    private final SnapshotQueryService queryService;

    @GetMapping({"/sources", "/subreddits"})
    public ResponseEntity<Map<String, List<SourceSummary>>> sources() {
        return ResponseEntity.ok(Map.of("sources", queryService.sources()));
    }

    @GetMapping("/data/{source}")
    public ResponseEntity<RunSnapshot> snapshot(@PathVariable String source) {
        return ResponseEntity.ok(queryService.snapshot(source));
    }

    @GetMapping("/data/{source}/metadata")
    public ResponseEntity<RunMetadata> metadata(@PathVariable String source) {
        return ResponseEntity.ok(queryService.metadata(source));
    }

    @GetMapping("/data/{source}/categories")
    public ResponseEntity<List<CategorySummary>> categories(@PathVariable String source) {
        return ResponseEntity.ok(queryService.categories(source));
    }

    @GetMapping("/data/{source}/insights")
    public ResponseEntity<List<CategoryInsight>> insights(@PathVariable String source) {
        return ResponseEntity.ok(queryService.insights(source));
    }

    @GetMapping("/data/{source}/insights/{insightId}")
    public ResponseEntity<CategoryInsight> insight(@PathVariable String source, @PathVariable String insightId) {
        return ResponseEntity.ok(queryService.insight(source, insightId));
    }

    @GetMapping("/data/{source}/history")
    public ResponseEntity<Map<String, List<RunSummary>>> history(@PathVariable String source) {
        return ResponseEntity.ok(Map.of("runs", queryService.history(source)));
    }

    @GetMapping("/data/{source}/runs/{runId}")
    public ResponseEntity<RunSnapshot> run(@PathVariable String source, @PathVariable String runId) {
        return ResponseEntity.ok(queryService.run(source, runId));
    }
}
