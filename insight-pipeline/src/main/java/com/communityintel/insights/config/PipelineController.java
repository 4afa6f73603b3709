package com.communityintel.insights.config;

import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.service.PipelineJobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineJobScheduler scheduler;

    // ── Service info ──────────────────────────────────────────────────────────

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "community-intel-insight-pipeline");
        body.put("version", "1.0.0");
        body.put("endpoints", List.of(
                "POST /pipeline/run",
                "GET /pipeline/status/{jobId}",
                "GET /pipeline/jobs",
                "GET /sources",
                "GET /data/{source}",
                "GET /data/{source}/metadata",
                "GET /data/{source}/categories",
                "GET /data/{source}/insights",
                "GET /data/{source}/insights/{insightId}",
                "GET /data/{source}/history",
                "GET /data/{source}/runs/{runId}",
                "GET /health"));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    // ── Job control ───────────────────────────────────────────────────────────

    @PostMapping("/pipeline/run")
    public ResponseEntity<Map<String, String>> run(@RequestBody JobRequest request) {
        String jobId = scheduler.submit(request);
        return ResponseEntity.accepted().body(Map.of(
                "jobId", jobId,
                "status", "queued",
                "message", "Pipeline job queued for " + request.getSource().strip()));
    }

    @GetMapping("/pipeline/status/{jobId}")
    public ResponseEntity<PipelineJob> status(@PathVariable String jobId) {
        return ResponseEntity.ok(scheduler.getStatus(jobId));
    }

    @GetMapping("/pipeline/jobs")
    public ResponseEntity<Map<String, List<PipelineJob>>> jobs() {
        return ResponseEntity.ok(Map.of("jobs", scheduler.list()));
    }
}
