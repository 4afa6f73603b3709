package com.communityintel.insights.scheduler;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.RunMode;
import com.communityintel.insights.output.ClickHouseAuditWriter;
import com.communityintel.insights.service.PipelineJobScheduler;
import com.communityintel.insights.service.RunVersionStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Startup housekeeping and the scheduled refresh of configured sources.
 *
 * Default schedule: every day at 03:00 UTC. Sources with a published run get an
 * UPDATE job; sources seen for the first time get a NEW job with the default lookback.
 *
 * Override with REFRESH_CRON env var or insight-pipeline.refresh.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RefreshScheduler {

    private final PipelineJobScheduler jobScheduler;
    private final RunVersionStore runVersionStore;
    private final ClickHouseAuditWriter auditWriter;
    private final InsightPipelineProperties properties;

    /**
     * On application startup:
     *  1. Clean up staging leftovers and repair latest pointers
     *  2. Ensure the audit schema exists, when auditing is on
     */
    @PostConstruct
    public void onStartup() {
        runVersionStore.recover();

        if (properties.getAudit().isEnabled()) {
            try {
                auditWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse audit schema: {}", e.getMessage());
            }
        }

        InsightPipelineProperties.Refresh refresh = properties.getRefresh();
        if (refresh.isEnabled()) {
            log.info("Pipeline ready. Refreshing {} on schedule {}", refresh.getSources(), refresh.getCron());
        } else {
            log.info("Pipeline ready. Scheduled refresh disabled");
        }
    }

    @Scheduled(cron = "${insight-pipeline.refresh.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledRefresh() {
        InsightPipelineProperties.Refresh refresh = properties.getRefresh();
        if (!refresh.isEnabled()) return;

        log.info("Scheduled refresh triggered for {} sources", refresh.getSources().size());
        for (String source : refresh.getSources()) {
            try {
                RunMode mode = runVersionStore.latestRunId(source).isPresent() ? RunMode.UPDATE : RunMode.NEW;
                String jobId = jobScheduler.submit(JobRequest.builder()
                        .source(source)
                        .mode(mode)
                        .maxItems(refresh.getMaxItems())
                        .minClusterSize(refresh.getMinClusterSize())
                        .build());
                log.info("Refresh of {} queued as {} job {}", source, mode, jobId);
            } catch (Exception e) {
                log.error("Scheduled refresh of {} failed: {}", source, e.getMessage(), e);
            }
        }
    }
}
