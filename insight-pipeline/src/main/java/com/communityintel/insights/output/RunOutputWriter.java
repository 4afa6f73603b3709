package com.communityintel.insights.output;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.service.RunVersionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Routes a run's content to the enabled file writers, and finished jobs to the audit sink.
 * The JSON artefacts are always written; CSV and report are switchable.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunOutputWriter implements RunVersionStore.RunContentWriter {

    private final SnapshotJsonWriter jsonWriter;
    private final CsvSummaryWriter csvWriter;
    private final MarkdownReportWriter reportWriter;
    private final ClickHouseAuditWriter auditWriter;
    private final InsightPipelineProperties properties;

    @Override
    public void write(Path directory, RunSnapshot snapshot) throws IOException {
        InsightPipelineProperties.Output output = properties.getOutput();

        jsonWriter.write(directory, snapshot);
        if (output.isWriteCsvSummary()) {
            csvWriter.write(directory, snapshot.getPosts());
        }
        if (output.isWriteReport()) {
            reportWriter.write(directory, snapshot);
        }
    }

    public void writeJob(PipelineJob job, RunSnapshot published) {
        if (!properties.getAudit().isEnabled()) return;
        try {
            auditWriter.writeJob(job);
            if (published != null) {
                auditWriter.writeCategories(published);
            }
        } catch (Exception e) {
            log.warn("Failed to write job audit for {}: {}", job.getJobId(), e.getMessage());
        }
    }
}
