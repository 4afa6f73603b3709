package com.communityintel.insights.output;

import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Audit trail of finished jobs and published categories in ClickHouse.
 * Only used when insight-pipeline.audit.enabled is set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseAuditWriter {

    private static final DateTimeFormatter CH_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse audit schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS insight_pipeline");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS insight_pipeline.pipeline_jobs
            (
                job_id              String,
                source              LowCardinality(String),
                mode                LowCardinality(String),
                status              LowCardinality(String),
                created_at          DateTime,
                started_at          Nullable(DateTime),
                completed_at        Nullable(DateTime),
                window_start        Nullable(DateTime),
                window_end          Nullable(DateTime),
                run_id              Nullable(String),
                posts_fetched       Int32,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (created_at, source)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS insight_pipeline.run_categories
            (
                run_id              String,
                source              LowCardinality(String),
                generated_at        DateTime,
                category            String,
                post_count          Int32,
                avg_engagement      Float64,
                avg_sentiment       Float64,
                dominant_sentiment  LowCardinality(String),
                narrative_status    LowCardinality(String)
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYYYYMM(generated_at)
            ORDER BY (source, run_id, category)
        """);

        log.info("ClickHouse audit schema ready.");
    }

    public void writeJob(PipelineJob job) {
        String sql = String.format("""
            INSERT INTO insight_pipeline.pipeline_jobs
            (job_id, source, mode, status, created_at, started_at, completed_at,
             window_start, window_end, run_id, posts_fetched, error_message)
            VALUES (%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%d,%s)
            """,
                sqlStr(job.getJobId()),
                sqlStr(job.getSource()),
                sqlStr(job.getMode()),
                sqlStr(job.getStatus().label()),
                sqlTime(job.getCreatedAt()),
                sqlTime(job.getStartedAt()),
                sqlTime(job.getCompletedAt()),
                sqlTime(job.getWindow() != null ? job.getWindow().start() : null),
                sqlTime(job.getWindow() != null ? job.getWindow().end() : null),
                sqlStr(job.getRunId()),
                job.getPostsFetched(),
                sqlStr(job.getError()));
        jdbcTemplate.execute(sql);
    }

    public void writeCategories(RunSnapshot snapshot) {
        if (snapshot.getCategories() == null || snapshot.getCategories().isEmpty()) return;
        RunMetadata meta = snapshot.getMetadata();

        String rows = snapshot.getCategories().stream()
                .map(c -> toValueRow(meta, c))
                .collect(Collectors.joining(",\n"));

        jdbcTemplate.execute("""
            INSERT INTO insight_pipeline.run_categories
            (run_id, source, generated_at, category, post_count, avg_engagement,
             avg_sentiment, dominant_sentiment, narrative_status)
            VALUES
            """ + rows);
        log.debug("Audited {} categories for {}", snapshot.getCategories().size(), meta.getRunId());
    }

    private String toValueRow(RunMetadata meta, CategorySummary c) {
        return String.format(Locale.ROOT, "(%s,%s,%s,%s,%d,%f,%f,%s,%s)",
                sqlStr(meta.getRunId()),
                sqlStr(meta.getSource()),
                sqlTime(meta.getGeneratedAt()),
                sqlStr(c.getName()),
                c.getPostCount(),
                c.getAvgEngagement(),
                c.getAvgSentiment(),
                sqlStr(c.getDominantSentiment().label()),
                sqlStr(c.getNarrativeStatus()));
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlTime(Instant t) {
        return t == null ? "NULL" : "'" + CH_DATETIME.format(t) + "'";
    }
}
