package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.RateLimitedException;
import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.JobStatus;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.RunMode;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.RunSummary;
import com.communityintel.insights.output.ClickHouseAuditWriter;
import com.communityintel.insights.output.CsvSummaryWriter;
import com.communityintel.insights.output.MarkdownReportWriter;
import com.communityintel.insights.output.RunOutputWriter;
import com.communityintel.insights.output.SnapshotJsonWriter;
import com.communityintel.insights.support.MutableClock;
import com.communityintel.insights.support.StubLanguageModel;
import com.communityintel.insights.support.TestPosts;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InsightPipelineServiceTest {

    private static final List<String> CATEGORIES =
            List.of("Outfit Help", "Thrift Finds", "Brand Talk", "Care Tips", "Style Inspiration");

    @TempDir
    Path baseDir;

    private MutableClock clock;
    private StubLanguageModel model;
    private ContentSource contentSource;
    private PipelineJobRegistry registry;
    private RunVersionStore store;
    private ThreadPoolTaskExecutor executor;
    private InsightPipelineService service;

    @BeforeEach
    void setUp() {
        InsightPipelineProperties properties = TestPosts.properties(baseDir);
        ObjectMapper objectMapper = TestPosts.objectMapper();
        clock = new MutableClock(Instant.parse("2025-10-20T09:00:00Z"));
        model = new StubLanguageModel(CATEGORIES);
        contentSource = mock(ContentSource.class);
        when(contentSource.fetch(eq("demo"), any(), anyInt())).thenReturn(TestPosts.posts(30));

        registry = new PipelineJobRegistry(properties, clock);
        store = new RunVersionStore(properties, objectMapper);
        executor = TestPosts.executor(properties.getCategorization().getMaxConcurrentBatches());
        CategorizationEngine engine = new CategorizationEngine(model, new PostEnricher(model, properties), properties, executor);
        RunOutputWriter outputWriter = new RunOutputWriter(new SnapshotJsonWriter(objectMapper),
                new CsvSummaryWriter(), new MarkdownReportWriter(), mock(ClickHouseAuditWriter.class), properties);

        service = new InsightPipelineService(registry, new DateRangeCalculator(), contentSource, engine,
                new InsightAggregator(model, properties), store, outputWriter, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private PipelineJob run(RunMode mode, Integer categoryCount) {
        JobRequest request = JobRequest.builder()
                .source("demo").mode(mode).lookbackDays(30).categoryCount(categoryCount).build();
        PipelineJob job = registry.register(request);
        return service.execute(job.getJobId());
    }

    @Test
    @DisplayName("demo: 30 posts into 5 categories, all classified and published")
    void demoScenario() throws IOException {
        PipelineJob job = run(RunMode.NEW, 5);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getPostsFetched()).isEqualTo(30);
        assertThat(job.getRunId()).isEqualTo("demo_20251020_090000");

        RunSnapshot latest = store.latest("demo").orElseThrow();
        assertThat(latest.getCategories()).hasSize(5);
        assertThat(latest.getMetadata().getNumUnclassified()).isZero();
        assertThat(latest.getCategories().stream().mapToInt(CategorySummary::getPostCount).sum()).isEqualTo(30);
        assertThat(latest.getInsights()).hasSize(5);

        Path runDir = baseDir.resolve(job.getRunId());
        assertThat(runDir.resolve("posts.jsonl")).exists();
        assertThat(Files.readAllLines(runDir.resolve("posts.jsonl"))).hasSize(30);
        assertThat(runDir.resolve("posts_summary.csv")).exists();
        assertThat(runDir.resolve("categories.json")).exists();
        assertThat(runDir.resolve("insights.json")).exists();
        assertThat(runDir.resolve("REPORT.md")).exists();
        try (Stream<Path> staging = Files.list(baseDir.resolve(".staging"))) {
            assertThat(staging).isEmpty();
        }
    }

    @Test
    @DisplayName("a batch malformed twice: its 10 posts unclassified, job still completes")
    void malformedBatchScenario() {
        model.malformedFor.add("p12");

        PipelineJob job = run(RunMode.NEW, 5);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        RunSnapshot latest = store.latest("demo").orElseThrow();
        assertThat(latest.getMetadata().getNumUnclassified()).isEqualTo(10);
        assertThat(latest.getMetadata().getFailedBatches()).isEqualTo(1);
        int classified = latest.getCategories().stream().mapToInt(CategorySummary::getPostCount).sum();
        assertThat(classified + latest.getMetadata().getNumUnclassified()).isEqualTo(30);
        assertThat(latest.getPosts()).filteredOn(p -> !p.isClassified())
                .extracting(Post::getId)
                .containsExactly("p11", "p12", "p13", "p14", "p15", "p16", "p17", "p18", "p19", "p20");
    }

    @Test
    @DisplayName("rate limited fetch: job fails and history is untouched")
    void rateLimitedScenario() {
        run(RunMode.NEW, 5);
        List<RunSummary> before = store.history("demo");
        when(contentSource.fetch(eq("demo"), any(), anyInt())).thenThrow(new RateLimitedException("429"));
        clock.advance(Duration.ofDays(1));

        PipelineJob job = run(RunMode.UPDATE, 5);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).contains("429");
        assertThat(store.history("demo")).isEqualTo(before);
        assertThat(store.latestRunId("demo")).contains(before.get(0).runId());
    }

    @Test
    @DisplayName("update mode restarts seven days before the previous window end")
    void updateScenario() {
        PipelineJob first = run(RunMode.NEW, 5);
        clock.advance(Duration.ofDays(3));

        PipelineJob second = run(RunMode.UPDATE, 5);

        assertThat(second.getStatus()).isEqualTo(JobStatus.COMPLETED);
        FetchWindow expected = new FetchWindow(
                first.getWindow().end().minus(Duration.ofDays(7)), clock.instant());
        assertThat(second.getWindow()).isEqualTo(expected);
        verify(contentSource).fetch("demo", expected, 700);

        List<RunSummary> history = store.history("demo");
        assertThat(history).hasSize(2);
        assertThat(store.latestRunId("demo")).contains(history.get(1).runId());
        assertThat(history.get(1).runId()).isEqualTo(second.getRunId());
    }

    @Test
    void updateWithoutPriorRunFailsBeforeFetching() {
        PipelineJob job = run(RunMode.UPDATE, 5);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getWindow()).isNull();
        verify(contentSource, org.mockito.Mockito.never()).fetch(any(), any(), anyInt());
    }

    @Test
    @DisplayName("identical NEW jobs produce the same categories and partition")
    void idempotentNewRuns() {
        PipelineJob a = run(RunMode.NEW, 5);
        clock.advance(Duration.ofMinutes(5));
        PipelineJob b = run(RunMode.NEW, 5);

        RunSnapshot first = store.load("demo", a.getRunId()).orElseThrow();
        RunSnapshot second = store.load("demo", b.getRunId()).orElseThrow();

        assertThat(second.getCategories()).extracting(CategorySummary::getName)
                .containsExactlyElementsOf(first.getCategories().stream().map(CategorySummary::getName).toList());
        assertThat(second.getPosts()).extracting(Post::getCategory)
                .containsExactlyElementsOf(first.getPosts().stream().map(Post::getCategory).toList());
    }
}
