package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.config.InsightPipelineProperties.Scheduler.SameSourcePolicy;
import com.communityintel.insights.exception.InvalidJobConfigException;
import com.communityintel.insights.exception.JobNotFoundException;
import com.communityintel.insights.exception.SchedulerSaturatedException;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.JobStatus;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.RunMode;
import com.communityintel.insights.support.TestPosts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineJobSchedulerTest {

    private InsightPipelineProperties properties;
    private PipelineJobRegistry registry;
    private InsightPipelineService pipelineService;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        properties = TestPosts.properties(Path.of("unused"));
        registry = new PipelineJobRegistry(properties, Clock.systemUTC());
        pipelineService = mock(InsightPipelineService.class);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private PipelineJobScheduler scheduler(int workers, int queue) {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queue);
        executor.initialize();
        return new PipelineJobScheduler(registry, pipelineService, executor, properties);
    }

    private void completeImmediately() {
        when(pipelineService.execute(anyString())).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            registry.markRunning(id);
            return registry.markCompleted(id, "demo_20251020_000000", 30);
        });
    }

    private static JobRequest.JobRequestBuilder valid() {
        return JobRequest.builder().source("demo");
    }

    @Nested
    class Validation {

        private PipelineJobScheduler scheduler;

        @BeforeEach
        void setUp() {
            scheduler = scheduler(1, 10);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "../etc", "has space", "way_too_long_name_way_too_long_name_way_too_long_name_way_too_long"})
        void rejectsUnsafeSourceNames(String source) {
            assertThatThrownBy(() -> scheduler.submit(valid().source(source).build()))
                    .isInstanceOf(InvalidJobConfigException.class);
            assertThat(registry.list()).isEmpty();
        }

        @Test
        void rejectsOutOfRangeNumbers() {
            assertThatThrownBy(() -> scheduler.submit(valid().maxItems(5).build()))
                    .isInstanceOf(InvalidJobConfigException.class).hasMessageContaining("maxItems");
            assertThatThrownBy(() -> scheduler.submit(valid().maxItems(5001).build()))
                    .isInstanceOf(InvalidJobConfigException.class);
            assertThatThrownBy(() -> scheduler.submit(valid().minClusterSize(1).build()))
                    .isInstanceOf(InvalidJobConfigException.class).hasMessageContaining("minClusterSize");
            assertThatThrownBy(() -> scheduler.submit(valid().lookbackDays(0).build()))
                    .isInstanceOf(InvalidJobConfigException.class);
            assertThatThrownBy(() -> scheduler.submit(valid().categoryCount(21).build()))
                    .isInstanceOf(InvalidJobConfigException.class);
        }

        @Test
        void rejectsBadCategoryLists() {
            assertThatThrownBy(() -> scheduler.submit(valid().categories(List.of("A", " ")).build()))
                    .isInstanceOf(InvalidJobConfigException.class);
            assertThatThrownBy(() -> scheduler.submit(valid().categories(List.of("Tips", "tips")).build()))
                    .isInstanceOf(InvalidJobConfigException.class).hasMessageContaining("duplicate");
        }

        @Test
        void fillsDefaults() {
            JobRequest normalized = scheduler.validate(JobRequest.builder()
                    .source(" demo ").mode(null).maxItems(null).minClusterSize(null).build());

            assertThat(normalized.getSource()).isEqualTo("demo");
            assertThat(normalized.getMode()).isEqualTo(RunMode.NEW);
            assertThat(normalized.getMaxItems()).isEqualTo(700);
            assertThat(normalized.getMinClusterSize()).isEqualTo(3);
        }
    }

    @Test
    void submitReturnsQueuedJobAndCompletesAsynchronously() throws Exception {
        completeImmediately();
        PipelineJobScheduler scheduler = scheduler(2, 10);

        String jobId = scheduler.submit(valid().build());
        PipelineJob done = scheduler.awaitCompletion(jobId).get(5, TimeUnit.SECONDS);

        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(scheduler.getStatus(jobId).getRunId()).isEqualTo("demo_20251020_000000");
        assertThat(scheduler.awaitCompletion(jobId).get().getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void unknownJobStatus() {
        PipelineJobScheduler scheduler = scheduler(1, 1);

        assertThatThrownBy(() -> scheduler.getStatus("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("a full queue rejects the submission and keeps no job")
    void saturatedPoolRejects() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(pipelineService.execute(anyString())).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            registry.markRunning(id);
            release.await(5, TimeUnit.SECONDS);
            return registry.markCompleted(id, "r", 0);
        });
        PipelineJobScheduler scheduler = scheduler(1, 1);

        String running = scheduler.submit(valid().build());
        String queued = scheduler.submit(valid().source("other").build());

        assertThatThrownBy(() -> scheduler.submit(valid().source("third").build()))
                .isInstanceOf(SchedulerSaturatedException.class);
        assertThat(registry.list()).extracting(PipelineJob::getJobId).containsExactlyInAnyOrder(running, queued);

        release.countDown();
        scheduler.awaitCompletion(queued).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("SERIALIZE never runs two jobs for the same source at once")
    void serializesSameSource() throws Exception {
        properties.getScheduler().setSameSourcePolicy(SameSourcePolicy.SERIALIZE);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(pipelineService.execute(anyString())).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            registry.markRunning(id);
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return registry.markCompleted(id, "r", 0);
        });
        PipelineJobScheduler scheduler = scheduler(4, 10);

        List<String> ids = List.of(
                scheduler.submit(valid().build()),
                scheduler.submit(valid().build()),
                scheduler.submit(valid().build()));
        for (String id : ids) {
            scheduler.awaitCompletion(id).get(5, TimeUnit.SECONDS);
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("a job waiting behind its source holds no worker, so other sources keep running")
    void waitingJobDoesNotBlockOtherSources() throws Exception {
        properties.getScheduler().setSameSourcePolicy(SameSourcePolicy.SERIALIZE);
        CountDownLatch release = new CountDownLatch(1);
        when(pipelineService.execute(anyString())).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            PipelineJob job = registry.markRunning(id);
            if (job.getSource().equals("demo")) {
                release.await(5, TimeUnit.SECONDS);
            }
            return registry.markCompleted(id, "r", 0);
        });
        PipelineJobScheduler scheduler = scheduler(2, 10);

        scheduler.submit(valid().build());
        String second = scheduler.submit(valid().build());
        String other = scheduler.submit(valid().source("other").build());

        assertThat(scheduler.awaitCompletion(other).get(5, TimeUnit.SECONDS).getStatus())
                .isEqualTo(JobStatus.COMPLETED);
        assertThat(registry.get(second).getStatus()).isEqualTo(JobStatus.QUEUED);

        release.countDown();
        assertThat(scheduler.awaitCompletion(second).get(5, TimeUnit.SECONDS).getStatus())
                .isEqualTo(JobStatus.COMPLETED);
    }
}
