package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.PublishException;
import com.communityintel.insights.model.DateRange;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunMode;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.RunSummary;
import com.communityintel.insights.support.TestPosts;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunVersionStoreTest {

    @TempDir
    Path baseDir;

    private ObjectMapper objectMapper;
    private RunVersionStore store;
    private RunVersionStore.RunContentWriter writer;

    @BeforeEach
    void setUp() {
        objectMapper = TestPosts.objectMapper();
        store = new RunVersionStore(TestPosts.properties(baseDir), objectMapper);
        writer = (dir, snapshot) -> objectMapper.writeValue(
                dir.resolve(RunVersionStore.SNAPSHOT_FILE).toFile(), snapshot);
    }

    private RunSnapshot snapshot(String source, Instant generatedAt) {
        return RunSnapshot.builder()
                .metadata(RunMetadata.builder()
                        .source(source)
                        .jobId("job")
                        .mode(RunMode.NEW)
                        .generatedAt(generatedAt)
                        .window(new FetchWindow(generatedAt.minus(Duration.ofDays(30)), generatedAt))
                        .dateRange(DateRange.of(TestPosts.posts(3)))
                        .numPosts(3)
                        .build())
                .categories(List.of())
                .insights(List.of())
                .posts(TestPosts.posts(3))
                .build();
    }

    private RunSnapshot publish(String source, Instant generatedAt) {
        return store.publish(snapshot(source, generatedAt), store.stage("job"), writer);
    }

    @Nested
    class Publish {

        @Test
        void assignsRunIdFromGenerationTime() {
            RunSnapshot published = publish("demo", Instant.parse("2025-10-13T08:15:30Z"));

            assertThat(published.getMetadata().getRunId()).isEqualTo("demo_20251013_081530");
            assertThat(baseDir.resolve("demo_20251013_081530").resolve(RunVersionStore.SNAPSHOT_FILE)).exists();
            assertThat(store.latestRunId("demo")).contains("demo_20251013_081530");
        }

        @Test
        @DisplayName("two runs generated in the same second get distinct ids")
        void disambiguatesCollisions() {
            Instant t = Instant.parse("2025-10-13T08:15:30Z");
            String first = publish("demo", t).getMetadata().getRunId();
            String second = publish("demo", t).getMetadata().getRunId();

            assertThat(first).isEqualTo("demo_20251013_081530");
            assertThat(second).isEqualTo("demo_20251013_081530_2");
            assertThat(store.latestRunId("demo")).contains(second);
        }

        @Test
        void writerFailureLeavesNothingBehind() {
            Path staging = store.stage("job");

            assertThatThrownBy(() -> store.publish(snapshot("demo", Instant.now()), staging,
                    (dir, s) -> {
                        throw new IOException("disk full");
                    }))
                    .isInstanceOf(PublishException.class)
                    .hasMessageContaining("disk full");

            assertThat(staging).doesNotExist();
            assertThat(store.list()).isEmpty();
            assertThat(store.latest("demo")).isEmpty();
        }

        @Test
        @DisplayName("latest never moves back to an older run")
        void pointerIsMonotonic() {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));
            publish("demo", Instant.parse("2025-10-01T00:00:00Z"));

            assertThat(store.latestRunId("demo")).contains("demo_20251013_000000");
            List<RunSummary> history = store.history("demo");
            assertThat(history.get(history.size() - 1).runId()).isEqualTo("demo_20251013_000000");
        }

        @Test
        @DisplayName("a failed pointer swap removes the new run and keeps the previous latest")
        void pointerWriteFailureRollsBack() throws IOException {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));
            Path pointer = baseDir.resolve(".latest").resolve("demo");
            Files.delete(pointer);
            Files.createDirectories(pointer);
            Files.writeString(pointer.resolve("blocker"), "x");

            assertThatThrownBy(() -> publish("demo", Instant.parse("2025-10-14T00:00:00Z")))
                    .isInstanceOf(PublishException.class)
                    .hasMessageContaining("latest pointer");

            assertThat(baseDir.resolve("demo_20251014_000000")).doesNotExist();
            assertThat(store.history("demo")).extracting(RunSummary::runId)
                    .containsExactly("demo_20251013_000000");
            assertThat(store.latestRunId("demo")).contains("demo_20251013_000000");
            assertThat(store.latest("demo")).get()
                    .extracting(s -> s.getMetadata().getRunId()).isEqualTo("demo_20251013_000000");
        }
    }

    @Nested
    class Read {

        @Test
        void historyIsAscendingAndMarksCurrent() {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));
            publish("demo", Instant.parse("2025-09-13T00:00:00Z"));
            publish("other", Instant.parse("2025-10-14T00:00:00Z"));

            List<RunSummary> history = store.history("demo");

            assertThat(history).extracting(RunSummary::runId)
                    .containsExactly("demo_20250913_000000", "demo_20251013_000000");
            assertThat(history).extracting(RunSummary::current).containsExactly(false, true);
        }

        @Test
        void historyMatchesSourceExactly() {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));
            publish("demo_extra", Instant.parse("2025-10-14T00:00:00Z"));

            assertThat(store.history("demo")).hasSize(1);
            assertThat(store.list()).containsExactly("demo", "demo_extra");
        }

        @Test
        void loadsSpecificRun() {
            String runId = publish("demo", Instant.parse("2025-10-13T00:00:00Z")).getMetadata().getRunId();

            assertThat(store.load("demo", runId)).get()
                    .extracting(s -> s.getMetadata().getNumPosts()).isEqualTo(3);
            assertThat(store.load("other", runId)).isEmpty();
            assertThat(store.load("demo", "demo_20200101_000000")).isEmpty();
        }

        @Test
        void stagingDirectoriesAreInvisible() {
            store.stage("job-in-flight");

            assertThat(store.list()).isEmpty();
        }

        @Test
        void snapshotsSurviveARestart() {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));

            RunVersionStore reopened = new RunVersionStore(TestPosts.properties(baseDir), objectMapper);

            assertThat(reopened.latest("demo")).get()
                    .extracting(s -> s.getPosts().size()).isEqualTo(3);
        }

        @Test
        void historyComesFromMetadataWithoutCachingSnapshots() {
            publish("demo", Instant.parse("2025-10-12T00:00:00Z"));
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));

            RunVersionStore reopened = new RunVersionStore(TestPosts.properties(baseDir), objectMapper);
            List<RunSummary> history = reopened.history("demo");

            assertThat(history).extracting(RunSummary::numPosts).containsExactly(3, 3);
            assertThat(history.get(0).dateRange()).isEqualTo(DateRange.of(TestPosts.posts(3)));
            assertThat(reopened.cachedSnapshotCount()).isZero();
        }

        @Test
        void snapshotCacheIsBounded() {
            InsightPipelineProperties properties = TestPosts.properties(baseDir);
            properties.getOutput().setSnapshotCacheSize(2);
            RunVersionStore small = new RunVersionStore(properties, objectMapper);

            for (int day = 10; day < 15; day++) {
                small.publish(snapshot("demo", Instant.parse("2025-10-" + day + "T00:00:00Z")), small.stage("job"), writer);
            }
            small.history("demo").forEach(row -> small.load("demo", row.runId()));

            assertThat(small.cachedSnapshotCount()).isEqualTo(2);
            assertThat(small.latest("demo")).get()
                    .extracting(s -> s.getMetadata().getRunId()).isEqualTo("demo_20251014_000000");
        }
    }

    @Nested
    class Recover {

        @Test
        void removesStagingLeftovers() {
            Path leftover = store.stage("crashed-job");

            store.recover();

            assertThat(leftover).doesNotExist();
        }

        @Test
        void repairsMissingPointer() throws IOException {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));
            Files.delete(baseDir.resolve(".latest").resolve("demo"));

            store.recover();

            assertThat(Files.readString(baseDir.resolve(".latest").resolve("demo")))
                    .isEqualTo("demo_20251013_000000");
        }

        @Test
        void fallsBackToNewestRunWhenPointerDangles() throws IOException {
            publish("demo", Instant.parse("2025-10-13T00:00:00Z"));
            Files.writeString(baseDir.resolve(".latest").resolve("demo"), "demo_20990101_000000");

            assertThat(store.latestRunId("demo")).contains("demo_20251013_000000");
        }
    }
}
