package com.communityintel.insights.service;

import com.communityintel.insights.exception.InsightNotFoundException;
import com.communityintel.insights.exception.RunNotFoundException;
import com.communityintel.insights.model.CategoryInsight;
import com.communityintel.insights.model.DateRange;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.RunSummary;
import com.communityintel.insights.model.SourceSummary;
import com.communityintel.insights.support.TestPosts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotQueryServiceTest {

    @Mock
    private RunVersionStore store;

    private SnapshotQueryService service;
    private RunSnapshot snapshot;

    @BeforeEach
    void setUp() {
        service = new SnapshotQueryService(store);
        snapshot = RunSnapshot.builder()
                .metadata(RunMetadata.builder()
                        .runId("demo_20251020_120000")
                        .source("demo")
                        .generatedAt(TestPosts.NOW)
                        .window(new FetchWindow(TestPosts.NOW.minus(Duration.ofDays(7)), TestPosts.NOW))
                        .numPosts(3)
                        .build())
                .categories(List.of())
                .insights(List.of(CategoryInsight.builder().id("insight-outfit-help").category("Outfit Help").build()))
                .posts(TestPosts.posts(3))
                .build();
    }

    @Test
    void summarisesEachPublishedSource() {
        when(store.list()).thenReturn(List.of("demo"));
        when(store.latest("demo")).thenReturn(Optional.of(snapshot));
        when(store.history("demo")).thenReturn(List.of(
                RunSummary.of(snapshot.getMetadata(), false), RunSummary.of(snapshot.getMetadata(), true)));

        List<SourceSummary> sources = service.sources();

        assertThat(sources).singleElement().satisfies(s -> {
            assertThat(s.name()).isEqualTo("demo");
            assertThat(s.latestRunId()).isEqualTo("demo_20251020_120000");
            assertThat(s.runCount()).isEqualTo(2);
            assertThat(s.dateRange()).isEqualTo(DateRange.of(snapshot.getPosts()));
        });
    }

    @Test
    void findsInsightById() {
        when(store.latest("demo")).thenReturn(Optional.of(snapshot));

        assertThat(service.insight("demo", "insight-outfit-help").getCategory()).isEqualTo("Outfit Help");
        assertThatThrownBy(() -> service.insight("demo", "insight-nope"))
                .isInstanceOf(InsightNotFoundException.class);
    }

    @Test
    void unknownSourceIsNotFound() {
        when(store.latest("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.metadata("ghost"))
                .isInstanceOf(RunNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void emptyHistoryIsNotFound() {
        when(store.history("ghost")).thenReturn(List.of());

        assertThatThrownBy(() -> service.history("ghost")).isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void loadsSpecificRun() {
        when(store.load("demo", "demo_20251020_120000")).thenReturn(Optional.of(snapshot));
        when(store.load("demo", "demo_20990101_000000")).thenReturn(Optional.empty());

        assertThat(service.run("demo", "demo_20251020_120000")).isSameAs(snapshot);
        assertThatThrownBy(() -> service.run("demo", "demo_20990101_000000"))
                .isInstanceOf(RunNotFoundException.class);
    }
}
