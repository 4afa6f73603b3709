package com.communityintel.insights.output;

import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.NarrativeStatus;
import com.communityintel.insights.model.PostRef;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.SentimentBucket;
import com.communityintel.insights.support.TestPosts;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownReportWriterTest {

    private static CategorySummary category(String name, int posts, String narrative) {
        return CategorySummary.builder()
                .name(name)
                .postCount(posts)
                .avgEngagement(12.5)
                .dominantSentiment(SentimentBucket.POSITIVE)
                .avgSentiment(0.4)
                .narrative(narrative)
                .narrativeStatus(NarrativeStatus.GENERATED)
                .topPosts(List.of(PostRef.of(TestPosts.post("a", 120, 4))))
                .build();
    }

    @Test
    void rendersLargestCategoryFirstWithShares() {
        RunSnapshot snapshot = RunSnapshot.builder()
                .metadata(RunMetadata.builder()
                        .runId("demo_20251020_120000")
                        .source("demo")
                        .generatedAt(TestPosts.NOW)
                        .window(new FetchWindow(TestPosts.NOW.minus(Duration.ofDays(7)), TestPosts.NOW))
                        .numPosts(20)
                        .numCategories(2)
                        .numUnclassified(2)
                        .failedBatches(0)
                        .build())
                .categories(List.of(category("Care Tips", 4, "Small group."), category("Outfit Help", 14, "Big group.")))
                .build();

        String md = new MarkdownReportWriter().render(snapshot);

        assertThat(md).startsWith("# r/demo insight report");
        assertThat(md).contains("- Window: 2025-10-13 to 2025-10-20");
        assertThat(md).contains("(discovered)");
        assertThat(md).doesNotContain("Failed classification batches");
        assertThat(md.indexOf("## Outfit Help")).isLessThan(md.indexOf("## Care Tips"));
        assertThat(md).contains("14 posts (70.0%)");
        assertThat(md).contains("- Post a (120 points, 4 comments)");
    }
}
