package com.communityintel.insights.output;

import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.PostRef;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Locale;

/**
 * Writes REPORT.md: run counts, then one section per category ordered by size
 * with its share of the run, narrative and top posts.
 */
@Component
@Slf4j
public class MarkdownReportWriter {

    public static final String FILE_NAME = "REPORT.md";

    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    public void write(Path dir, RunSnapshot snapshot) throws IOException {
        Files.writeString(dir.resolve(FILE_NAME), render(snapshot), StandardCharsets.UTF_8);
        log.debug("Wrote report for {}", snapshot.getMetadata().getRunId());
    }

    String render(RunSnapshot snapshot) {
        RunMetadata meta = snapshot.getMetadata();
        StringBuilder md = new StringBuilder();

        md.append("# r/").append(meta.getSource()).append(" insight report\n\n");
        md.append("- Run: `").append(meta.getRunId()).append("`\n");
        md.append("- Generated: ").append(meta.getGeneratedAt()).append('\n');
        if (meta.getWindow() != null) {
            md.append("- Window: ").append(DAY.format(meta.getWindow().start()))
                    .append(" to ").append(DAY.format(meta.getWindow().end())).append('\n');
        }
        md.append("- Posts analysed: ").append(meta.getNumPosts()).append('\n');
        md.append("- Categories: ").append(meta.getNumCategories())
                .append(meta.isCategoriesProvided() ? " (supplied)" : " (discovered)").append('\n');
        md.append("- Unclassified posts: ").append(meta.getNumUnclassified()).append('\n');
        if (meta.getFailedBatches() > 0) {
            md.append("- Failed classification batches: ").append(meta.getFailedBatches()).append('\n');
        }
        md.append('\n');

        int total = Math.max(1, meta.getNumPosts());
        snapshot.getCategories().stream()
                .sorted(Comparator.comparingInt(CategorySummary::getPostCount).reversed())
                .forEach(c -> appendCategory(md, c, total));

        return md.toString();
    }

    private void appendCategory(StringBuilder md, CategorySummary c, int total) {
        md.append("## ").append(c.getName()).append("\n\n");
        md.append(String.format(Locale.ROOT, "%d posts (%.1f%%), avg engagement %.1f, sentiment %s (%.2f)%n%n",
                c.getPostCount(), 100.0 * c.getPostCount() / total, c.getAvgEngagement(),
                c.getDominantSentiment().label(), c.getAvgSentiment()));
        md.append(c.getNarrative()).append("\n\n");

        if (c.getTopPosts() != null && !c.getTopPosts().isEmpty()) {
            md.append("Top posts:\n\n");
            for (PostRef p : c.getTopPosts()) {
                md.append("- ").append(p.title())
                        .append(" (").append(p.score()).append(" points, ")
                        .append(p.numComments()).append(" comments)\n");
            }
            md.append('\n');
        }
    }
}
