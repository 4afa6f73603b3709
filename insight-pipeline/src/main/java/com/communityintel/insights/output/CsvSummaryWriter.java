package com.communityintel.insights.output;

import com.communityintel.insights.model.Post;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes posts_summary.csv, a flat view of every post in the run.
 *
 * Unclassified posts are listed under "Uncategorized"; summaries are cut to 100 characters.
 */
@Component
@Slf4j
public class CsvSummaryWriter {

    public static final String FILE_NAME = "posts_summary.csv";
    static final String UNCATEGORIZED = "Uncategorized";
    private static final int SUMMARY_CHARS = 100;

    private static final String[] HEADERS = {
            "id", "created_iso", "title",
            "score", "num_comments",
            "category", "confidence",
            "sentiment", "summary"
    };

    public void write(Path dir, List<Post> posts) throws IOException {
        Path outputPath = dir.resolve(FILE_NAME);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (Post p : posts) {
                writer.writeNext(toRow(p));
            }
        }
        log.debug("Written {} rows to {}", posts.size(), outputPath);
    }

    String[] toRow(Post p) {
        return new String[]{
                str(p.getId()),
                str(p.getCreatedAt()),
                str(p.getTitle()),
                str(p.getScore()),
                str(p.getNumComments()),
                p.getCategory() != null ? p.getCategory() : UNCATEGORIZED,
                str(p.getCategoryConfidence()),
                p.getSentiment() != null ? p.getSentiment().bucket().label() : "",
                truncate(p.getSummary() != null ? p.getSummary() : p.getTitle())
        };
    }

    private String truncate(String s) {
        if (s == null) return "";
        return s.length() <= SUMMARY_CHARS ? s : s.substring(0, SUMMARY_CHARS);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
