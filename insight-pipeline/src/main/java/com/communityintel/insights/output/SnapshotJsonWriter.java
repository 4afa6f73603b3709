package com.communityintel.insights.output;

import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.service.RunVersionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the JSON artefacts of a run:
 *   posts.jsonl          one post per line, classified or not
 *   categories.json      the category summaries
 *   insights.json        the insight set
 *   dashboard_data.json  the consolidated snapshot, read back by the store
 */
@Component
@Slf4j
public class SnapshotJsonWriter {

    public static final String POSTS_FILE = "posts.jsonl";
    public static final String CATEGORIES_FILE = "categories.json";
    public static final String INSIGHTS_FILE = "insights.json";

    private final ObjectMapper objectMapper;
    private final ObjectWriter pretty;

    public SnapshotJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.pretty = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public void write(Path dir, RunSnapshot snapshot) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(dir.resolve(POSTS_FILE), StandardCharsets.UTF_8)) {
            for (Post post : snapshot.getPosts()) {
                out.write(objectMapper.writeValueAsString(post));
                out.newLine();
            }
        }
        pretty.writeValue(dir.resolve(CATEGORIES_FILE).toFile(), snapshot.getCategories());
        pretty.writeValue(dir.resolve(INSIGHTS_FILE).toFile(), snapshot.getInsights());
        pretty.writeValue(dir.resolve(RunVersionStore.SNAPSHOT_FILE).toFile(), snapshot);

        log.debug("Wrote JSON artefacts for {} to {}", snapshot.getMetadata().getRunId(), dir);
    }
}
