package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.PostDigest;
import com.communityintel.insights.model.Sentiment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Adds a short summary and a sentiment label to each post before categorization.
 * A failed batch keeps its titles as summaries and leaves sentiment untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PostEnricher {

    private final LanguageModel languageModel;
    private final InsightPipelineProperties properties;

    public List<Post> enrich(List<Post> posts) {
        int batchSize = properties.getCategorization().getBatchSize();
        List<Post> enriched = new ArrayList<>(posts.size());
        int failedBatches = 0;

        for (int i = 0; i < posts.size(); i += batchSize) {
            List<Post> batch = posts.subList(i, Math.min(i + batchSize, posts.size()));
            Map<String, PostDigest> digests;
            try {
                digests = languageModel.summarize(batch).stream()
                        .filter(d -> d.postId() != null)
                        .collect(Collectors.toMap(PostDigest::postId, Function.identity(), (a, b) -> a));
            } catch (RuntimeException e) {
                log.warn("Summarization failed for posts {}-{}: {}", i, i + batch.size() - 1, e.getMessage());
                digests = Map.of();
                failedBatches++;
            }

            for (Post post : batch) {
                enriched.add(apply(post, digests.get(post.getId())));
            }
        }

        log.info("Enriched {} posts ({} summary batches fell back to titles)", enriched.size(), failedBatches);
        return enriched;
    }

    private Post apply(Post post, PostDigest digest) {
        Post.PostBuilder builder = post.toBuilder();
        if (digest == null || digest.summary() == null || digest.summary().isBlank()) {
            builder.summary(post.getTitle());
        } else {
            builder.summary(digest.summary().strip());
        }
        if (post.getSentiment() == null && digest != null && digest.sentimentLabel() != null) {
            builder.sentiment(Sentiment.ofLabel(digest.sentimentLabel()));
        }
        return builder.build();
    }
}
