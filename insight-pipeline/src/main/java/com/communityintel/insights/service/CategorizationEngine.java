package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.CategoryDiscoveryException;
import com.communityintel.insights.exception.ClassificationBatchException;
import com.communityintel.insights.model.ClassificationResult;
import com.communityintel.insights.model.JobRequest;
import com.communityintel.insights.model.Post;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Two-phase categorization: discover a category set from a sample (unless the caller supplied
 * one), then classify every post against it in fixed-size batches.
 *
 * A batch whose answer is unusable is retried once with the same input. If the retry fails too,
 * the batch's posts stay unclassified and the run carries on. Batches run on the shared
 * {@code classificationExecutor}, so concurrent jobs together never exceed its pool size.
 */
@Service
@Slf4j
public class CategorizationEngine {

    private static final int EXCERPT_CHARS = 200;

    private final LanguageModel languageModel;
    private final PostEnricher postEnricher;
    private final InsightPipelineProperties properties;
    private final AsyncTaskExecutor classificationExecutor;

    public CategorizationEngine(LanguageModel languageModel, PostEnricher postEnricher,
                                InsightPipelineProperties properties,
                                @Qualifier("classificationExecutor") AsyncTaskExecutor classificationExecutor) {
        this.languageModel = languageModel;
        this.postEnricher = postEnricher;
        this.properties = properties;
        this.classificationExecutor = classificationExecutor;
    }

    public CategorizationResult categorize(List<Post> posts, JobRequest request) {
        List<Post> working = properties.getCategorization().isEnrichPosts()
                ? postEnricher.enrich(posts)
                : new ArrayList<>(posts);

        boolean provided = request.hasExplicitCategories();
        List<String> categories = provided
                ? request.getCategories().stream().map(String::strip).toList()
                : discover(working, desiredCount(request));

        log.info("Classifying {} posts into {} {} categories: {}",
                working.size(), categories.size(), provided ? "supplied" : "discovered", categories);

        return classifyAll(working, categories, provided);
    }

    // ── Phase 1: discovery ───────────────────────────────────────────────────

    List<String> discover(List<Post> posts, int desiredCount) {
        if (posts.isEmpty()) {
            throw new CategoryDiscoveryException("No posts to discover categories from");
        }
        int sampleSize = Math.min(posts.size(), properties.getCategorization().getDiscoverySampleSize());
        List<Post> sample = posts.subList(0, sampleSize).stream()
                .map(p -> p.toBuilder().body(p.excerpt(EXCERPT_CHARS)).build())
                .toList();

        List<String> raw;
        try {
            raw = languageModel.discoverCategories(sample, desiredCount);
        } catch (RuntimeException e) {
            throw new CategoryDiscoveryException("Category discovery failed: " + e.getMessage(), e);
        }

        List<String> categories = cleanCategoryNames(raw, desiredCount);
        if (categories.isEmpty()) {
            throw new CategoryDiscoveryException("Model returned no usable category names");
        }
        log.info("Discovered {} categories from a sample of {} posts", categories.size(), sampleSize);
        return categories;
    }

    /**
     * Strips numbering and bullets, drops names of two characters or fewer and
     * case-insensitive duplicates, and keeps at most {@code limit}.
     */
    static List<String> cleanCategoryNames(List<String> raw, int limit) {
        Map<String, String> unique = new LinkedHashMap<>();
        if (raw == null) return List.of();
        for (String name : raw) {
            if (name == null) continue;
            String cleaned = name.strip()
                    .replaceFirst("^(?:\\d+\\s*[.):-]|[-*•#]+)\\s*", "")
                    .replaceAll("^[\"']|[\"']$", "")
                    .strip();
            if (cleaned.length() <= 2) continue;
            unique.putIfAbsent(cleaned.toLowerCase(Locale.ROOT), cleaned);
            if (unique.size() == limit) break;
        }
        return List.copyOf(unique.values());
    }

    private int desiredCount(JobRequest request) {
        return request.getCategoryCount() != null
                ? request.getCategoryCount()
                : properties.getCategorization().getDefaultCategoryCount();
    }

    // ── Phase 2: classification ──────────────────────────────────────────────

    private CategorizationResult classifyAll(List<Post> posts, List<String> categories, boolean provided) {
        int batchSize = properties.getCategorization().getBatchSize();
        List<List<Post>> batches = new ArrayList<>();
        for (int i = 0; i < posts.size(); i += batchSize) {
            batches.add(posts.subList(i, Math.min(i + batchSize, posts.size())));
        }

        List<Future<Map<String, ClassificationResult>>> futures = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            int index = i;
            List<Post> batch = batches.get(i);
            futures.add(classificationExecutor.submit(() -> classifyBatch(index, batch, categories)));
        }

        Map<String, ClassificationResult> assignments = new HashMap<>();
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                assignments.putAll(futures.get(i).get());
            } catch (ExecutionException e) {
                failed++;
                log.warn("Batch {}/{} left unclassified: {}", i + 1, batches.size(), e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for classification batches", e);
            }
        }

        List<Post> classified = new ArrayList<>(posts.size());
        for (Post post : posts) {
            ClassificationResult result = assignments.get(post.getId());
            classified.add(post.toBuilder()
                    .category(result != null ? result.category() : null)
                    .categoryConfidence(result != null ? result.confidence() : null)
                    .build());
        }

        log.info("Classification finished: {} batches, {} failed, {} posts classified",
                batches.size(), failed, assignments.size());
        return new CategorizationResult(categories, classified, failed, provided);
    }

    Map<String, ClassificationResult> classifyBatch(int index, List<Post> batch, List<String> categories) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                List<ClassificationResult> results = languageModel.classify(batch, categories);
                return validate(index, batch, categories, results);
            } catch (RuntimeException e) {
                last = e;
                log.debug("Batch {} attempt {} rejected: {}", index, attempt, e.getMessage());
            }
        }
        throw new ClassificationBatchException(index,
                "Batch " + index + " failed twice: " + last.getMessage(), last);
    }

    /**
     * Every post in the batch answered exactly once, with a known category and a
     * confidence in [0, 1]. Category names are matched ignoring case and mapped back
     * to their canonical spelling.
     */
    private Map<String, ClassificationResult> validate(int index, List<Post> batch, List<String> categories,
                                                       List<ClassificationResult> results) {
        if (results == null) {
            throw ClassificationBatchException.malformed(index, "no results");
        }
        Map<String, String> canonical = new HashMap<>();
        categories.forEach(c -> canonical.put(c.toLowerCase(Locale.ROOT), c));

        Map<String, Post> expected = new LinkedHashMap<>();
        batch.forEach(p -> expected.put(p.getId(), p));

        Map<String, ClassificationResult> accepted = new HashMap<>();
        for (ClassificationResult r : results) {
            if (r == null || !expected.containsKey(r.postId())) {
                throw ClassificationBatchException.malformed(index, "unknown post " + (r == null ? null : r.postId()));
            }
            if (accepted.containsKey(r.postId())) {
                throw ClassificationBatchException.malformed(index, "post " + r.postId() + " answered twice");
            }
            String category = r.category() == null ? null : canonical.get(r.category().strip().toLowerCase(Locale.ROOT));
            if (category == null) {
                throw ClassificationBatchException.malformed(index, "unknown category '" + r.category() + "'");
            }
            if (Double.isNaN(r.confidence()) || r.confidence() < 0.0 || r.confidence() > 1.0) {
                throw ClassificationBatchException.malformed(index, "confidence " + r.confidence() + " out of range");
            }
            accepted.put(r.postId(), new ClassificationResult(r.postId(), category, r.confidence()));
        }
        if (accepted.size() != expected.size()) {
            throw ClassificationBatchException.malformed(index,
                    (expected.size() - accepted.size()) + " of " + expected.size() + " posts missing");
        }
        return accepted;
    }
}
