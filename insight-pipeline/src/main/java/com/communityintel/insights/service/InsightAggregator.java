package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.NarrativeGenerationException;
import com.communityintel.insights.model.CategoryInsight;
import com.communityintel.insights.model.CategoryStatistics;
import com.communityintel.insights.model.CategorySummary;
import com.communityintel.insights.model.DateRange;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.NarrativeStatus;
import com.communityintel.insights.model.PipelineJob;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.PostRef;
import com.communityintel.insights.model.RunMetadata;
import com.communityintel.insights.model.RunSnapshot;
import com.communityintel.insights.model.Sentiment;
import com.communityintel.insights.model.SentimentBucket;
import com.communityintel.insights.model.ThemeCluster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a categorized post set into the run snapshot: per-category statistics,
 * a model-written narrative for every category large enough to deserve one,
 * theme-clustered insights and the run metadata.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InsightAggregator {

    public static final String NARRATIVE_FAILED_PLACEHOLDER = "Narrative generation failed.";
    public static final String INSUFFICIENT_DATA_PLACEHOLDER = "Insufficient data for a narrative.";

    /** Highest engagement first; ties by score, then by id so the order is stable. */
    static final Comparator<Post> BY_ENGAGEMENT = Comparator
            .comparingLong(Post::engagement).reversed()
            .thenComparing(Comparator.comparingLong(Post::getScore).reversed())
            .thenComparing(Post::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final LanguageModel languageModel;
    private final InsightPipelineProperties properties;

    public List<CategorySummary> summarize(CategorizationResult result, int minClusterSize) {
        Map<String, List<Post>> members = new LinkedHashMap<>();
        result.categories().forEach(c -> members.put(c, new ArrayList<>()));
        for (Post post : result.posts()) {
            if (post.isClassified()) {
                members.computeIfAbsent(post.getCategory(), k -> new ArrayList<>()).add(post);
            }
        }

        List<CategorySummary> summaries = new ArrayList<>(members.size());
        Set<String> usedIds = new HashSet<>();
        for (Map.Entry<String, List<Post>> entry : members.entrySet()) {
            CategorySummary summary = summarizeCategory(entry.getKey(), entry.getValue(), minClusterSize);
            summary.setId(uniqueId(summary.getId(), usedIds));
            summaries.add(summary);
        }
        return summaries;
    }

    CategorySummary summarizeCategory(String name, List<Post> posts, int minClusterSize) {
        CategoryStatistics stats = statistics(name, posts);
        List<Post> ranked = posts.stream().sorted(BY_ENGAGEMENT).toList();
        int topN = properties.getAggregation().getTopPostsPerCategory();

        CategorySummary.CategorySummaryBuilder summary = CategorySummary.builder()
                .id(slugify(name))
                .name(name)
                .postCount(stats.postCount())
                .avgEngagement(round(stats.avgEngagement(), 1))
                .avgScore(round(stats.avgScore(), 1))
                .avgComments(round(stats.avgComments(), 1))
                .avgSentiment(round(stats.avgSentiment(), 3))
                .dominantSentiment(stats.dominantSentiment())
                .timeRangeStart(stats.timeRange().start())
                .timeRangeEnd(stats.timeRange().end())
                .topPosts(ranked.stream().limit(topN).map(PostRef::of).toList());

        if (posts.size() < minClusterSize) {
            log.debug("Category '{}' has {} posts, below minimum {}", name, posts.size(), minClusterSize);
            return summary
                    .insufficientData(true)
                    .narrative(INSUFFICIENT_DATA_PLACEHOLDER)
                    .narrativeStatus(NarrativeStatus.INSUFFICIENT_DATA)
                    .build();
        }

        List<Post> sample = ranked.stream().limit(properties.getAggregation().getNarrativeSampleSize()).toList();
        try {
            String narrative = languageModel.summarizeCategory(name, stats, sample);
            if (narrative == null || narrative.isBlank()) {
                throw new NarrativeGenerationException(name, "empty response");
            }
            return summary.narrative(narrative.strip()).narrativeStatus(NarrativeStatus.GENERATED).build();
        } catch (RuntimeException e) {
            NarrativeGenerationException failure = e instanceof NarrativeGenerationException nge
                    ? nge : new NarrativeGenerationException(name, e);
            log.warn(failure.getMessage());
            return summary.narrative(NARRATIVE_FAILED_PLACEHOLDER)
                    .narrativeStatus(NarrativeStatus.GENERATION_FAILED)
                    .build();
        }
    }

    public CategoryStatistics statistics(String name, List<Post> posts) {
        int n = posts.size();
        double avgEngagement = n == 0 ? 0 : posts.stream().mapToLong(Post::engagement).average().orElse(0);
        double avgScore = n == 0 ? 0 : posts.stream().mapToLong(Post::getScore).average().orElse(0);
        double avgComments = n == 0 ? 0 : posts.stream().mapToLong(Post::getNumComments).average().orElse(0);
        double avgSentiment = posts.stream()
                .map(Post::getSentiment)
                .filter(Objects::nonNull)
                .mapToDouble(Sentiment::score)
                .average()
                .orElse(0);
        return new CategoryStatistics(name, n, avgEngagement, avgScore, avgComments, avgSentiment,
                dominantSentiment(posts), DateRange.of(posts));
    }

    /**
     * Bucket with the most posts; ties go to positive, then negative, then neutral.
     * Posts without a sentiment count as neutral.
     */
    static SentimentBucket dominantSentiment(List<Post> posts) {
        Map<SentimentBucket, Integer> counts = new EnumMap<>(SentimentBucket.class);
        for (Post p : posts) {
            SentimentBucket b = p.getSentiment() != null ? p.getSentiment().bucket() : SentimentBucket.NEUTRAL;
            counts.merge(b, 1, Integer::sum);
        }
        SentimentBucket best = SentimentBucket.NEUTRAL;
        int bestCount = -1;
        for (SentimentBucket candidate : List.of(SentimentBucket.POSITIVE, SentimentBucket.NEGATIVE, SentimentBucket.NEUTRAL)) {
            int c = counts.getOrDefault(candidate, 0);
            if (c > bestCount) {
                best = candidate;
                bestCount = c;
            }
        }
        return best;
    }

    // ── Snapshot assembly ────────────────────────────────────────────────────

    public RunSnapshot assemble(PipelineJob job, FetchWindow window, CategorizationResult result,
                                List<CategorySummary> categories, Instant generatedAt) {
        Map<String, List<Post>> members = new LinkedHashMap<>();
        for (Post post : result.posts()) {
            if (post.isClassified()) {
                members.computeIfAbsent(post.getCategory(), k -> new ArrayList<>()).add(post);
            }
        }

        int minClusterSize = job.getRequest().getMinClusterSize();
        List<CategoryInsight> insights = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        for (CategorySummary category : categories) {
            if (category.isInsufficientData()) continue;
            List<Post> linked = members.getOrDefault(category.getName(), List.of()).stream()
                    .sorted(BY_ENGAGEMENT)
                    .toList();
            String base = "insight-" + category.getId();
            if (!properties.getAggregation().isClusterThemes()) {
                insights.add(insight(uniqueId(base, usedIds), category, null, linked));
                continue;
            }
            insights.addAll(themeInsights(category, linked, minClusterSize, base, usedIds));
        }

        int unclassified = (int) result.unclassifiedCount();
        int classified = categories.stream().mapToInt(CategorySummary::getPostCount).sum();
        if (classified + unclassified != result.posts().size()) {
            throw new IllegalStateException(String.format(
                    "Category counts (%d) plus unclassified (%d) do not add up to %d posts",
                    classified, unclassified, result.posts().size()));
        }

        RunMetadata metadata = RunMetadata.builder()
                .source(job.getSource())
                .jobId(job.getJobId())
                .mode(job.getMode())
                .generatedAt(generatedAt)
                .window(window)
                .dateRange(DateRange.of(result.posts()))
                .numPosts(result.posts().size())
                .numClassified(classified)
                .numUnclassified(unclassified)
                .numCategories(categories.size())
                .numInsights(insights.size())
                .categoriesProvided(result.categoriesProvided())
                .failedBatches(result.failedBatches())
                .minClusterSize(minClusterSize)
                .build();

        log.info("Assembled snapshot for {}: {} posts, {} categories, {} insights, {} unclassified",
                job.getSource(), metadata.getNumPosts(), metadata.getNumCategories(),
                metadata.getNumInsights(), unclassified);

        return RunSnapshot.builder()
                .metadata(metadata)
                .categories(categories)
                .insights(insights)
                .posts(result.posts())
                .build();
    }

    /**
     * One insight per theme cluster of at least {@code minClusterSize} posts. When no cluster
     * qualifies the whole category becomes a single {@code -all} insight; when clustering
     * fails it becomes a single {@code -fallback} insight. Both reuse the category narrative.
     */
    List<CategoryInsight> themeInsights(CategorySummary category, List<Post> linked, int minClusterSize,
                                        String base, Set<String> usedIds) {
        List<ThemeCluster> clusters;
        try {
            clusters = languageModel.clusterCategory(category.getName(), linked, minClusterSize);
        } catch (RuntimeException e) {
            log.warn("Theme clustering failed for '{}', keeping one insight for the category: {}",
                    category.getName(), e.getMessage());
            return List.of(insight(uniqueId(base + "-fallback", usedIds), category, null, linked));
        }

        Map<String, Post> byId = new LinkedHashMap<>();
        linked.forEach(p -> byId.put(p.getId(), p));
        List<CategoryInsight> insights = new ArrayList<>();
        int n = 0;
        for (ThemeCluster cluster : clusters) {
            List<Post> posts = cluster.postIds().stream()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted(BY_ENGAGEMENT)
                    .toList();
            if (posts.size() < minClusterSize) {
                log.debug("Skipping cluster '{}' in '{}' with {} posts", cluster.theme(), category.getName(), posts.size());
                continue;
            }
            CategoryInsight insight = insight(uniqueId(base + "-" + (++n), usedIds), category, cluster.theme(), posts);
            narrateTheme(insight, category.getName(), cluster.theme(), posts);
            insights.add(insight);
        }
        if (insights.isEmpty()) {
            log.debug("No theme cluster in '{}' reached {} posts", category.getName(), minClusterSize);
            return List.of(insight(uniqueId(base + "-all", usedIds), category, null, linked));
        }
        return insights;
    }

    private void narrateTheme(CategoryInsight insight, String category, String theme, List<Post> posts) {
        List<Post> sample = posts.stream().limit(properties.getAggregation().getNarrativeSampleSize()).toList();
        try {
            String narrative = languageModel.summarizeTheme(category, theme, statistics(category, posts), sample);
            if (narrative == null || narrative.isBlank()) {
                throw new NarrativeGenerationException(category, "empty response");
            }
            insight.setNarrative(narrative.strip());
            insight.setStatus(NarrativeStatus.GENERATED);
        } catch (RuntimeException e) {
            NarrativeGenerationException failure = e instanceof NarrativeGenerationException nge
                    ? nge : new NarrativeGenerationException(category, e);
            log.warn(failure.getMessage());
            insight.setNarrative(NARRATIVE_FAILED_PLACEHOLDER);
            insight.setStatus(NarrativeStatus.GENERATION_FAILED);
        }
    }

    private static CategoryInsight insight(String id, CategorySummary category, String theme, List<Post> posts) {
        return CategoryInsight.builder()
                .id(id)
                .category(category.getName())
                .theme(theme)
                .clusterSize(posts.size())
                .narrative(category.getNarrative())
                .status(category.getNarrativeStatus())
                .postCount(posts.size())
                .avgSentiment(round(posts.stream()
                        .map(Post::getSentiment)
                        .filter(Objects::nonNull)
                        .mapToDouble(Sentiment::score)
                        .average()
                        .orElse(0), 3))
                .totalEngagement(posts.stream().mapToLong(Post::engagement).sum())
                .timeRange(DateRange.of(posts))
                .linkedPosts(posts.stream().map(Post::getId).toList())
                .linkedPostsFull(posts.stream().map(PostRef::of).toList())
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** {@code base}, or {@code base-2}, {@code base-3}... for the first one not yet in {@code used}. */
    static String uniqueId(String base, Set<String> used) {
        String id = base;
        for (int n = 2; !used.add(id); n++) {
            id = base + "-" + n;
        }
        return id;
    }

    static String slugify(String name) {
        if (name == null) return "uncategorized";
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-|-$", "");
        return slug.isEmpty() ? "category" : slug;
    }

    private static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
