package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.model.CategoryStatistics;
import com.communityintel.insights.model.ClassificationResult;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.PostDigest;
import com.communityintel.insights.model.ThemeCluster;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language model backed by an OpenAI-compatible chat completions endpoint.
 * With {@code llm.azure=true} the Azure deployment URL and {@code api-key} header are used.
 *
 * Every prompt asks for a line-oriented answer:
 *   classification   POST_3: 2 0.85          (category number, confidence)
 *   summarization    POST_3: text || SENTIMENT: positive
 *   discovery        one category name per line
 *   clustering       CLUSTER: theme || POST_1, POST_4
 *   assignment       POST_3: 2                (cluster number)
 */
@Service
@Slf4j
public class OpenAiLanguageModel implements LanguageModel {

    static final double DEFAULT_CONFIDENCE = 0.8;

    private static final Pattern CLASSIFY_LINE =
            Pattern.compile("^\\s*POST_(\\d+)\\s*:\\s*(\\d+)(?:\\s+([-+]?\\d*\\.?\\d+))?.*$");
    private static final Pattern SUMMARY_LINE =
            Pattern.compile("^\\s*POST_(\\d+)\\s*:\\s*(.*?)\\s*(?:\\|\\|\\s*SENTIMENT\\s*:\\s*(\\w+))?\\s*$",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern CLUSTER_LINE =
            Pattern.compile("^\\s*CLUSTER(?:_\\d+)?\\s*:\\s*(.*?)\\s*\\|\\|\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSIGN_LINE =
            Pattern.compile("^\\s*POST_(\\d+)\\s*:\\s*(?:CLUSTER_)?(\\d+).*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final InsightPipelineProperties properties;

    public OpenAiLanguageModel(@Qualifier("languageModelRestTemplate") RestTemplate restTemplate,
                               ObjectMapper objectMapper,
                               InsightPipelineProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    // ── LanguageModel ────────────────────────────────────────────────────────

    @Override
    @Retry(name = "languageModel")
    public List<PostDigest> summarize(List<Post> posts) {
        StringBuilder prompt = new StringBuilder("""
                Summarize each post in one sentence and label its sentiment as positive, neutral or negative.
                Respond with one line per post, exactly in this format:
                POST_X: <summary> || SENTIMENT: <label>

                Posts:
                """);
        for (int i = 0; i < posts.size(); i++) {
            prompt.append(describe(i + 1, posts.get(i), 300)).append('\n');
        }
        String answer = chat("You summarize social media posts precisely and neutrally.",
                prompt.toString(), 800);
        return parseSummaries(answer, posts);
    }

    @Override
    @Retry(name = "languageModel")
    public List<String> discoverCategories(List<Post> sample, int desiredCount) {
        StringBuilder posts = new StringBuilder();
        for (Post p : sample) {
            posts.append("Title: ").append(p.getTitle());
            if (p.getBody() != null && !p.getBody().isBlank()) {
                posts.append("\nContent: ").append(p.getBody());
            }
            if (p.getFlair() != null) {
                posts.append("\nFlair: ").append(p.getFlair());
            }
            posts.append("\n\n---\n\n");
        }
        String prompt = String.format("""
                You are analyzing posts from a community to identify its main themes.

                Based on the sample posts below, generate %d distinct, meaningful category names.
                - Specific and descriptive, 2-4 words each
                - Mutually exclusive where possible
                - Title case
                - Return ONLY the category names, one per line, no numbering or explanation

                Sample posts:
                %s
                Generate %d category names:""", desiredCount, posts, desiredCount);

        String answer = chat("You are an expert at content categorization and thematic analysis.", prompt, 300);
        return Arrays.stream(answer.split("\\R"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    @Retry(name = "languageModel")
    public List<ClassificationResult> classify(List<Post> batch, List<String> categories) {
        StringBuilder categoryList = new StringBuilder();
        for (int i = 0; i < categories.size(); i++) {
            categoryList.append(i + 1).append(". ").append(categories.get(i)).append('\n');
        }
        StringBuilder postText = new StringBuilder();
        for (int i = 0; i < batch.size(); i++) {
            postText.append(describe(i + 1, batch.get(i), 300)).append('\n');
        }
        String prompt = String.format("""
                Categorize each post into ONE of the following categories:

                %s
                For each post respond with ONLY the category number (1-%d) followed by a confidence (0.0-1.0).
                Format: POST_X: <category_number> <confidence>

                Example:
                POST_1: 3 0.85
                POST_2: 1 0.92

                Posts to categorize:
                %s
                Your categorization:""", categoryList, categories.size(), postText);

        String answer = chat("You are an expert content categorizer. Assign each post to the most appropriate category.",
                prompt, 500);
        return parseClassifications(answer, batch, categories);
    }

    @Override
    @Retry(name = "languageModel")
    public String summarizeCategory(String category, CategoryStatistics stats, List<Post> sample) {
        StringBuilder posts = new StringBuilder();
        for (Post p : sample) {
            posts.append("• ").append(p.getTitle())
                    .append(" (Score: ").append(p.getScore())
                    .append(", Comments: ").append(p.getNumComments()).append(")\n");
            String excerpt = p.excerpt(200);
            if (!excerpt.isEmpty()) {
                posts.append("  Content: ").append(excerpt).append('\n');
            }
        }
        String prompt = String.format(Locale.ROOT, """
                You are analyzing posts from the "%s" category. Write an insight report of 300-500 words.

                Category: %s
                Total posts: %d
                Average score: %.1f
                Average comments: %.1f
                Dominant sentiment: %s

                Sample posts:
                %s
                Cover the main themes, common interests and pain points, what drives engagement,
                notable examples and actionable takeaways for community managers.""",
                category, category, stats.postCount(), stats.avgScore(), stats.avgComments(),
                stats.dominantSentiment().label(), posts);

        return chat("You are an expert data analyst specializing in social media and community insights.",
                prompt, 800);
    }

    /**
     * Clusters the first {@code clusterSampleSize} posts in one call, then assigns the rest
     * to those clusters in batches. Posts the model leaves out join the largest cluster.
     */
    @Override
    @Retry(name = "languageModel")
    public List<ThemeCluster> clusterCategory(String category, List<Post> posts, int minClusterSize) {
        InsightPipelineProperties.Aggregation cfg = properties.getAggregation();
        List<Post> sample = posts.subList(0, Math.min(cfg.getClusterSampleSize(), posts.size()));

        StringBuilder postText = new StringBuilder();
        for (int i = 0; i < sample.size(); i++) {
            postText.append(digestLine(i + 1, sample.get(i))).append('\n');
        }
        String prompt = String.format("""
                You are clustering posts from the "%s" category.

                Group these %d posts into thematic clusters. Posts discussing the same topic, problem,
                claim or experience belong together. Create as many clusters as needed and aim for at
                least %d posts per cluster. Every post must appear in exactly one cluster.

                Respond with one line per cluster, exactly in this format:
                CLUSTER: <one-sentence theme> || POST_X, POST_Y, POST_Z

                Posts:
                %s
                Your clusters:""", category, sample.size(), minClusterSize, postText);

        String answer = chat("You are an expert at semantic clustering and pattern recognition.", prompt, 800);
        List<MutableCluster> clusters = parseClusters(answer, sample);
        if (clusters.isEmpty()) {
            throw new IllegalStateException("Clustering response for '" + category + "' named no clusters");
        }

        List<Post> remaining = posts.subList(sample.size(), posts.size());
        int batchSize = cfg.getClusterAssignBatchSize();
        for (int i = 0; i < remaining.size(); i += batchSize) {
            assign(category, clusters, remaining.subList(i, Math.min(i + batchSize, remaining.size())));
        }
        return clusters.stream().map(MutableCluster::freeze).toList();
    }

    @Override
    @Retry(name = "languageModel")
    public String summarizeTheme(String category, String theme, CategoryStatistics stats, List<Post> sample) {
        StringBuilder posts = new StringBuilder();
        for (Post p : sample) {
            posts.append("• ").append(p.getTitle())
                    .append(" (Score: ").append(p.getScore())
                    .append(", Comments: ").append(p.getNumComments()).append(")\n");
            if (p.getSummary() != null) {
                posts.append("  Summary: ").append(p.getSummary()).append('\n');
            }
        }
        String prompt = String.format(Locale.ROOT, """
                You are analyzing %d posts from the "%s" category that share this theme:
                %s

                Average score: %.1f
                Average comments: %.1f
                Dominant sentiment: %s

                Posts:
                %s
                Write the insight in three short sections:
                Theme: one sentence naming what these posts have in common.
                Key Insight: two or three sentences on what it means for the community.
                Supporting Evidence: two or three concrete examples from the posts.""",
                stats.postCount(), category, theme, stats.avgScore(), stats.avgComments(),
                stats.dominantSentiment().label(), posts);

        return chat("You are an expert data analyst specializing in social media and community insights.",
                prompt, 600);
    }

    private void assign(String category, List<MutableCluster> clusters, List<Post> batch) {
        StringBuilder themes = new StringBuilder();
        for (int c = 0; c < clusters.size(); c++) {
            themes.append("CLUSTER_").append(c + 1).append(": ").append(clusters.get(c).theme).append('\n');
        }
        StringBuilder postText = new StringBuilder();
        for (int i = 0; i < batch.size(); i++) {
            postText.append(digestLine(i + 1, batch.get(i))).append('\n');
        }
        String prompt = String.format("""
                Assign each post from the "%s" category to the cluster whose theme fits it best.

                Clusters:
                %s
                Posts:
                %s
                Respond with one line per post, exactly in this format:
                POST_X: <cluster number 1-%d>""", category, themes, postText, clusters.size());

        String answer;
        try {
            answer = chat("You are an expert at text classification and thematic matching.", prompt, 500);
        } catch (RuntimeException e) {
            log.warn("Cluster assignment for '{}' failed, {} posts go to the largest cluster: {}",
                    category, batch.size(), e.getMessage());
            answer = "";
        }
        applyAssignments(answer, batch, clusters);
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    /**
     * One result per recognised line. Category numbers outside the list are passed through
     * as {@code "#n"} so the caller rejects the batch.
     */
    static List<ClassificationResult> parseClassifications(String answer, List<Post> batch, List<String> categories) {
        Map<Integer, ClassificationResult> byIndex = new LinkedHashMap<>();
        for (String line : answer.split("\\R")) {
            Matcher m = CLASSIFY_LINE.matcher(line);
            if (!m.matches()) continue;
            int postIndex = Integer.parseInt(m.group(1));
            if (postIndex < 1 || postIndex > batch.size() || byIndex.containsKey(postIndex)) continue;

            int categoryNumber = Integer.parseInt(m.group(2));
            String category = categoryNumber >= 1 && categoryNumber <= categories.size()
                    ? categories.get(categoryNumber - 1)
                    : "#" + categoryNumber;
            double confidence = m.group(3) != null ? Double.parseDouble(m.group(3)) : DEFAULT_CONFIDENCE;
            byIndex.put(postIndex, new ClassificationResult(batch.get(postIndex - 1).getId(), category, confidence));
        }
        return new ArrayList<>(byIndex.values());
    }

    static List<PostDigest> parseSummaries(String answer, List<Post> posts) {
        List<PostDigest> digests = new ArrayList<>();
        for (String line : answer.split("\\R")) {
            Matcher m = SUMMARY_LINE.matcher(line);
            if (!m.matches()) continue;
            int index = Integer.parseInt(m.group(1));
            if (index < 1 || index > posts.size()) continue;
            String summary = m.group(2).isBlank() ? null : m.group(2);
            digests.add(new PostDigest(posts.get(index - 1).getId(), summary, m.group(3)));
        }
        return digests;
    }

    /** Clusters in answer order; a post named twice stays in the first cluster naming it. */
    static List<MutableCluster> parseClusters(String answer, List<Post> sample) {
        List<MutableCluster> clusters = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (String line : answer.split("\\R")) {
            Matcher m = CLUSTER_LINE.matcher(line);
            if (!m.matches()) continue;
            MutableCluster cluster = new MutableCluster(m.group(1).isBlank() ? null : m.group(1));
            Matcher n = NUMBER.matcher(m.group(2));
            while (n.find()) {
                int index = Integer.parseInt(n.group());
                if (index >= 1 && index <= sample.size() && seen.add(index)) {
                    cluster.postIds.add(sample.get(index - 1).getId());
                }
            }
            if (!cluster.postIds.isEmpty()) {
                clusters.add(cluster);
            }
        }
        if (!clusters.isEmpty()) {
            for (int i = 1; i <= sample.size(); i++) {
                if (!seen.contains(i)) {
                    largest(clusters).postIds.add(sample.get(i - 1).getId());
                }
            }
        }
        return clusters;
    }

    /** Unparseable or missing assignments go to the largest cluster. */
    static void applyAssignments(String answer, List<Post> batch, List<MutableCluster> clusters) {
        Map<Integer, Integer> byPost = new LinkedHashMap<>();
        for (String line : answer.split("\\R")) {
            Matcher m = ASSIGN_LINE.matcher(line);
            if (!m.matches()) continue;
            int index = Integer.parseInt(m.group(1));
            int cluster = Integer.parseInt(m.group(2));
            if (index >= 1 && index <= batch.size() && cluster >= 1 && cluster <= clusters.size()) {
                byPost.putIfAbsent(index, cluster);
            }
        }
        for (int i = 1; i <= batch.size(); i++) {
            Integer cluster = byPost.get(i);
            MutableCluster target = cluster != null ? clusters.get(cluster - 1) : largest(clusters);
            target.postIds.add(batch.get(i - 1).getId());
        }
    }

    private static MutableCluster largest(List<MutableCluster> clusters) {
        return clusters.stream().max(Comparator.comparingInt(c -> c.postIds.size())).orElseThrow();
    }

    static final class MutableCluster {
        final String theme;
        final List<String> postIds = new ArrayList<>();

        MutableCluster(String theme) {
            this.theme = theme;
        }

        ThemeCluster freeze() {
            return new ThemeCluster(theme, List.copyOf(postIds));
        }
    }

    // ── HTTP ─────────────────────────────────────────────────────────────────

    String chat(String system, String user, int maxTokens) {
        InsightPipelineProperties.Llm cfg = properties.getLlm();

        ObjectNode body = objectMapper.createObjectNode();
        if (!cfg.isAzure()) {
            body.put("model", cfg.getModel());
        }
        body.put("temperature", cfg.getTemperature());
        body.put("max_tokens", maxTokens);
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", system);
        messages.addObject().put("role", "user").put("content", user);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String url;
        if (cfg.isAzure()) {
            headers.set("api-key", cfg.getApiKey());
            url = cfg.getBaseUrl() + "/openai/deployments/" + cfg.getModel()
                    + "/chat/completions?api-version=" + cfg.getApiVersion();
        } else {
            headers.setBearerAuth(cfg.getApiKey());
            url = cfg.getBaseUrl() + "/chat/completions";
        }

        log.debug("Calling chat completions at {} ({} prompt chars)", url, user.length());
        JsonNode root = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);

        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new IllegalStateException("Chat completion response had no message content");
        }
        return content.asText().strip();
    }

    private static String digestLine(int n, Post p) {
        String text = p.getSummary() != null ? p.getSummary() : p.getTitle();
        if (text != null && text.length() > 300) {
            text = text.substring(0, 300);
        }
        return "POST_" + n + ": " + text;
    }

    private static String describe(int n, Post p, int bodyChars) {
        StringBuilder s = new StringBuilder("POST_").append(n).append(":\nTitle: ").append(p.getTitle()).append('\n');
        String excerpt = p.excerpt(bodyChars);
        if (!excerpt.isEmpty()) {
            s.append("Content: ").append(excerpt).append('\n');
        }
        if (p.getFlair() != null) {
            s.append("Flair: ").append(p.getFlair()).append('\n');
        }
        return s.toString();
    }
}
