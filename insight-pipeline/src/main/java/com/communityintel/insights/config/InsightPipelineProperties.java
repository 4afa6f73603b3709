package com.communityintel.insights.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "insight-pipeline")
@Data
public class InsightPipelineProperties {

    private Output output = new Output();
    private Scheduler scheduler = new Scheduler();
    private Categorization categorization = new Categorization();
    private Aggregation aggregation = new Aggregation();
    private Source source = new Source();
    private Llm llm = new Llm();
    private Refresh refresh = new Refresh();
    private Audit audit = new Audit();

    @Data
    public static class Output {
        private String baseDir = "pipeline_output";
        private boolean writeCsvSummary = true;
        private boolean writeReport = true;
        private int snapshotCacheSize = 8;
    }

    @Data
    public static class Scheduler {
        private int workerPoolSize = 2;
        private int queueCapacity = 100;
        private SameSourcePolicy sameSourcePolicy = SameSourcePolicy.SERIALIZE;
        private int maxRetainedJobs = 500;

        /**
         * What happens when two jobs target the same source at once.
         * SERIALIZE runs them one after the other; LAST_WRITE_WINS lets them race
         * and whichever publishes the newer run becomes latest.
         */
        public enum SameSourcePolicy {
            SERIALIZE, LAST_WRITE_WINS
        }
    }

    @Data
    public static class Categorization {
        private int batchSize = 10;
        private int discoverySampleSize = 100;
        private int defaultCategoryCount = 8;
        private int maxConcurrentBatches = 4;
        private boolean enrichPosts = true;
    }

    @Data
    public static class Aggregation {
        private int topPostsPerCategory = 3;
        private int narrativeSampleSize = 50;
        private boolean clusterThemes = true;
        private int clusterSampleSize = 100;
        private int clusterAssignBatchSize = 30;
    }

    @Data
    public static class Source {
        private String baseUrl = "https://www.reddit.com";
        private String userAgent = "community-intel:insight-pipeline:1.0";
        private int minScore = 50;
        private int minComments = 0;
        private int pageSize = 100;
        private long rateLimitDelayMs = 1000;
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private boolean azure = false;
        private String apiVersion = "2024-02-15-preview";
        private double temperature = 0.3;
        private int timeoutSeconds = 120;
    }

    @Data
    public static class Refresh {
        private boolean enabled = false;
        private String cron = "0 0 3 * * ?";
        private List<String> sources = new ArrayList<>();
        private int maxItems = 700;
        private int minClusterSize = 3;
    }

    @Data
    public static class Audit {
        private boolean enabled = false;
    }
}
