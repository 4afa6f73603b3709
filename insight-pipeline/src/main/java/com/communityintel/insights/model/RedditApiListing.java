package com.communityintel.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the reddit.com listing JSON (/r/{name}/new.json).
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RedditApiListing {

    private String kind;
    private ListingData data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListingData {
        private String after;
        private List<Child> children;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Child {
        private String kind;
        private Submission data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Submission {
        private String id;
        private String subreddit;
        private String title;
        private String selftext;
        private String author;
        private Long score;

        @JsonProperty("num_comments")
        private Long numComments;

        @JsonProperty("created_utc")
        private Double createdUtc;

        private String permalink;

        @JsonProperty("link_flair_text")
        private String linkFlairText;

        @JsonProperty("over_18")
        private Boolean over18;

        private Boolean stickied;
    }
}
