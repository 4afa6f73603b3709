package com.communityintel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorySummary {

    private String id;              // slug of the name
    private String name;
    private int postCount;
    private double avgEngagement;   // mean(score + numComments)
    private double avgScore;
    private double avgComments;
    private double avgSentiment;
    private SentimentBucket dominantSentiment;
    private Instant timeRangeStart;
    private Instant timeRangeEnd;
    private List<PostRef> topPosts;
    private String narrative;
    private NarrativeStatus narrativeStatus;
    private boolean insufficientData;
}
