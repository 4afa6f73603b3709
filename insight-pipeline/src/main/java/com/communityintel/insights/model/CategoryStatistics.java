package com.communityintel.insights.model;

/** Figures handed to the model alongside sample posts when asking for a narrative. */
public record CategoryStatistics(String category, int postCount, double avgEngagement, double avgScore,
                                 double avgComments, double avgSentiment, SentimentBucket dominantSentiment,
                                 DateRange timeRange) {
}
