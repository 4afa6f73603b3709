package com.communityintel.insights.model;

import java.util.List;

/** A group of posts within one category that share a theme, as proposed by the model. */
public record ThemeCluster(String theme, List<String> postIds) {

    public int size() {
        return postIds.size();
    }
}
