package com.communityintel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Consolidated document for one run (dashboard_data.json). Immutable once published.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RunSnapshot {

    private RunMetadata metadata;
    private List<CategorySummary> categories;
    private List<CategoryInsight> insights;
    private List<Post> posts;
}
