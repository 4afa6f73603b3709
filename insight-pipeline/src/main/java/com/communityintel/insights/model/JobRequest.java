package com.communityintel.insights.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /pipeline/run. Defaults mirror what the dashboard sends when a field is left blank.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {

    private String source;

    @Builder.Default
    private RunMode mode = RunMode.NEW;

    /** Only used in NEW mode. */
    private Integer lookbackDays;

    @Builder.Default
    private Integer maxItems = 700;

    @Builder.Default
    private Integer minClusterSize = 3;

    /** Number of categories to discover; ignored when categories are supplied. */
    private Integer categoryCount;

    /** Caller-supplied categories; discovery is skipped when present. */
    private List<String> categories;

    public boolean hasExplicitCategories() {
        return categories != null && !categories.isEmpty();
    }

    public JobRequest copy() {
        return toBuilder()
                .categories(categories != null ? new ArrayList<>(categories) : null)
                .build();
    }
}
