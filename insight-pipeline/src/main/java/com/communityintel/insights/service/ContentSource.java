package com.communityintel.insights.service;

import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.Post;

import java.util.List;

/**
 * Where posts come from.
 */
public interface ContentSource {

    /**
     * Fetch up to {@code maxItems} posts created inside {@code window}, newest first.
     *
     * @throws com.communityintel.insights.exception.RateLimitedException       when the source throttles us
     * @throws com.communityintel.insights.exception.SourceUnavailableException when the source cannot be read
     */
    List<Post> fetch(String source, FetchWindow window, int maxItems);
}
