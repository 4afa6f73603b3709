package com.communityintel.insights.service;

import com.communityintel.insights.config.InsightPipelineProperties;
import com.communityintel.insights.exception.PipelineException;
import com.communityintel.insights.exception.RateLimitedException;
import com.communityintel.insights.exception.SourceUnavailableException;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.Post;
import com.communityintel.insights.model.RedditApiListing;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a subreddit's newest posts through the public listing endpoint.
 *
 * Pages newest to oldest until the window start, the listing's end or {@code maxItems}.
 * Posts below the score or comment thresholds are skipped. A configurable delay is applied
 * between pages. 429 fails fast as rate limited, 403/404 as unavailable; server errors and
 * I/O failures go through the Resilience4j retry before being reported as unavailable.
 */
@Service
@Slf4j
public class RedditClient implements ContentSource {

    private final RestTemplate restTemplate;
    private final RedditPostMapper mapper;
    private final InsightPipelineProperties properties;

    public RedditClient(@Qualifier("contentSourceRestTemplate") RestTemplate restTemplate,
                        RedditPostMapper mapper,
                        InsightPipelineProperties properties) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.properties = properties;
    }

    @Override
    @Retry(name = "contentSource", fallbackMethod = "unavailable")
    public List<Post> fetch(String source, FetchWindow window, int maxItems) {
        InsightPipelineProperties.Source cfg = properties.getSource();
        List<Post> posts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String after = null;
        int pages = 0;
        int skipped = 0;

        while (posts.size() < maxItems) {
            if (pages > 0) {
                sleepMs(cfg.getRateLimitDelayMs());
            }
            RedditApiListing.ListingData page = fetchPage(source, after);
            pages++;
            if (page == null || page.getChildren() == null || page.getChildren().isEmpty()) {
                break;
            }

            boolean reachedWindowStart = false;
            for (RedditApiListing.Child child : page.getChildren()) {
                Post post = mapper.map(child.getData(), source);
                if (post == null || !seen.add(post.getId())) continue;

                if (post.getCreatedAt().isBefore(window.start())) {
                    reachedWindowStart = true;
                    break;
                }
                if (!window.contains(post.getCreatedAt())) continue;
                if (post.getScore() < cfg.getMinScore()
                        || (cfg.getMinComments() > 0 && post.getNumComments() < cfg.getMinComments())) {
                    skipped++;
                    continue;
                }
                posts.add(post);
                if (posts.size() >= maxItems) break;
            }

            after = page.getAfter();
            if (reachedWindowStart || after == null) {
                break;
            }
        }

        log.info("Fetched {} posts from r/{} in {} pages ({} below thresholds)",
                posts.size(), source, pages, skipped);
        return posts;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RedditApiListing.ListingData fetchPage(String source, String after) {
        InsightPipelineProperties.Source cfg = properties.getSource();
        UriComponentsBuilder uri = UriComponentsBuilder
                .fromHttpUrl(cfg.getBaseUrl() + "/r/" + source + "/new.json")
                .queryParam("limit", cfg.getPageSize())
                .queryParam("raw_json", 1);
        if (after != null) {
            uri.queryParam("after", after);
        }
        String url = uri.toUriString();
        log.debug("Calling listing endpoint: {}", url);

        try {
            RedditApiListing listing = restTemplate.getForObject(url, RedditApiListing.class);
            return listing != null ? listing.getData() : null;

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) reading r/{}", source);
            throw new RateLimitedException("Content source rate limited reads of '" + source + "'", e);

        } catch (HttpClientErrorException.Forbidden | HttpClientErrorException.NotFound e) {
            throw SourceUnavailableException.httpStatus(source, e.getStatusCode().value());
        }
    }

    /** Retry fallback: pipeline errors pass through, anything else means the source is unreachable. */
    @SuppressWarnings("unused")
    private List<Post> unavailable(String source, FetchWindow window, int maxItems, Throwable t) {
        if (t instanceof PipelineException pe) {
            throw pe;
        }
        throw new SourceUnavailableException("Could not read '" + source + "': " + t.getMessage(), t);
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
