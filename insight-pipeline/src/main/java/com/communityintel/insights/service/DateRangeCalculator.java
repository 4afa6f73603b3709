package com.communityintel.insights.service;

import com.communityintel.insights.exception.InvalidWindowException;
import com.communityintel.insights.exception.NoPriorRunException;
import com.communityintel.insights.model.FetchWindow;
import com.communityintel.insights.model.RunMode;
import com.communityintel.insights.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Works out which time window a run should fetch.
 *
 * NEW runs use the caller's lookback. UPDATE runs restart from the end of the source's
 * latest run, minus a fixed overlap so posts that surfaced late near the old boundary
 * are picked up again. The overlap is fixed.
 */
@Component
@Slf4j
public class DateRangeCalculator {

    public static final Duration UPDATE_OVERLAP = Duration.ofDays(7);
    public static final int DEFAULT_LOOKBACK_DAYS = 365;

    /**
     * @param priorRuns  the source's published runs, any order
     * @param lookbackDays only read in NEW mode; null means {@value #DEFAULT_LOOKBACK_DAYS}
     */
    public FetchWindow computeWindow(String source, RunMode mode, Integer lookbackDays,
                                     List<RunSummary> priorRuns, Instant now) {
        Instant start;
        if (mode == RunMode.UPDATE) {
            RunSummary last = priorRuns.stream()
                    .filter(r -> r.window() != null)
                    .max(Comparator.comparing(RunSummary::generatedAt).thenComparing(RunSummary::runId))
                    .orElseThrow(() -> new NoPriorRunException(source));
            start = last.window().end().minus(UPDATE_OVERLAP);
            log.info("Update window for {}: last run {} ended {}, restarting from {}",
                    source, last.runId(), last.window().end(), start);
        } else {
            int days = lookbackDays != null ? lookbackDays : DEFAULT_LOOKBACK_DAYS;
            start = now.minus(Duration.ofDays(days));
        }

        if (!start.isBefore(now)) {
            throw new InvalidWindowException(source, start, now);
        }
        return new FetchWindow(start, now);
    }
}
