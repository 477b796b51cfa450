package de.bsommerfeld.threadcrawler.app;

import java.time.Duration;

/**
 * Counters of one crawl run. Every listed article ends up in exactly one of
 * {@code crawled}, {@code notFound}, {@code belowThreshold} or
 * {@code failed}, unless the run was cancelled.
 */
public record RunSummary(
        String listing,
        int listed,
        int crawled,
        int notFound,
        int belowThreshold,
        int failed,
        int commentTreesSkipped,
        int commentsEmitted,
        int commentsDropped,
        int commentFetchFailures,
        int truncatedTrees,
        int writesSucceeded,
        int writesFailed,
        boolean cancelled,
        Duration duration) {

    /** {@code true} if nothing failed along the way. */
    public boolean isClean() {
        return failed == 0 && writesFailed == 0 && commentFetchFailures == 0 && !cancelled;
    }

    @Override
    public String toString() {
        return String.format("%s: %d listed, %d crawled, %d not found, %d below threshold, %d failed, "
                + "%d comment trees skipped | %d comments (%d dropped, %d fetch failures, %d truncated trees) | "
                + "%d stored, %d write failures | %.1fs%s",
                listing, listed, crawled, notFound, belowThreshold, failed, commentTreesSkipped,
                commentsEmitted, commentsDropped, commentFetchFailures, truncatedTrees,
                writesSucceeded, writesFailed, duration.toMillis() / 1000.0, cancelled ? " (cancelled)" : "");
    }
}
