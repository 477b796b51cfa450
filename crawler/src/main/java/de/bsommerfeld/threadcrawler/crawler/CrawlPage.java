package de.bsommerfeld.threadcrawler.crawler;

import java.util.List;

/**
 * Outcome of crawling one listing page. Successes and failures are kept
 * apart; both lists are ordered by rank.
 *
 * @param results        crawled articles
 * @param failures       articles whose fetch or processing failed
 * @param listed         ids taken from the listing after truncation and
 *                       de-duplication
 * @param notFound       listed ids that turned out missing, deleted or dead
 * @param belowThreshold articles discarded for their score
 * @param cancelled      a stop was requested before every article was
 *                       handled
 */
public record CrawlPage(
        List<ArticleCrawlResult> results,
        List<ArticleFailure> failures,
        int listed,
        int notFound,
        int belowThreshold,
        boolean cancelled) {

    public CrawlPage {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }
}
