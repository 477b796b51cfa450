package de.bsommerfeld.threadcrawler.core.event;

/**
 * Progress events published by the crawl run. Consumers subscribe through
 * {@link ApplicationEventBus}.
 */
public class CrawlEvents {

    /** Fired once the listing has been fetched and the page size is known. */
    public record RunStartedEvent(String listing, int articleCount) {
    }

    /**
     * Fired after each article has been handled, whatever the outcome.
     *
     * @param articleId the article's id
     * @param outcome   short outcome label, e.g. {@code stored} or
     *                  {@code failed}
     * @param comments  comments persisted for this article
     * @param completed articles handled so far in this run
     * @param total     articles in this run
     */
    public record ArticleProcessedEvent(String articleId, String outcome, int comments, int completed, int total) {
    }

    public record RunFinishedEvent(String summary, boolean cancelled) {
    }
}
