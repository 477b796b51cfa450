package de.bsommerfeld.threadcrawler.app;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.event.CrawlEvents.ArticleProcessedEvent;
import de.bsommerfeld.threadcrawler.core.event.CrawlEvents.RunFinishedEvent;
import de.bsommerfeld.threadcrawler.core.event.CrawlEvents.RunStartedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs crawl progress with a percentage and a naive ETA.
 */
@Singleton
public class ProgressLogger {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressLogger.class);

    private volatile long startedAtNanos = System.nanoTime();

    @Subscribe
    public void onRunStarted(RunStartedEvent event) {
        startedAtNanos = System.nanoTime();
        LOG.info("Crawling {} articles from {}", event.articleCount(), event.listing());
    }

    @Subscribe
    public void onArticleProcessed(ArticleProcessedEvent event) {
        LOG.info("[{}/{}] {} {} ({} comments){}", event.completed(), event.total(), event.articleId(),
                event.outcome(), event.comments(), eta(event.completed(), event.total()));
    }

    @Subscribe
    public void onRunFinished(RunFinishedEvent event) {
        if (event.cancelled()) {
            LOG.warn("Run cancelled: {}", event.summary());
        }
    }

    String eta(int completed, int total) {
        if (completed <= 0 || total <= 0 || completed >= total)
            return "";
        double elapsedSec = (System.nanoTime() - startedAtNanos) / 1e9;
        double remaining = elapsedSec / completed * (total - completed);
        return String.format(" %.0f%%, ETA %.0fs", 100.0 * completed / total, remaining);
    }
}
