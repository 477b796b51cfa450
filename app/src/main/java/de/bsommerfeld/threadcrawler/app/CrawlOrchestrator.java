package de.bsommerfeld.threadcrawler.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.config.CrawlConfig;
import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;
import de.bsommerfeld.threadcrawler.core.event.ApplicationEventBus;
import de.bsommerfeld.threadcrawler.core.event.CrawlEvents.ArticleProcessedEvent;
import de.bsommerfeld.threadcrawler.core.event.CrawlEvents.RunFinishedEvent;
import de.bsommerfeld.threadcrawler.core.event.CrawlEvents.RunStartedEvent;
import de.bsommerfeld.threadcrawler.crawler.ArticleCrawlResult;
import de.bsommerfeld.threadcrawler.crawler.ArticleCrawler;
import de.bsommerfeld.threadcrawler.crawler.ArticleFailure;
import de.bsommerfeld.threadcrawler.crawler.ArticleSink;
import de.bsommerfeld.threadcrawler.crawler.CommentCrawlResult;
import de.bsommerfeld.threadcrawler.crawler.CrawlPage;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchFailedException;
import de.bsommerfeld.threadcrawler.db.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one crawl end to end: crawl a listing page, persist every crawled
 * article with its comments and a score snapshot, and account for every
 * outcome in a {@link RunSummary}.
 *
 * <h3>Best effort</h3>
 * Persistence starts as soon as an article is crawled, while the remaining
 * articles are still being fetched. A failed write is logged and counted;
 * it never aborts the run. Only a listing that cannot be fetched at all
 * fails the run.
 */
@Singleton
public class CrawlOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);

    private final ArticleCrawler articleCrawler;
    private final ArticleRepository repository;
    private final CrawlConfig config;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public CrawlOrchestrator(ArticleCrawler articleCrawler, ArticleRepository repository, CrawlConfig config,
            ApplicationEventBus eventBus, Clock clock) {
        this.articleCrawler = articleCrawler;
        this.repository = repository;
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /** Crawls with the configured page size and score threshold. */
    public RunSummary run() throws FetchFailedException {
        return run(config.maxArticles(), config.minScoreThreshold());
    }

    /**
     * @throws FetchFailedException if the listing itself cannot be fetched
     */
    public RunSummary run(int maxArticles, int minScoreThreshold) throws FetchFailedException {
        long startedAt = clock.millis();
        String listing = config.listing().endpoint();
        LOG.info("Starting crawl of {} (max {} articles, min score {})", listing, maxArticles, minScoreThreshold);

        PersistingSink sink = new PersistingSink(listing);
        CrawlPage page = articleCrawler.crawlPage(maxArticles, minScoreThreshold, sink);

        int stored = 0;
        int writeFailures = 0;
        for (PendingWrite write : sink.pendingWrites()) {
            try {
                write.future().join();
                stored++;
            } catch (CompletionException e) {
                writeFailures++;
                LOG.error("Failed to persist article {}", write.articleId(), e.getCause());
            }
        }

        RunSummary summary = summarize(listing, page, stored, writeFailures,
                Duration.ofMillis(clock.millis() - startedAt));
        LOG.info("Crawl finished: {}", summary);
        eventBus.post(new RunFinishedEvent(summary.toString(), summary.cancelled()));
        return summary;
    }

    private static RunSummary summarize(String listing, CrawlPage page, int stored, int writeFailures,
            Duration duration) {
        int emitted = 0;
        int dropped = 0;
        int fetchFailures = 0;
        int truncated = 0;
        int skippedTrees = 0;
        boolean cancelled = page.cancelled();
        for (ArticleCrawlResult result : page.results()) {
            CommentCrawlResult comments = result.commentCrawl();
            emitted += comments.size();
            dropped += comments.droppedNodes();
            fetchFailures += comments.fetchFailures();
            if (comments.truncated())
                truncated++;
            if (comments.cancelled())
                cancelled = true;
            if (result.commentsSkipped())
                skippedTrees++;
        }
        return new RunSummary(listing, page.listed(), page.results().size(), page.notFound(),
                page.belowThreshold(), page.failures().size(), skippedTrees, emitted, dropped, fetchFailures,
                truncated, stored, writeFailures, cancelled, duration);
    }

    private record PendingWrite(String articleId, CompletableFuture<Void> future) {
    }

    /**
     * Starts the writes of each crawled article right away and reports
     * progress. Invoked concurrently by the article workers.
     */
    private final class PersistingSink implements ArticleSink {

        private final String listing;
        private final List<PendingWrite> writes = new ArrayList<>();
        private final AtomicInteger completed = new AtomicInteger();
        private volatile int total;

        PersistingSink(String listing) {
            this.listing = listing;
        }

        @Override
        public void onListed(int articleCount) {
            total = articleCount;
            eventBus.post(new RunStartedEvent(listing, articleCount));
        }

        @Override
        public void onResult(ArticleCrawlResult result) {
            Article article = result.article();
            CompletableFuture<Void> articleWrite = repository.upsertArticle(article);
            CompletableFuture<Void> commentWrite = result.commentsSkipped()
                    ? CompletableFuture.completedFuture(null)
                    : repository.upsertComments(article.id(), result.comments());
            CompletableFuture<Void> snapshotWrite = repository.recordSnapshot(new ScoreSnapshot(article.id(),
                    result.fetchedAtMillis(), article.score(), article.commentCount(), result.rank()));

            synchronized (writes) {
                writes.add(new PendingWrite(article.id(),
                        CompletableFuture.allOf(articleWrite, commentWrite, snapshotWrite)));
            }
            progress(article.id(), result.commentsSkipped() ? "refreshed" : "crawled", result.comments().size());
        }

        @Override
        public void onFailure(ArticleFailure failure) {
            progress(failure.articleId(), "failed", 0);
        }

        @Override
        public void onSkipped(String articleId, int rank, String reason) {
            progress(articleId, reason, 0);
        }

        List<PendingWrite> pendingWrites() {
            synchronized (writes) {
                return new ArrayList<>(writes);
            }
        }

        private void progress(String articleId, String outcome, int comments) {
            eventBus.post(new ArticleProcessedEvent(articleId, outcome, comments, completed.incrementAndGet(),
                    total));
        }
    }
}
