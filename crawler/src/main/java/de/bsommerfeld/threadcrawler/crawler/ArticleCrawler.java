package de.bsommerfeld.threadcrawler.crawler;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.config.CrawlConfig;
import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.util.StopSignal;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchFailedException;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchResult;
import de.bsommerfeld.threadcrawler.crawler.fetch.Item;
import de.bsommerfeld.threadcrawler.crawler.fetch.ItemFetcher;
import de.bsommerfeld.threadcrawler.db.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Crawls one page of a ranked listing: fetches the article items, filters
 * them by score and hands each survivor to the {@link CommentTreeCrawler}.
 *
 * <h3>Concurrency</h3>
 * Articles are processed on a fixed pool of {@code concurrency} workers that
 * lives for the duration of one {@link #crawlPage} call. All workers share the
 * same {@link ItemFetcher} and therefore the same rate limiter, so the
 * aggregate request rate stays bounded regardless of the pool size.
 *
 * <h3>Already processed articles</h3>
 * With {@code skipAlreadyProcessed} an article that is already stored is
 * still fetched, so its score and comment count are refreshed and a snapshot
 * can be taken, but its comment tree is not walked again.
 */
@Singleton
public class ArticleCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(ArticleCrawler.class);

    private final ItemFetcher fetcher;
    private final CommentTreeCrawler commentCrawler;
    private final ArticleRepository repository;
    private final CrawlConfig config;
    private final StopSignal stopSignal;
    private final Clock clock;
    private final ItemNormalizer normalizer;

    @Inject
    public ArticleCrawler(ItemFetcher fetcher, CommentTreeCrawler commentCrawler, ArticleRepository repository,
            CrawlConfig config, StopSignal stopSignal, Clock clock) {
        this.fetcher = fetcher;
        this.commentCrawler = commentCrawler;
        this.repository = repository;
        this.config = config;
        this.stopSignal = stopSignal;
        this.clock = clock;
        this.normalizer = new ItemNormalizer(config.maxCommentLength(), config.maxStoryTextLength());
    }

    /**
     * Crawls the configured listing.
     *
     * @param pageSize          number of listing ids to take
     * @param minScoreThreshold articles scoring lower are discarded after fetch
     * @throws FetchFailedException if the listing itself cannot be fetched
     */
    public CrawlPage crawlPage(int pageSize, int minScoreThreshold) throws FetchFailedException {
        return crawlPage(pageSize, minScoreThreshold, ArticleSink.NONE);
    }

    /**
     * Same as {@link #crawlPage(int, int)} but forwards every outcome to
     * {@code sink} as soon as it is known.
     */
    public CrawlPage crawlPage(int pageSize, int minScoreThreshold, ArticleSink sink) throws FetchFailedException {
        List<Long> ids = fetchPageIds(pageSize);
        LOG.info("Crawling {} articles from {} with {} workers", ids.size(), config.listing().endpoint(),
                config.concurrency());
        sink.onListed(ids.size());

        PageState state = new PageState();
        ExecutorService workers = Executors.newFixedThreadPool(config.concurrency(), workerThreadFactory());
        try {
            List<Future<?>> pending = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                long id = ids.get(i);
                int rank = i + 1;
                pending.add(workers.submit(() -> crawlArticle(id, rank, minScoreThreshold, sink, state)));
            }
            for (Future<?> f : pending) {
                awaitWorker(f);
            }
        } finally {
            workers.shutdownNow();
        }

        state.results.sort(Comparator.comparingInt(ArticleCrawlResult::rank));
        state.failures.sort(Comparator.comparingInt(ArticleFailure::rank));
        return new CrawlPage(state.results, state.failures, ids.size(), state.notFound.get(),
                state.belowThreshold.get(), state.cancelled.get());
    }

    /** Fetches the listing, keeps the first occurrence of each id and truncates. */
    List<Long> fetchPageIds(int pageSize) throws FetchFailedException {
        List<Long> listing = fetcher.fetchListing(config.listing());
        List<Long> unique = new ArrayList<>(new LinkedHashSet<>(listing));
        return unique.size() > pageSize ? unique.subList(0, pageSize) : unique;
    }

    private void crawlArticle(long id, int rank, int minScoreThreshold, ArticleSink sink, PageState state) {
        String articleId = String.valueOf(id);
        if (stopSignal.isStopRequested()) {
            state.cancelled.set(true);
            return;
        }

        try {
            FetchResult result = fetcher.fetch(id);
            long fetchedAtMillis = clock.millis();
            if (result instanceof FetchResult.NotFound) {
                state.notFound.incrementAndGet();
                LOG.debug("Article {} (rank {}) not found, skipping", articleId, rank);
                sink.onSkipped(articleId, rank, "not found");
                return;
            }

            Item item = ((FetchResult.Found) result).item();
            Article article = normalizer.toArticle(item, fetchedAtMillis / 1000);
            if (article.score() < minScoreThreshold) {
                state.belowThreshold.incrementAndGet();
                LOG.debug("Article {} below score threshold ({} < {})", articleId, article.score(),
                        minScoreThreshold);
                sink.onSkipped(articleId, rank, "below threshold");
                return;
            }

            boolean skipComments = config.skipAlreadyProcessed() && repository.exists(articleId);
            CommentCrawlResult comments = skipComments
                    ? CommentCrawlResult.EMPTY
                    : commentCrawler.crawl(articleId, item.kids());

            ArticleCrawlResult crawled = new ArticleCrawlResult(article, comments, rank, fetchedAtMillis,
                    skipComments);
            // a throwing sink turns the article into a failure, never both
            sink.onResult(crawled);
            state.results.add(crawled);
        } catch (FetchFailedException e) {
            LOG.warn("Failed to fetch article {} (rank {}): {}", articleId, rank, e.getMessage());
            fail(new ArticleFailure(articleId, rank, e.getMessage(), e), sink, state);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while crawling article {}", articleId, e);
            fail(new ArticleFailure(articleId, rank, String.valueOf(e.getMessage()), e), sink, state);
        }
    }

    private void fail(ArticleFailure failure, ArticleSink sink, PageState state) {
        state.failures.add(failure);
        sink.onFailure(failure);
    }

    private void awaitWorker(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopSignal.requestStop();
        } catch (ExecutionException e) {
            // crawlArticle catches everything it can recover from
            LOG.error("Article worker died", e.getCause());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> new Thread(r, "article-worker-" + counter.incrementAndGet());
    }

    private static final class PageState {
        final List<ArticleCrawlResult> results = Collections.synchronizedList(new ArrayList<>());
        final List<ArticleFailure> failures = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger notFound = new AtomicInteger();
        final AtomicInteger belowThreshold = new AtomicInteger();
        final AtomicBoolean cancelled = new AtomicBoolean();
    }
}
