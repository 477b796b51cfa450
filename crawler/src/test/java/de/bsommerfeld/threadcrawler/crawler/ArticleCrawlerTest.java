package de.bsommerfeld.threadcrawler.crawler;

import de.bsommerfeld.threadcrawler.core.config.CrawlConfig;
import de.bsommerfeld.threadcrawler.core.config.CrawlSettings;
import de.bsommerfeld.threadcrawler.core.util.StopSignal;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchFailedException;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchResult;
import de.bsommerfeld.threadcrawler.crawler.fetch.ItemFetcher;
import de.bsommerfeld.threadcrawler.db.ArticleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArticleCrawlerTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    @Mock
    private ArticleRepository repository;

    private FakeItemFetcher fetcher;
    private StopSignal stopSignal;
    private CrawlSettings settings;
    private CommentTreeCrawler commentCrawler;

    @BeforeEach
    void setUp() {
        fetcher = new FakeItemFetcher();
        stopSignal = new StopSignal();
        settings = new CrawlSettings();
        settings.setConcurrency(2);
    }

    @AfterEach
    void tearDown() {
        if (commentCrawler != null)
            commentCrawler.shutdown();
    }

    // -- Page Assembly --

    @Test
    void crawlPage_shouldReturnResultsOrderedByRank() throws Exception {
        fetcher.story(10, 50, 11L).comment(11, "first!")
                .story(20, 40)
                .story(30, 30, 31L, 32L).comment(31, "a").comment(32, "b")
                .listing(10L, 20L, 30L);

        CrawlPage page = crawler().crawlPage(30, 0);

        assertEquals(3, page.listed());
        assertEquals(List.of("10", "20", "30"),
                page.results().stream().map(r -> r.article().id()).toList());
        assertEquals(List.of(1, 2, 3), page.results().stream().map(ArticleCrawlResult::rank).toList());
        assertEquals(1, page.results().get(0).comments().size());
        assertEquals(2, page.results().get(2).comments().size());
        assertTrue(page.failures().isEmpty());
        assertFalse(page.cancelled());
    }

    @Test
    void crawlPage_shouldStampFetchTimeFromClock() throws Exception {
        fetcher.story(10, 50).listing(10L);

        ArticleCrawlResult result = crawler().crawlPage(1, 0).results().get(0);

        assertEquals(NOW.toEpochMilli(), result.fetchedAtMillis());
        assertEquals(NOW.getEpochSecond(), result.article().fetchedAtUtc());
    }

    @Test
    void crawlPage_shouldStampFetchTimeAfterFetchReturns() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        FakeItemFetcher slowFetcher = new FakeItemFetcher() {
            @Override
            public FetchResult fetch(long itemId) throws FetchFailedException {
                // time spent queued on the rate limiter
                clock.advance(Duration.ofSeconds(5));
                return super.fetch(itemId);
            }
        };
        slowFetcher.story(10, 50).listing(10L);
        CrawlConfig config = settings.toCrawlConfig();
        commentCrawler = new CommentTreeCrawler(slowFetcher, config, stopSignal);
        ArticleCrawler crawler = new ArticleCrawler(slowFetcher, commentCrawler, repository, config, stopSignal,
                clock);

        ArticleCrawlResult result = crawler.crawlPage(1, 0).results().get(0);

        assertEquals(NOW.plusSeconds(5).toEpochMilli(), result.fetchedAtMillis());
        assertEquals(NOW.getEpochSecond() + 5, result.article().fetchedAtUtc());
    }

    @Test
    void fetchPageIds_shouldDeduplicateBeforeTruncating() throws Exception {
        fetcher.listing(10L, 10L, 20L, 10L, 30L);

        assertEquals(List.of(10L, 20L), crawler().fetchPageIds(2));
        assertEquals(List.of(10L, 20L, 30L), crawler().fetchPageIds(10));
    }

    // -- Filtering --

    @Test
    void crawlPage_shouldDiscardArticlesBelowThreshold() throws Exception {
        fetcher.story(10, 50, 11L).comment(11, "x").story(20, 5, 21L).comment(21, "y").listing(10L, 20L);

        CrawlPage page = crawler().crawlPage(30, 10);

        assertEquals(1, page.results().size());
        assertEquals(1, page.belowThreshold());
        assertFalse(fetcher.requested().contains(21L), "comments of discarded articles are not crawled");
    }

    @Test
    void crawlPage_shouldCountMissingArticles() throws Exception {
        fetcher.story(10, 50).listing(10L, 99L);

        CrawlPage page = crawler().crawlPage(30, 0);

        assertEquals(1, page.results().size());
        assertEquals(1, page.notFound());
        assertTrue(page.failures().isEmpty());
    }

    @Test
    void crawlPage_shouldIsolateArticleFailures() throws Exception {
        fetcher.story(10, 50).story(20, 40).failing(20).story(30, 30).listing(10L, 20L, 30L);

        CrawlPage page = crawler().crawlPage(30, 0);

        assertEquals(2, page.results().size());
        assertEquals(1, page.failures().size());
        ArticleFailure failure = page.failures().get(0);
        assertEquals("20", failure.articleId());
        assertEquals(2, failure.rank());
        assertInstanceOf(FetchFailedException.class, failure.cause());
    }

    @Test
    void crawlPage_shouldSkipCommentTreeOfStoredArticles() throws Exception {
        settings.setSkipAlreadyProcessed(true);
        fetcher.story(10, 50, 11L).comment(11, "old").story(20, 40, 21L).comment(21, "new").listing(10L, 20L);
        when(repository.exists("10")).thenReturn(true);
        when(repository.exists("20")).thenReturn(false);

        CrawlPage page = crawler().crawlPage(30, 0);

        ArticleCrawlResult stored = page.results().get(0);
        assertTrue(stored.commentsSkipped());
        assertTrue(stored.comments().isEmpty());
        assertEquals(50, stored.article().score(), "article itself is still refreshed");
        assertFalse(page.results().get(1).commentsSkipped());
        assertFalse(fetcher.requested().contains(11L));
        assertTrue(fetcher.requested().contains(21L));
    }

    @Test
    void crawlPage_shouldRecrawlStoredArticlesByDefault() throws Exception {
        fetcher.story(10, 50, 11L).comment(11, "old").listing(10L);

        CrawlPage page = crawler().crawlPage(30, 0);

        assertFalse(page.results().get(0).commentsSkipped());
        assertEquals(1, page.results().get(0).comments().size());
    }

    // -- Sink & Cancellation --

    @Test
    void crawlPage_shouldReportEveryOutcomeToSink() throws Exception {
        fetcher.story(10, 50).story(20, 1).failing(30).listing(10L, 20L, 30L, 40L);
        RecordingSink sink = new RecordingSink();

        crawler().crawlPage(30, 10, sink);

        assertEquals(List.of("10"), sink.results);
        assertEquals(List.of("30"), sink.failures);
        assertEquals(2, sink.skipped.size());
        assertTrue(sink.skipped.contains("20:below threshold"));
        assertTrue(sink.skipped.contains("40:not found"));
    }

    @Test
    void crawlPage_shouldCountThrowingSinkAsFailureOnly() throws Exception {
        fetcher.story(10, 50).story(20, 40).listing(10L, 20L);
        RecordingSink sink = new RecordingSink() {
            @Override
            public void onResult(ArticleCrawlResult result) {
                if ("10".equals(result.article().id()))
                    throw new IllegalStateException("write executor shut down");
                super.onResult(result);
            }
        };

        CrawlPage page = crawler().crawlPage(30, 0, sink);

        assertEquals(List.of("20"), page.results().stream().map(r -> r.article().id()).toList());
        assertEquals(1, page.failures().size());
        assertEquals("10", page.failures().get(0).articleId());
        assertEquals(page.listed(), page.results().size() + page.failures().size());
        assertEquals(List.of("10"), sink.failures);
    }

    @Test
    void crawlPage_shouldStopWhenRequested() throws Exception {
        fetcher.story(10, 50).story(20, 40).listing(10L, 20L);
        stopSignal.requestStop();

        CrawlPage page = crawler().crawlPage(30, 0);

        assertTrue(page.cancelled());
        assertTrue(page.results().isEmpty());
        assertTrue(fetcher.requested().isEmpty());
    }

    @Test
    void crawlPage_shouldPropagateListingFailure() throws Exception {
        ItemFetcher broken = mock(ItemFetcher.class);
        when(broken.fetchListing(any())).thenThrow(new FetchFailedException(ItemFetcher.LISTING_ID, "down", true));
        CrawlConfig config = settings.toCrawlConfig();
        commentCrawler = new CommentTreeCrawler(broken, config, stopSignal);
        ArticleCrawler crawler = new ArticleCrawler(broken, commentCrawler, repository, config, stopSignal,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(FetchFailedException.class, () -> crawler.crawlPage(30, 0));
    }

    private ArticleCrawler crawler() {
        CrawlConfig config = settings.toCrawlConfig();
        if (commentCrawler == null)
            commentCrawler = new CommentTreeCrawler(fetcher, config, stopSignal);
        return new ArticleCrawler(fetcher, commentCrawler, repository, config, stopSignal,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static class RecordingSink implements ArticleSink {
        final List<String> results = Collections.synchronizedList(new ArrayList<>());
        final List<String> failures = Collections.synchronizedList(new ArrayList<>());
        final List<String> skipped = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onResult(ArticleCrawlResult result) {
            results.add(result.article().id());
        }

        @Override
        public void onFailure(ArticleFailure failure) {
            failures.add(failure.articleId());
        }

        @Override
        public void onSkipped(String articleId, int rank, String reason) {
            skipped.add(articleId + ":" + reason);
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        synchronized void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
