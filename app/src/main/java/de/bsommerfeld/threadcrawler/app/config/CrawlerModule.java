package de.bsommerfeld.threadcrawler.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.config.ApiConfig;
import de.bsommerfeld.threadcrawler.core.config.ApplicationMode;
import de.bsommerfeld.threadcrawler.core.config.ConfigLoader;
import de.bsommerfeld.threadcrawler.core.config.CrawlConfig;
import de.bsommerfeld.threadcrawler.core.config.DatabaseConfig;
import de.bsommerfeld.threadcrawler.core.config.GlobalConfig;
import de.bsommerfeld.threadcrawler.crawler.fetch.HttpItemFetcher;
import de.bsommerfeld.threadcrawler.crawler.fetch.ItemFetcher;
import de.bsommerfeld.threadcrawler.crawler.fetch.ItemParser;
import de.bsommerfeld.threadcrawler.crawler.fetch.RateLimitedItemFetcher;
import de.bsommerfeld.threadcrawler.crawler.fetch.RateLimiter;
import de.bsommerfeld.threadcrawler.crawler.fetch.RetryingItemFetcher;
import de.bsommerfeld.threadcrawler.crawler.fetch.TestItemFetcher;
import de.bsommerfeld.threadcrawler.db.DatabaseService;
import de.bsommerfeld.threadcrawler.db.SqlDatabaseService;
import de.bsommerfeld.threadcrawler.db.TestDatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Guice module wiring configuration, storage and the fetcher stack.
 *
 * <p>
 * The crawl section is validated when the module is constructed, so an
 * invalid configuration surfaces as
 * {@link de.bsommerfeld.threadcrawler.core.config.ConfigInvalidException}
 * before any injector exists.
 */
public class CrawlerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlerModule.class);

    private final GlobalConfig config;
    private final CrawlConfig crawlConfig;
    private final ApplicationMode mode;

    public CrawlerModule() {
        this(ConfigLoader.load(ConfigLoader.defaultLocation()), ApplicationMode.get());
    }

    public CrawlerModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.crawlConfig = config.getCrawl().toCrawlConfig();
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);
        bind(ApiConfig.class).toInstance(config.getApi());
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(CrawlConfig.class).toInstance(crawlConfig);
        bind(Clock.class).toInstance(Clock.systemUTC());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(DatabaseService.class).to(TestDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }
    }

    @Provides
    @Singleton
    RateLimiter rateLimiter(CrawlConfig crawl) {
        return new RateLimiter(crawl.requestRateIntervalMs());
    }

    /**
     * PROD: raw HTTP, then rate limiting, then retries on the outside so
     * every retry attempt waits for its own slot. TEST: synthetic items,
     * unthrottled.
     */
    @Provides
    @Singleton
    ItemFetcher itemFetcher(ApiConfig api, CrawlConfig crawl, RateLimiter rateLimiter) {
        if (mode.isTest()) {
            return new TestItemFetcher();
        }
        Duration timeout = Duration.ofMillis(crawl.requestTimeoutMs());
        ItemFetcher http = new HttpItemFetcher(HttpItemFetcher.defaultClient(timeout), new ItemParser(),
                api.getBaseUrl(), api.getUserAgent(), timeout);
        LOG.info("Fetching from {} at most every {}ms", api.getBaseUrl(), rateLimiter.getIntervalMillis());
        return new RetryingItemFetcher(new RateLimitedItemFetcher(http, rateLimiter), crawl.maxRetries(),
                crawl.retryBaseDelayMs(), crawl.retryMaxDelayMs());
    }
}
