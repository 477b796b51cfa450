package de.bsommerfeld.threadcrawler.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrawlConfigTest {

    // -- Defaults --

    @Test
    void defaults_shouldMatchDocumentedValues() {
        CrawlConfig config = CrawlConfig.defaults();

        assertEquals(Listing.TOP, config.listing());
        assertEquals(30, config.maxArticles());
        assertEquals(200, config.maxCommentsPerArticle());
        assertEquals(4, config.maxCommentDepth());
        assertEquals(15, config.maxChildrenPerNode());
        assertEquals(1000, config.requestRateIntervalMs());
        assertEquals(10_000, config.requestTimeoutMs());
        assertEquals(3, config.maxRetries());
        assertEquals(0, config.minScoreThreshold());
        assertEquals(2, config.concurrency());
        assertEquals(1, config.subtreeFanOut());
        assertFalse(config.skipAlreadyProcessed());
        assertEquals(1000, config.maxCommentLength());
        assertEquals(2000, config.maxStoryTextLength());
    }

    @Test
    void globalConfig_shouldInitializeAllSections() {
        GlobalConfig config = new GlobalConfig();

        assertNotNull(config.getApi());
        assertNotNull(config.getCrawl());
        assertNotNull(config.getDatabase());
        assertEquals("https://hacker-news.firebaseio.com/v0", config.getApi().getBaseUrl());
        assertEquals("", config.getDatabase().getPath());
    }

    // -- Validation --

    @Test
    void toCrawlConfig_shouldRejectZeroConcurrency() {
        CrawlSettings settings = new CrawlSettings();
        settings.setConcurrency(0);

        ConfigInvalidException e = assertThrows(ConfigInvalidException.class, settings::toCrawlConfig);
        assertTrue(e.getMessage().contains("concurrency"));
    }

    @Test
    void toCrawlConfig_shouldRejectNegativeDepth() {
        CrawlSettings settings = new CrawlSettings();
        settings.setMaxCommentDepth(-1);

        assertThrows(ConfigInvalidException.class, settings::toCrawlConfig);
    }

    @Test
    void toCrawlConfig_shouldRejectBackoffCapBelowBase() {
        CrawlSettings settings = new CrawlSettings();
        settings.setRetryBaseDelayMs(1000);
        settings.setRetryMaxDelayMs(10);

        assertThrows(ConfigInvalidException.class, settings::toCrawlConfig);
    }

    @Test
    void toCrawlConfig_shouldRejectUnknownListing() {
        CrawlSettings settings = new CrawlSettings();
        settings.setListing("hotstories");

        assertThrows(ConfigInvalidException.class, settings::toCrawlConfig);
    }

    @Test
    void toCrawlConfig_shouldAllowZeroDepthAndZeroBudget() {
        CrawlSettings settings = new CrawlSettings();
        settings.setMaxCommentDepth(0);
        settings.setMaxCommentsPerArticle(0);

        CrawlConfig config = settings.toCrawlConfig();
        assertEquals(0, config.maxCommentDepth());
        assertEquals(0, config.maxCommentsPerArticle());
    }

    // -- Listing --

    @Test
    void listingParse_shouldAcceptEndpointAndConstantName() {
        assertEquals(Listing.BEST, Listing.parse("beststories"));
        assertEquals(Listing.ASK, Listing.parse("ASK"));
        assertEquals(Listing.NEW, Listing.parse(" NewStories "));
    }
}
