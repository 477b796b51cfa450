package de.bsommerfeld.threadcrawler.core.config;

/**
 * Immutable, validated configuration for a single crawl run.
 *
 * <p>
 * Instances are normally produced by {@link CrawlSettings#toCrawlConfig()}.
 * The compact constructor rejects out-of-range values with a
 * {@link ConfigInvalidException}, so a constructed instance is always usable.
 *
 * @param listing               which ranked listing to crawl
 * @param maxArticles           page size taken from the listing
 * @param maxCommentsPerArticle total comment budget per article
 * @param maxCommentDepth       deepest comment depth that is fetched (0 = top
 *                              level only)
 * @param maxChildrenPerNode    child ids taken per node, in upstream order
 * @param requestRateIntervalMs minimum spacing between two upstream requests
 * @param requestTimeoutMs      per-request timeout
 * @param maxRetries            retries after the first failed attempt
 * @param retryBaseDelayMs      initial backoff delay
 * @param retryMaxDelayMs       backoff cap
 * @param minScoreThreshold     articles below this score are discarded
 * @param concurrency           article worker threads
 * @param subtreeFanOut         sibling subtrees prefetched in parallel
 * @param skipAlreadyProcessed  skip comment trees of articles that are already
 *                              stored
 * @param maxCommentLength      comment text is truncated to this many chars
 * @param maxStoryTextLength    story text is truncated to this many chars
 */
public record CrawlConfig(
        Listing listing,
        int maxArticles,
        int maxCommentsPerArticle,
        int maxCommentDepth,
        int maxChildrenPerNode,
        long requestRateIntervalMs,
        long requestTimeoutMs,
        int maxRetries,
        long retryBaseDelayMs,
        long retryMaxDelayMs,
        int minScoreThreshold,
        int concurrency,
        int subtreeFanOut,
        boolean skipAlreadyProcessed,
        int maxCommentLength,
        int maxStoryTextLength) {

    public static final int DEFAULT_MAX_ARTICLES = 30;
    public static final int DEFAULT_MAX_COMMENTS_PER_ARTICLE = 200;
    public static final int DEFAULT_MAX_COMMENT_DEPTH = 4;
    public static final int DEFAULT_MAX_CHILDREN_PER_NODE = 15;
    public static final long DEFAULT_REQUEST_RATE_INTERVAL_MS = 1000;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 500;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 8_000;
    public static final int DEFAULT_CONCURRENCY = 2;
    public static final int DEFAULT_MAX_COMMENT_LENGTH = 1000;
    public static final int DEFAULT_MAX_STORY_TEXT_LENGTH = 2000;

    public CrawlConfig {
        if (listing == null) {
            throw new ConfigInvalidException("listing must be set");
        }
        requirePositive("max-articles", maxArticles);
        requireNonNegative("max-comments-per-article", maxCommentsPerArticle);
        requireNonNegative("max-comment-depth", maxCommentDepth);
        requireNonNegative("max-children-per-node", maxChildrenPerNode);
        requireNonNegative("request-rate-interval-ms", requestRateIntervalMs);
        requirePositive("request-timeout-ms", requestTimeoutMs);
        requireNonNegative("max-retries", maxRetries);
        requireNonNegative("retry-base-delay-ms", retryBaseDelayMs);
        requireNonNegative("min-score-threshold", minScoreThreshold);
        requirePositive("concurrency", concurrency);
        requirePositive("subtree-fan-out", subtreeFanOut);
        requirePositive("max-comment-length", maxCommentLength);
        requirePositive("max-story-text-length", maxStoryTextLength);
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new ConfigInvalidException("retry-max-delay-ms (" + retryMaxDelayMs
                    + ") must not be lower than retry-base-delay-ms (" + retryBaseDelayMs + ")");
        }
    }

    /** Configuration with every field at its default value. */
    public static CrawlConfig defaults() {
        return new CrawlSettings().toCrawlConfig();
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigInvalidException(key + " must be positive, was " + value);
        }
    }

    private static void requireNonNegative(String key, long value) {
        if (value < 0) {
            throw new ConfigInvalidException(key + " must not be negative, was " + value);
        }
    }
}
