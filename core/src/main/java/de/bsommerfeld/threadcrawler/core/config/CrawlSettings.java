package de.bsommerfeld.threadcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mutable, file-bound crawl section of {@code config.toml}. Converted into
 * the immutable {@link CrawlConfig} once per run via {@link #toCrawlConfig()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlSettings {

    @JsonProperty("listing")
    private String listing = "topstories";

    @JsonProperty("max-articles")
    private int maxArticles = CrawlConfig.DEFAULT_MAX_ARTICLES;

    @JsonProperty("max-comments-per-article")
    private int maxCommentsPerArticle = CrawlConfig.DEFAULT_MAX_COMMENTS_PER_ARTICLE;

    @JsonProperty("max-comment-depth")
    private int maxCommentDepth = CrawlConfig.DEFAULT_MAX_COMMENT_DEPTH;

    @JsonProperty("max-children-per-node")
    private int maxChildrenPerNode = CrawlConfig.DEFAULT_MAX_CHILDREN_PER_NODE;

    @JsonProperty("request-rate-interval-ms")
    private long requestRateIntervalMs = CrawlConfig.DEFAULT_REQUEST_RATE_INTERVAL_MS;

    @JsonProperty("request-timeout-ms")
    private long requestTimeoutMs = CrawlConfig.DEFAULT_REQUEST_TIMEOUT_MS;

    @JsonProperty("max-retries")
    private int maxRetries = CrawlConfig.DEFAULT_MAX_RETRIES;

    @JsonProperty("retry-base-delay-ms")
    private long retryBaseDelayMs = CrawlConfig.DEFAULT_RETRY_BASE_DELAY_MS;

    @JsonProperty("retry-max-delay-ms")
    private long retryMaxDelayMs = CrawlConfig.DEFAULT_RETRY_MAX_DELAY_MS;

    @JsonProperty("min-score-threshold")
    private int minScoreThreshold = 0;

    @JsonProperty("concurrency")
    private int concurrency = CrawlConfig.DEFAULT_CONCURRENCY;

    @JsonProperty("subtree-fan-out")
    private int subtreeFanOut = 1;

    @JsonProperty("skip-already-processed")
    private boolean skipAlreadyProcessed = false;

    @JsonProperty("max-comment-length")
    private int maxCommentLength = CrawlConfig.DEFAULT_MAX_COMMENT_LENGTH;

    @JsonProperty("max-story-text-length")
    private int maxStoryTextLength = CrawlConfig.DEFAULT_MAX_STORY_TEXT_LENGTH;

    /**
     * Validates the current values and freezes them.
     *
     * @throws ConfigInvalidException if any value is out of range
     */
    public CrawlConfig toCrawlConfig() {
        return new CrawlConfig(
                Listing.parse(listing),
                maxArticles,
                maxCommentsPerArticle,
                maxCommentDepth,
                maxChildrenPerNode,
                requestRateIntervalMs,
                requestTimeoutMs,
                maxRetries,
                retryBaseDelayMs,
                retryMaxDelayMs,
                minScoreThreshold,
                concurrency,
                subtreeFanOut,
                skipAlreadyProcessed,
                maxCommentLength,
                maxStoryTextLength);
    }

    public String getListing() {
        return listing;
    }

    public void setListing(String listing) {
        this.listing = listing;
    }

    public int getMaxArticles() {
        return maxArticles;
    }

    public void setMaxArticles(int maxArticles) {
        this.maxArticles = maxArticles;
    }

    public int getMaxCommentsPerArticle() {
        return maxCommentsPerArticle;
    }

    public void setMaxCommentsPerArticle(int maxCommentsPerArticle) {
        this.maxCommentsPerArticle = maxCommentsPerArticle;
    }

    public int getMaxCommentDepth() {
        return maxCommentDepth;
    }

    public void setMaxCommentDepth(int maxCommentDepth) {
        this.maxCommentDepth = maxCommentDepth;
    }

    public int getMaxChildrenPerNode() {
        return maxChildrenPerNode;
    }

    public void setMaxChildrenPerNode(int maxChildrenPerNode) {
        this.maxChildrenPerNode = maxChildrenPerNode;
    }

    public long getRequestRateIntervalMs() {
        return requestRateIntervalMs;
    }

    public void setRequestRateIntervalMs(long requestRateIntervalMs) {
        this.requestRateIntervalMs = requestRateIntervalMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public long getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public void setRetryMaxDelayMs(long retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
    }

    public int getMinScoreThreshold() {
        return minScoreThreshold;
    }

    public void setMinScoreThreshold(int minScoreThreshold) {
        this.minScoreThreshold = minScoreThreshold;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getSubtreeFanOut() {
        return subtreeFanOut;
    }

    public void setSubtreeFanOut(int subtreeFanOut) {
        this.subtreeFanOut = subtreeFanOut;
    }

    public boolean isSkipAlreadyProcessed() {
        return skipAlreadyProcessed;
    }

    public void setSkipAlreadyProcessed(boolean skipAlreadyProcessed) {
        this.skipAlreadyProcessed = skipAlreadyProcessed;
    }

    public int getMaxCommentLength() {
        return maxCommentLength;
    }

    public void setMaxCommentLength(int maxCommentLength) {
        this.maxCommentLength = maxCommentLength;
    }

    public int getMaxStoryTextLength() {
        return maxStoryTextLength;
    }

    public void setMaxStoryTextLength(int maxStoryTextLength) {
        this.maxStoryTextLength = maxStoryTextLength;
    }
}
