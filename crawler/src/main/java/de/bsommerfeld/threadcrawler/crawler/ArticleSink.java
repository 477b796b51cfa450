package de.bsommerfeld.threadcrawler.crawler;

/**
 * Receives article outcomes as soon as they are ready. Called concurrently
 * from the crawl workers, so implementations must be thread-safe.
 */
public interface ArticleSink {

    ArticleSink NONE = new ArticleSink() {
        @Override
        public void onResult(ArticleCrawlResult result) {
        }

        @Override
        public void onFailure(ArticleFailure failure) {
        }
    };

    /** The listing has been fetched; {@code articleCount} articles follow. */
    default void onListed(int articleCount) {
    }

    void onResult(ArticleCrawlResult result);

    void onFailure(ArticleFailure failure);

    /** An article was listed but skipped (missing or below the score threshold). */
    default void onSkipped(String articleId, int rank, String reason) {
    }
}
