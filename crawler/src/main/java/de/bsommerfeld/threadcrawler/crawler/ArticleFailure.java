package de.bsommerfeld.threadcrawler.crawler;

/**
 * An article that could not be fetched or processed at all.
 *
 * @param articleId listing id of the article
 * @param rank      1-based position in the listing
 * @param reason    human-readable cause
 * @param cause     underlying exception, may be {@code null}
 */
public record ArticleFailure(String articleId, int rank, String reason, Throwable cause) {
}
