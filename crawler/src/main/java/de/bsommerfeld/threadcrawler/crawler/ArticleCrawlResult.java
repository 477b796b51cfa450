package de.bsommerfeld.threadcrawler.crawler;

import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.Comment;

import java.util.List;

/**
 * A successfully crawled article together with its comments.
 *
 * @param article         the normalized article
 * @param commentCrawl    comments and traversal counters; empty when
 *                        {@code commentsSkipped}
 * @param rank            1-based position in the listing
 * @param fetchedAtMillis when the article item was fetched, epoch millis
 * @param commentsSkipped the article was already stored and its comment tree
 *                        was not re-crawled
 */
public record ArticleCrawlResult(
        Article article,
        CommentCrawlResult commentCrawl,
        int rank,
        long fetchedAtMillis,
        boolean commentsSkipped) {

    public List<Comment> comments() {
        return commentCrawl.comments();
    }
}
