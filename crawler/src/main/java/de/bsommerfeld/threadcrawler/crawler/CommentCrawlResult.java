package de.bsommerfeld.threadcrawler.crawler;

import de.bsommerfeld.threadcrawler.core.domain.Comment;

import java.util.List;

/**
 * Comments of one article in depth-first emission order plus traversal
 * counters.
 *
 * @param comments      emitted comments, each exactly once
 * @param fetchFailures nodes whose fetch failed, each aborting its subtree
 * @param droppedNodes  nodes skipped for being missing, deleted, dead or
 *                      textless
 * @param truncated     the comment budget ran out before the tree was
 *                      exhausted
 * @param cancelled     a stop was requested before the tree was exhausted
 */
public record CommentCrawlResult(
        List<Comment> comments,
        int fetchFailures,
        int droppedNodes,
        boolean truncated,
        boolean cancelled) {

    public static final CommentCrawlResult EMPTY = new CommentCrawlResult(List.of(), 0, 0, false, false);

    public CommentCrawlResult {
        comments = List.copyOf(comments);
    }

    public int size() {
        return comments.size();
    }
}
