package de.bsommerfeld.threadcrawler.crawler;

/**
 * Per-article cap on emitted comments. One instance is shared by the whole
 * traversal of an article and handed through it by reference.
 * Not thread-safe; only the traversal thread touches it.
 */
final class CommentBudget {

    private final int limit;
    private int used;

    CommentBudget(int limit) {
        this.limit = limit;
    }

    boolean isExhausted() {
        return used >= limit;
    }

    /** @return {@code false} if the budget was already exhausted */
    boolean tryConsume() {
        if (isExhausted())
            return false;
        used++;
        return true;
    }

    int limit() {
        return limit;
    }
}
