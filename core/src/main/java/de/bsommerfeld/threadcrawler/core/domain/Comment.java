package de.bsommerfeld.threadcrawler.core.domain;

/**
 * A single comment within an article's comment tree.
 * Comments reference their article by id only, there is no object link back.
 *
 * @param id        source item id of the comment
 * @param articleId id of the owning article
 * @param parentId  id of the parent comment, {@code null} for top-level
 *                  comments
 * @param author    commenter's username, {@code null} if unknown
 * @param text      cleaned and length-capped comment body
 * @param postedUtc creation timestamp in epoch seconds
 * @param depth     0 for top-level, parent depth + 1 otherwise
 */
public record Comment(
        String id,
        String articleId,
        String parentId,
        String author,
        String text,
        long postedUtc,
        int depth) {

    public Comment {
        if (depth < 0) {
            throw new IllegalArgumentException("Comment depth must not be negative: " + depth);
        }
    }

    public boolean isTopLevel() {
        return parentId == null;
    }
}
