package de.bsommerfeld.threadcrawler.core.domain;

/**
 * Normalized snapshot of a listed article at the time of crawling.
 * Timestamps {@code postedUtc} and {@code fetchedAtUtc} are Unix epoch seconds.
 * Identity is the source item id; score and comment count change between
 * crawls while everything else stays stable.
 *
 * @param id           source item id, unique and stable
 * @param title        article title
 * @param url          linked url, {@code null} for self posts
 * @param domain       lower-cased host of {@code url} without {@code www.}
 * @param score        points at time of crawling, never negative
 * @param author       submitter's username, {@code null} if unknown
 * @param postedUtc    submission timestamp in epoch seconds
 * @param commentCount declared number of descendants
 * @param storyText    cleaned self-post body, {@code null} if absent
 * @param storyType    story classification
 * @param fetchedAtUtc crawl timestamp in epoch seconds
 */
public record Article(
        String id,
        String title,
        String url,
        String domain,
        int score,
        String author,
        long postedUtc,
        int commentCount,
        String storyText,
        StoryType storyType,
        long fetchedAtUtc) {

    public Article {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Article id must not be blank");
        }
        score = Math.max(0, score);
        commentCount = Math.max(0, commentCount);
        if (storyType == null) {
            storyType = StoryType.STORY;
        }
    }
}
