package de.bsommerfeld.threadcrawler.core.domain;

/**
 * Point-in-time observation of an article's score. Snapshots are append-only
 * and identified by {@code (articleId, takenAtMillis)}.
 *
 * @param articleId     id of the observed article
 * @param takenAtMillis observation timestamp in epoch milliseconds
 * @param score         article score at that moment
 * @param commentCount  declared comment count at that moment
 * @param rank          1-based position in the listing, {@code null} if the
 *                      article was not observed through a listing
 */
public record ScoreSnapshot(
        String articleId,
        long takenAtMillis,
        int score,
        int commentCount,
        Integer rank) {

    public ScoreSnapshot(String articleId, long takenAtMillis, int score, int commentCount) {
        this(articleId, takenAtMillis, score, commentCount, null);
    }
}
