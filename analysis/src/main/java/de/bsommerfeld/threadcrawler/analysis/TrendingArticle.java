package de.bsommerfeld.threadcrawler.analysis;

/**
 * Score and comment growth of one article between two snapshots.
 *
 * @param articleId       the article's id
 * @param title           stored title, {@code null} if the article row is
 *                        missing
 * @param initialScore    score at the earlier snapshot
 * @param currentScore    score at the later snapshot
 * @param scoreIncrease   {@code currentScore - initialScore}, may be negative
 * @param commentIncrease growth of the declared comment count, may be
 *                        negative
 * @param snapshotCount   snapshots the delta was computed from
 */
public record TrendingArticle(
        String articleId,
        String title,
        int initialScore,
        int currentScore,
        int scoreIncrease,
        int commentIncrease,
        int snapshotCount) {

    @Override
    public String toString() {
        return String.format("%-10s %+6d pts %+5d comments  (%d -> %d, %d snapshots)  %s",
                articleId, scoreIncrease, commentIncrease, initialScore, currentScore, snapshotCount,
                title == null ? "" : title);
    }
}
