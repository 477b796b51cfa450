package de.bsommerfeld.threadcrawler.db;

import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;

import java.util.List;

/**
 * Persistence contract for articles, comments and score history.
 * Implementations must be thread-safe. Write operations throw
 * {@link RepositoryException} on failure; read operations degrade to an
 * empty result and log the cause.
 *
 * @see SqlDatabaseService
 * @see TestDatabaseService
 */
public interface DatabaseService {

    /**
     * Inserts or updates an article by id. Score, comment count and fetch time
     * are overwritten; the first-seen timestamp and the posting time are kept,
     * and a {@code null} attribute never blanks a stored value. Idempotent.
     */
    void upsertArticle(Article article);

    /**
     * Inserts or updates the given comments of one article in a single
     * transaction, keyed by {@code (articleId, commentId)}. A later write of
     * the same key wins.
     *
     * @throws IllegalArgumentException if a comment belongs to another article
     */
    void upsertComments(String articleId, List<Comment> comments);

    /** Appends a score snapshot. Snapshots are never updated. */
    void recordSnapshot(ScoreSnapshot snapshot);

    /**
     * Returns the snapshots of one article taken at or after
     * {@code sinceMillis}, oldest first.
     */
    List<ScoreSnapshot> getSnapshotHistory(String articleId, long sinceMillis);

    /**
     * Returns all snapshots taken at or after {@code sinceMillis}, grouped by
     * article and ordered by time within each article.
     */
    List<ScoreSnapshot> getSnapshotsSince(long sinceMillis);

    boolean exists(String articleId);

    /** Returns the stored article, or {@code null} if it was never stored. */
    Article getArticle(String articleId);

    /** Returns up to {@code limit} articles, highest score first. */
    List<Article> getArticles(int limit);

    List<String> getAllArticleIds();

    /**
     * Returns up to {@code limit} comments of an article ordered by depth,
     * then posting time.
     */
    List<Comment> getCommentsForArticle(String articleId, int limit);

    RepositoryStats getStats();
}
