package de.bsommerfeld.threadcrawler.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Write-through caching layer over {@link DatabaseService}.
 *
 * <p>
 * This is the single point of access for persisted crawl data. The crawler,
 * the orchestrator and the trend analyzer never talk to
 * {@code DatabaseService} directly.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li><strong>Writes</strong>: the article cache is updated on the caller's
 * thread, then the DB write is queued on a dedicated single-thread executor.
 * Every write returns a {@link CompletableFuture} that completes
 * exceptionally with the {@link RepositoryException} if the store rejects it;
 * a failed article write evicts the cache entry again.</li>
 * <li><strong>Reads</strong>: {@link #exists} and {@link #getArticle} are
 * served from the cache when possible, everything else goes to the store.</li>
 * </ul>
 */
@Singleton
public class ArticleRepository {

    private static final Logger LOG = LoggerFactory.getLogger(ArticleRepository.class);

    private final DatabaseService databaseService;
    private final ExecutorService dbExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "db-writer");
        t.setDaemon(true);
        return t;
    });

    private final Map<String, Article> articleCache = new ConcurrentHashMap<>();

    @Inject
    public ArticleRepository(DatabaseService databaseService) {
        this.databaseService = databaseService;
    }

    /**
     * Loads all stored article ids so that {@link #exists} can answer without
     * touching the store for articles seen in earlier runs.
     */
    public void warmup() {
        LOG.info("Warming up ArticleRepository cache...");
        int loaded = 0;
        for (String id : databaseService.getAllArticleIds()) {
            Article article = databaseService.getArticle(id);
            if (article != null) {
                articleCache.put(id, article);
                loaded++;
            }
        }
        LOG.info("Cache warmed with {} articles.", loaded);
    }

    /**
     * Drains pending writes (up to 30s), then stops the DB executor.
     */
    public void shutdown() {
        LOG.info("Shutting down ArticleRepository...");
        dbExecutor.shutdown();
        try {
            if (!dbExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                dbExecutor.shutdownNow();
                LOG.warn("ArticleRepository forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            dbExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // -- Writes (Async Write-Through) --

    public CompletableFuture<Void> upsertArticle(Article article) {
        articleCache.put(article.id(), article);
        return CompletableFuture.runAsync(() -> databaseService.upsertArticle(article), dbExecutor)
                .whenComplete((ok, error) -> {
                    if (error != null) {
                        articleCache.remove(article.id(), article);
                    }
                });
    }

    public CompletableFuture<Void> upsertComments(String articleId, List<Comment> comments) {
        if (comments == null || comments.isEmpty())
            return CompletableFuture.completedFuture(null);
        List<Comment> copy = List.copyOf(comments);
        return CompletableFuture.runAsync(() -> databaseService.upsertComments(articleId, copy), dbExecutor);
    }

    public CompletableFuture<Void> recordSnapshot(ScoreSnapshot snapshot) {
        return CompletableFuture.runAsync(() -> databaseService.recordSnapshot(snapshot), dbExecutor);
    }

    // -- Reads --

    public boolean exists(String articleId) {
        if (articleCache.containsKey(articleId))
            return true;
        return databaseService.exists(articleId);
    }

    /** Returns the article from cache or store, {@code null} if unknown. */
    public Article getArticle(String articleId) {
        Article cached = articleCache.get(articleId);
        if (cached != null)
            return cached;
        Article stored = databaseService.getArticle(articleId);
        if (stored != null)
            articleCache.put(articleId, stored);
        return stored;
    }

    public List<Article> getArticles(int limit) {
        return databaseService.getArticles(limit);
    }

    public List<Comment> getCommentsForArticle(String articleId, int limit) {
        return databaseService.getCommentsForArticle(articleId, limit);
    }

    public List<ScoreSnapshot> getSnapshotHistory(String articleId, long sinceMillis) {
        return databaseService.getSnapshotHistory(articleId, sinceMillis);
    }

    public List<ScoreSnapshot> getSnapshotsSince(long sinceMillis) {
        return databaseService.getSnapshotsSince(sinceMillis);
    }

    public RepositoryStats getStats() {
        return databaseService.getStats();
    }
}
