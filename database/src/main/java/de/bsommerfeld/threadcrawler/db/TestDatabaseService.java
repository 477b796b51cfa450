package de.bsommerfeld.threadcrawler.db;

import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory {@link DatabaseService} for TEST mode. No disk I/O, no SQLite.
 * Mirrors the upsert semantics of {@link SqlDatabaseService}: counters are
 * overwritten, {@code null} attributes never blank a stored value, snapshots
 * with an already recorded key are ignored.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);

    private final Map<String, Article> articles = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Comment>> comments = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentSkipListMap<Long, ScoreSnapshot>> snapshots = new ConcurrentHashMap<>();

    public TestDatabaseService() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");
    }

    @Override
    public void upsertArticle(Article article) {
        articles.merge(article.id(), article, TestDatabaseService::mergeArticle);
    }

    private static Article mergeArticle(Article stored, Article incoming) {
        return new Article(
                stored.id(),
                incoming.title() != null ? incoming.title() : stored.title(),
                incoming.url() != null ? incoming.url() : stored.url(),
                incoming.domain() != null ? incoming.domain() : stored.domain(),
                incoming.score(),
                incoming.author() != null ? incoming.author() : stored.author(),
                stored.postedUtc(),
                incoming.commentCount(),
                incoming.storyText() != null ? incoming.storyText() : stored.storyText(),
                incoming.storyType(),
                incoming.fetchedAtUtc());
    }

    @Override
    public void upsertComments(String articleId, List<Comment> list) {
        if (list == null || list.isEmpty())
            return;
        for (Comment c : list) {
            if (!articleId.equals(c.articleId())) {
                throw new IllegalArgumentException(
                        "Comment " + c.id() + " belongs to article " + c.articleId() + ", not " + articleId);
            }
        }
        Map<String, Comment> store = comments.computeIfAbsent(articleId, id -> new ConcurrentHashMap<>());
        for (Comment c : list) {
            store.merge(c.id(), c, (stored, incoming) -> incoming.author() != null ? incoming
                    : new Comment(incoming.id(), incoming.articleId(), incoming.parentId(), stored.author(),
                            incoming.text(), incoming.postedUtc(), incoming.depth()));
        }
    }

    @Override
    public void recordSnapshot(ScoreSnapshot snapshot) {
        snapshots.computeIfAbsent(snapshot.articleId(), id -> new ConcurrentSkipListMap<>())
                .putIfAbsent(snapshot.takenAtMillis(), snapshot);
    }

    @Override
    public List<ScoreSnapshot> getSnapshotHistory(String articleId, long sinceMillis) {
        ConcurrentSkipListMap<Long, ScoreSnapshot> history = snapshots.get(articleId);
        if (history == null)
            return new ArrayList<>();
        return new ArrayList<>(history.tailMap(sinceMillis, true).values());
    }

    @Override
    public List<ScoreSnapshot> getSnapshotsSince(long sinceMillis) {
        List<ScoreSnapshot> result = new ArrayList<>();
        snapshots.keySet().stream().sorted().forEach(id -> result.addAll(getSnapshotHistory(id, sinceMillis)));
        return result;
    }

    @Override
    public boolean exists(String articleId) {
        return articles.containsKey(articleId);
    }

    @Override
    public Article getArticle(String articleId) {
        return articles.get(articleId);
    }

    @Override
    public List<Article> getArticles(int limit) {
        return articles.values().stream()
                .sorted(Comparator.comparingInt(Article::score).reversed().thenComparing(Article::id))
                .limit(limit)
                .toList();
    }

    @Override
    public List<String> getAllArticleIds() {
        return new ArrayList<>(articles.keySet());
    }

    @Override
    public List<Comment> getCommentsForArticle(String articleId, int limit) {
        Map<String, Comment> store = comments.get(articleId);
        if (store == null)
            return new ArrayList<>();
        return store.values().stream()
                .sorted(Comparator.comparingInt(Comment::depth)
                        .thenComparingLong(Comment::postedUtc)
                        .thenComparing(Comment::id))
                .limit(limit)
                .toList();
    }

    @Override
    public RepositoryStats getStats() {
        long commentCount = comments.values().stream().mapToLong(Map::size).sum();
        long snapshotCount = snapshots.values().stream().mapToLong(Map::size).sum();
        return new RepositoryStats(articles.size(), commentCount, snapshotCount);
    }
}
