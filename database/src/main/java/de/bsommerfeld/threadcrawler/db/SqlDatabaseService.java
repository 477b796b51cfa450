package de.bsommerfeld.threadcrawler.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.config.ConfigLoader;
import de.bsommerfeld.threadcrawler.core.config.DatabaseConfig;
import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;
import de.bsommerfeld.threadcrawler.core.domain.StoryType;
import de.bsommerfeld.threadcrawler.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS}, so re-running it is harmless.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, and the single-threaded
 * executor in {@link ArticleRepository} serializes them on the Java side.
 *
 * <h3>Upsert semantics</h3>
 * Articles and comments use {@code INSERT ... ON CONFLICT DO UPDATE}. The
 * conflict clause keeps {@code first_seen_at} and {@code posted_utc} and
 * uses {@code COALESCE} so a missing attribute in a later crawl does not
 * erase a known one. Snapshots use {@code INSERT OR IGNORE}: a second write
 * with the same {@code (article_id, taken_at)} key leaves the first intact.
 *
 * @see SqlLoader
 * @see ArticleRepository
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);
    private final String dbUrl;

    @Inject
    public SqlDatabaseService(DatabaseConfig config) {
        this(resolveDatabaseFile(config));
    }

    public SqlDatabaseService(Path dbFile) {
        Path parent = dbFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
        initialize();
    }

    private static Path resolveDatabaseFile(DatabaseConfig config) {
        String configured = config.getPath();
        if (configured == null || configured.isBlank()) {
            return StorageUtils.getDefaultDatabaseFile(ConfigLoader.APP_NAME);
        }
        return Path.of(configured);
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Database initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time, inside
     * a single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql");
                Statement stmt = conn.createStatement()) {

            if (schemaStream == null) {
                throw new SQLException("schema.sql not found on classpath");
            }

            String schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            conn.setAutoCommit(false);
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = stripComments(sql);
                if (statement.isEmpty())
                    continue;
                stmt.execute(statement);
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (IOException | SQLException e) {
            if (!conn.getAutoCommit())
                conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (!line.trim().startsWith("--"))
                sb.append(line).append('\n');
        }
        return sb.toString().trim();
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public void upsertArticle(Article article) {
        long now = Instant.now().getEpochSecond();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-article"))) {
            ps.setString(1, article.id());
            ps.setString(2, article.title());
            ps.setString(3, article.url());
            ps.setString(4, article.domain());
            ps.setInt(5, article.score());
            ps.setString(6, article.author());
            ps.setLong(7, article.postedUtc());
            ps.setInt(8, article.commentCount());
            ps.setString(9, article.storyText());
            ps.setString(10, article.storyType().name());
            ps.setLong(11, article.fetchedAtUtc());
            ps.setLong(12, now);
            ps.setLong(13, now);
            ps.executeUpdate();
            LOG.debug("[DB] Upserted article {}", article.id());
        } catch (SQLException e) {
            throw new RepositoryException(article.id(), "Failed to upsert article " + article.id(), e);
        }
    }

    @Override
    public void upsertComments(String articleId, List<Comment> comments) {
        if (comments == null || comments.isEmpty())
            return;
        for (Comment c : comments) {
            if (!articleId.equals(c.articleId())) {
                throw new IllegalArgumentException(
                        "Comment " + c.id() + " belongs to article " + c.articleId() + ", not " + articleId);
            }
        }

        long now = Instant.now().getEpochSecond();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-comment"))) {
                for (Comment c : comments) {
                    bindComment(ps, c, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.debug("[DB] Upserted {} comments for article {}", comments.size(), articleId);
        } catch (SQLException e) {
            throw new RepositoryException(articleId, "Failed to upsert comments of article " + articleId, e);
        }
    }

    private void bindComment(PreparedStatement ps, Comment c, long now) throws SQLException {
        ps.setString(1, c.articleId());
        ps.setString(2, c.id());
        ps.setString(3, c.parentId());
        ps.setString(4, c.author());
        ps.setString(5, c.text());
        ps.setLong(6, c.postedUtc());
        ps.setInt(7, c.depth());
        ps.setLong(8, now);
    }

    @Override
    public void recordSnapshot(ScoreSnapshot snapshot) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-snapshot"))) {
            ps.setString(1, snapshot.articleId());
            ps.setLong(2, snapshot.takenAtMillis());
            ps.setInt(3, snapshot.score());
            ps.setInt(4, snapshot.commentCount());
            if (snapshot.rank() != null) {
                ps.setInt(5, snapshot.rank());
            } else {
                ps.setNull(5, Types.INTEGER);
            }
            if (ps.executeUpdate() == 0) {
                LOG.debug("[DB] Snapshot {}@{} already recorded", snapshot.articleId(), snapshot.takenAtMillis());
            }
        } catch (SQLException e) {
            throw new RepositoryException(snapshot.articleId(),
                    "Failed to record snapshot for article " + snapshot.articleId(), e);
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public List<ScoreSnapshot> getSnapshotHistory(String articleId, long sinceMillis) {
        List<ScoreSnapshot> list = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-snapshot-history"))) {
            ps.setString(1, articleId);
            ps.setLong(2, sinceMillis);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    list.add(mapSnapshot(rs));
            }
        } catch (SQLException e) {
            LOG.error("Failed to load snapshot history for {}", articleId, e);
        }
        return list;
    }

    @Override
    public List<ScoreSnapshot> getSnapshotsSince(long sinceMillis) {
        List<ScoreSnapshot> list = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-snapshots-since"))) {
            ps.setLong(1, sinceMillis);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    list.add(mapSnapshot(rs));
            }
        } catch (SQLException e) {
            LOG.error("Failed to load snapshots since {}", sinceMillis, e);
        }
        return list;
    }

    @Override
    public boolean exists(String articleId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("exists-article"))) {
            ps.setString(1, articleId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            LOG.error("Failed to check existence of article {}", articleId, e);
            return false;
        }
    }

    @Override
    public Article getArticle(String articleId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-article"))) {
            ps.setString(1, articleId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    return mapArticle(rs);
            }
        } catch (SQLException e) {
            LOG.error("Failed to load article {}", articleId, e);
        }
        return null;
    }

    @Override
    public List<Article> getArticles(int limit) {
        List<Article> list = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-articles-by-score"))) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    list.add(mapArticle(rs));
            }
        } catch (SQLException e) {
            LOG.error("Failed to load articles", e);
        }
        return list;
    }

    @Override
    public List<String> getAllArticleIds() {
        List<String> ids = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-article-ids"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                ids.add(rs.getString(1));
        } catch (SQLException e) {
            LOG.error("Failed to load article ids", e);
            return Collections.emptyList();
        }
        return ids;
    }

    @Override
    public List<Comment> getCommentsForArticle(String articleId, int limit) {
        List<Comment> list = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-comments-for-article"))) {
            ps.setString(1, articleId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    list.add(mapComment(rs));
            }
        } catch (SQLException e) {
            LOG.error("Failed to load comments for article {}", articleId, e);
        }
        return list;
    }

    @Override
    public RepositoryStats getStats() {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-stats"));
                ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return new RepositoryStats(rs.getLong(1), rs.getLong(2), rs.getLong(3));
            }
        } catch (SQLException e) {
            LOG.error("Failed to load repository stats", e);
        }
        return RepositoryStats.EMPTY;
    }

    // =====================================================================
    // ResultSet Mappers
    // =====================================================================

    private Article mapArticle(ResultSet rs) throws SQLException {
        return new Article(
                rs.getString("id"),
                rs.getString("title"),
                rs.getString("url"),
                rs.getString("domain"),
                rs.getInt("score"),
                rs.getString("author"),
                rs.getLong("posted_utc"),
                rs.getInt("comment_count"),
                rs.getString("story_text"),
                StoryType.valueOf(rs.getString("story_type")),
                rs.getLong("fetched_at"));
    }

    private Comment mapComment(ResultSet rs) throws SQLException {
        return new Comment(
                rs.getString("id"),
                rs.getString("article_id"),
                rs.getString("parent_id"),
                rs.getString("author"),
                rs.getString("text"),
                rs.getLong("posted_utc"),
                rs.getInt("depth"));
    }

    private ScoreSnapshot mapSnapshot(ResultSet rs) throws SQLException {
        int rank = rs.getInt("rank");
        Integer nullableRank = rs.wasNull() ? null : rank;
        return new ScoreSnapshot(
                rs.getString("article_id"),
                rs.getLong("taken_at"),
                rs.getInt("score"),
                rs.getInt("comment_count"),
                nullableRank);
    }
}
