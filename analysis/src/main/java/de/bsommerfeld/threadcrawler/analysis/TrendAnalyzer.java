package de.bsommerfeld.threadcrawler.analysis;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;
import de.bsommerfeld.threadcrawler.db.ArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives growth figures from the append-only score snapshots.
 *
 * <h3>Ordering</h3>
 * Trending lists are sorted by score increase, then comment increase (both
 * descending), then article id ascending, so equal inputs always produce the
 * same list. Articles observed only once inside the window have no delta and
 * are left out. Shrinking scores are reported as negative increases rather
 * than filtered.
 */
@Singleton
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    /** Default list length of {@link #computeTrending(int, int)} callers. */
    public static final int DEFAULT_LIMIT = 20;

    static final Comparator<TrendingArticle> TRENDING_ORDER = Comparator
            .comparingInt(TrendingArticle::scoreIncrease).reversed()
            .thenComparing(Comparator.comparingInt(TrendingArticle::commentIncrease).reversed())
            .thenComparing(TrendingArticle::articleId);

    private static final Comparator<ScoreSnapshot> BY_TIME = Comparator.comparingLong(ScoreSnapshot::takenAtMillis);

    private final ArticleRepository repository;
    private final Clock clock;

    @Inject
    public TrendAnalyzer(ArticleRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Every article with at least two snapshots in the last
     * {@code windowHours}, growth measured from the earliest to the latest
     * of them.
     *
     * @throws IllegalArgumentException if {@code windowHours} is not positive
     */
    public List<TrendingArticle> computeTrending(int windowHours) {
        if (windowHours <= 0)
            throw new IllegalArgumentException("Window must be positive: " + windowHours + "h");

        long since = clock.millis() - Duration.ofHours(windowHours).toMillis();
        Map<String, List<ScoreSnapshot>> byArticle = groupByArticle(repository.getSnapshotsSince(since));

        List<TrendingArticle> trending = new ArrayList<>();
        for (Map.Entry<String, List<ScoreSnapshot>> entry : byArticle.entrySet()) {
            List<ScoreSnapshot> snapshots = entry.getValue();
            if (snapshots.size() < 2)
                continue;
            snapshots.sort(BY_TIME);
            trending.add(delta(entry.getKey(), snapshots.get(0), snapshots.get(snapshots.size() - 1),
                    snapshots.size()));
        }
        trending.sort(TRENDING_ORDER);

        LOG.debug("{} of {} articles trending within {}h", trending.size(), byArticle.size(), windowHours);
        return trending;
    }

    /** Top {@code limit} entries of {@link #computeTrending(int)}. */
    public List<TrendingArticle> computeTrending(int windowHours, int limit) {
        List<TrendingArticle> all = computeTrending(windowHours);
        return all.size() > limit ? List.copyOf(all.subList(0, Math.max(0, limit))) : all;
    }

    /**
     * Growth between the two most recent snapshots of one article.
     *
     * @return empty if fewer than two snapshots exist
     */
    public Optional<TrendingArticle> latestDelta(String articleId) {
        List<ScoreSnapshot> snapshots = history(articleId);
        if (snapshots.size() < 2)
            return Optional.empty();
        return Optional.of(delta(articleId, snapshots.get(snapshots.size() - 2),
                snapshots.get(snapshots.size() - 1), 2));
    }

    /** All snapshots of one article, oldest first. */
    public List<ScoreSnapshot> history(String articleId) {
        List<ScoreSnapshot> snapshots = new ArrayList<>(repository.getSnapshotHistory(articleId, 0));
        snapshots.sort(BY_TIME);
        return snapshots;
    }

    private TrendingArticle delta(String articleId, ScoreSnapshot earliest, ScoreSnapshot latest, int count) {
        Article article = repository.getArticle(articleId);
        return new TrendingArticle(articleId, article == null ? null : article.title(),
                earliest.score(), latest.score(),
                latest.score() - earliest.score(),
                latest.commentCount() - earliest.commentCount(),
                count);
    }

    private static Map<String, List<ScoreSnapshot>> groupByArticle(List<ScoreSnapshot> snapshots) {
        Map<String, List<ScoreSnapshot>> grouped = new LinkedHashMap<>();
        for (ScoreSnapshot s : snapshots) {
            grouped.computeIfAbsent(s.articleId(), k -> new ArrayList<>()).add(s);
        }
        return grouped;
    }
}
