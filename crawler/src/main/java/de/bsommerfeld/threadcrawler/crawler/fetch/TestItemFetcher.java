package de.bsommerfeld.threadcrawler.crawler.fetch;

import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.config.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Offline {@link ItemFetcher} that replaces the HTTP stack in TEST mode.
 *
 * <h3>No network access</h3>
 * A forest of {@value #ARTICLE_COUNT} articles with nested comment trees is
 * generated once from a fixed seed, so every run sees the same structure.
 * Roughly one comment in twenty is deleted but keeps its replies, which
 * exercises the crawler's orphan handling.
 *
 * <h3>Simulated activity</h3>
 * Every listing request bumps article scores and comment counts by a
 * per-article amount, so consecutive runs produce snapshot deltas for the
 * trend analysis.
 */
@Singleton
public class TestItemFetcher implements ItemFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(TestItemFetcher.class);

    private static final int ARTICLE_COUNT = 40;
    private static final long FIRST_ARTICLE_ID = 40_000_000L;
    private static final int MAX_GENERATED_DEPTH = 6;

    private static final String[] TITLES = { "Show HN: A tiny SQLite-backed job queue",
            "Ask HN: How do you review large pull requests?", "The hidden cost of microservices",
            "Why we moved back to a monolith", "Rust in the Linux kernel: one year later",
            "A visual guide to consistent hashing", "Postgres as a message broker",
            "Ask HN: What are you working on this month?", "Understanding the JVM's garbage collectors",
            "We replaced our CDN with a single server" };
    private static final String[] DOMAINS = { "https://github.com/example/project", "https://blog.example.org/post",
            "https://www.example.com/article", "https://lwn.net/Articles/1" };
    private static final String[] AUTHORS = { "pg", "dang", "tptacek", "patio11", "throwaway42", "jdoe",
            "kernel_hacker", "sqlfan" };
    private static final String[] COMMENTS = {
            "This matches my experience &mdash; the operational overhead is real.",
            "<p>Counterpoint: at our scale it was the only option.<p>We tried the alternative first.",
            "Has anyone benchmarked this against <i>Redis</i>?",
            "The article glosses over failure modes.",
            "I&#x27;d love to see the numbers behind this claim.",
            "We did exactly this in 2019, happy to answer questions.",
            "<a href=\"https://example.com\">Relevant link</a> with more background." };

    private final Map<Long, Item> items = new ConcurrentHashMap<>();
    private final List<Long> articleIds = new ArrayList<>();
    private final AtomicInteger listingCalls = new AtomicInteger();
    private long nextCommentId = FIRST_ARTICLE_ID + 1_000;

    public TestItemFetcher() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Serving synthetic forum items   #");
        LOG.warn("#######################################################");
        generate(new Random(42));
        LOG.info("Generated {} synthetic items across {} articles", items.size(), articleIds.size());
    }

    @Override
    public FetchResult fetch(long itemId) {
        Item item = items.get(itemId);
        if (item == null)
            return new FetchResult.NotFound(itemId);
        if (item.isGone())
            return new FetchResult.NotFound(itemId, item.kids());
        if (articleIds.contains(itemId))
            return new FetchResult.Found(withActivity(item));
        return new FetchResult.Found(item);
    }

    @Override
    public List<Long> fetchListing(Listing listing) {
        listingCalls.incrementAndGet();
        List<Long> ranked = new ArrayList<>(articleIds);
        ranked.sort(Comparator.comparingInt((Long id) -> withActivity(items.get(id)).score()).reversed());
        return ranked;
    }

    /** Applies the simulated growth for the current number of listing calls. */
    private Item withActivity(Item article) {
        int rounds = listingCalls.get();
        int growth = (int) (article.id() % 7) + 1;
        return new Item(article.id(), article.type(), article.by(), article.time(), article.text(),
                article.score() + rounds * growth * 3, article.title(), article.url(), article.parent(),
                article.kids(), article.deleted(), article.dead(), article.descendants() + rounds * growth);
    }

    // =====================================================================
    // Generation
    // =====================================================================

    private void generate(Random rnd) {
        long now = System.currentTimeMillis() / 1000;
        for (int i = 0; i < ARTICLE_COUNT; i++) {
            long id = FIRST_ARTICLE_ID + i;
            String title = TITLES[i % TITLES.length];
            boolean selfPost = title.startsWith("Ask HN");
            String url = selfPost ? null : DOMAINS[rnd.nextInt(DOMAINS.length)] + "/" + id;
            String text = selfPost ? "<p>Curious how others approach this.<p>Details in the comments." : null;

            int topLevel = rnd.nextInt(9);
            List<Long> kids = new ArrayList<>();
            AtomicInteger descendants = new AtomicInteger();
            for (int k = 0; k < topLevel; k++) {
                kids.add(generateComment(rnd, id, 1, now, descendants));
            }

            String type = i % 13 == 12 ? "job" : "story";
            items.put(id, new Item(id, type, pick(rnd, AUTHORS), now - rnd.nextInt(86_400), text,
                    1 + rnd.nextInt(400), title, url, null, kids, false, false, descendants.get()));
            articleIds.add(id);
        }
    }

    private long generateComment(Random rnd, long parentId, int level, long now, AtomicInteger descendants) {
        long id = nextCommentId++;
        descendants.incrementAndGet();

        List<Long> kids = new ArrayList<>();
        if (level < MAX_GENERATED_DEPTH) {
            int replies = rnd.nextInt(Math.max(1, 5 - level));
            for (int r = 0; r < replies; r++) {
                kids.add(generateComment(rnd, id, level + 1, now, descendants));
            }
        }

        boolean deleted = rnd.nextInt(20) == 0;
        String text = deleted ? null : pick(rnd, COMMENTS);
        String author = deleted ? null : pick(rnd, AUTHORS);
        items.put(id, new Item(id, "comment", author, now - rnd.nextInt(3_600), text, 0, null, null, parentId,
                kids, deleted, false, 0));
        return id;
    }

    private static String pick(Random rnd, String[] pool) {
        return pool[rnd.nextInt(pool.length)];
    }
}
