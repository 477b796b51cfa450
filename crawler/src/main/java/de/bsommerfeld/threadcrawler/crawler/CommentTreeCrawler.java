package de.bsommerfeld.threadcrawler.crawler;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadcrawler.core.config.CrawlConfig;
import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.util.StopSignal;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchFailedException;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchResult;
import de.bsommerfeld.threadcrawler.crawler.fetch.Item;
import de.bsommerfeld.threadcrawler.crawler.fetch.ItemFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks an article's comment tree and flattens it into depth-annotated
 * {@link Comment} records under hard caps.
 *
 * <h3>Traversal</h3>
 * Iterative depth-first search over an explicit stack of
 * {@code (id, parentId, depth)} frames, so adversarially deep trees cannot
 * overflow the call stack. For each frame:
 * <ol>
 * <li>Stop if the per-article {@link CommentBudget} is exhausted or a stop was
 * requested. Nothing further is fetched.</li>
 * <li>Fetch the item. A {@link FetchFailedException} drops this subtree
 * only.</li>
 * <li>Missing, deleted, dead or textless items emit nothing, but their child
 * ids are still walked: a deleted comment may have live replies.</li>
 * <li>Items with text are cleaned, truncated and emitted.</li>
 * <li>The first {@code maxChildrenPerNode} child ids are pushed, provided
 * their depth does not exceed {@code maxDepth}. Depth is checked before a
 * frame is pushed and again before it is fetched.</li>
 * </ol>
 * The article's root id list is walked completely (bounded by the budget); the
 * breadth cap applies to the children of fetched nodes.
 *
 * <h3>Sibling prefetch</h3>
 * With {@code subtreeFanOut > 1} the frames on top of the stack are fetched
 * ahead of time on a bounded pool while all decisions stay on the traversal
 * thread. Emission order and content are therefore identical to a sequential
 * run. Prefetches still pending when the budget runs out are cancelled; a
 * prefetch that already completed is simply discarded.
 */
@Singleton
public class CommentTreeCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(CommentTreeCrawler.class);

    private final ItemFetcher fetcher;
    private final ItemNormalizer normalizer;
    private final StopSignal stopSignal;

    private final int maxDepth;
    private final int maxChildrenPerNode;
    private final int maxTotalComments;
    private final int fanOut;
    private final ExecutorService prefetchPool;

    @Inject
    public CommentTreeCrawler(ItemFetcher fetcher, CrawlConfig config, StopSignal stopSignal) {
        this(fetcher, new ItemNormalizer(config.maxCommentLength(), config.maxStoryTextLength()), stopSignal,
                config.maxCommentDepth(), config.maxChildrenPerNode(), config.maxCommentsPerArticle(),
                config.subtreeFanOut(), config.subtreeFanOut() * config.concurrency());
    }

    CommentTreeCrawler(ItemFetcher fetcher, ItemNormalizer normalizer, StopSignal stopSignal, int maxDepth,
            int maxChildrenPerNode, int maxTotalComments, int fanOut, int prefetchThreads) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.stopSignal = stopSignal;
        this.maxDepth = maxDepth;
        this.maxChildrenPerNode = maxChildrenPerNode;
        this.maxTotalComments = maxTotalComments;
        this.fanOut = fanOut;
        this.prefetchPool = fanOut > 1 ? Executors.newFixedThreadPool(prefetchThreads, prefetchThreadFactory())
                : null;
    }

    private static ThreadFactory prefetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "comment-prefetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Crawls the comment tree below an article.
     *
     * @param articleId id of the owning article
     * @param rootIds   the article's direct child ids in upstream order
     */
    public CommentCrawlResult crawl(String articleId, List<Long> rootIds) {
        if (rootIds == null || rootIds.isEmpty())
            return CommentCrawlResult.EMPTY;

        CommentBudget budget = new CommentBudget(maxTotalComments);
        TraversalStats stats = new TraversalStats();
        List<Comment> emitted = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        pushChildren(stack, rootIds, rootIds.size(), null, 0);

        try {
            while (!stack.isEmpty()) {
                if (budget.isExhausted()) {
                    stats.truncated = true;
                    break;
                }
                if (stopSignal.isStopRequested() || Thread.currentThread().isInterrupted()) {
                    stats.cancelled = true;
                    break;
                }

                Frame frame = stack.pop();
                if (frame.depth > maxDepth || !seen.add(frame.id)) {
                    frame.cancel();
                    continue;
                }
                prefetchAhead(stack);
                visit(articleId, frame, stack, budget, stats, emitted);
            }
        } finally {
            stack.forEach(Frame::cancel);
        }

        if (stats.truncated) {
            LOG.debug("Article {}: comment budget of {} exhausted, tree truncated", articleId, budget.limit());
        }
        LOG.debug("Article {}: {} comments, {} dropped, {} failed", articleId, emitted.size(), stats.dropped,
                stats.failures);
        return new CommentCrawlResult(emitted, stats.failures, stats.dropped, stats.truncated, stats.cancelled);
    }

    private void visit(String articleId, Frame frame, Deque<Frame> stack, CommentBudget budget,
            TraversalStats stats, List<Comment> emitted) {
        FetchResult result;
        try {
            result = frame.resolve(fetcher);
        } catch (FetchFailedException e) {
            stats.failures++;
            LOG.warn("Article {}: skipping subtree of comment {}: {}", articleId, frame.id, e.getMessage());
            return;
        }

        List<Long> childIds;
        if (result instanceof FetchResult.Found found) {
            Item item = found.item();
            Comment comment = normalizer.toComment(item, articleId, frame.parentId, frame.depth);
            if (comment != null && budget.tryConsume()) {
                emitted.add(comment);
            } else {
                stats.dropped++;
            }
            childIds = item.kids();
        } else {
            stats.dropped++;
            childIds = ((FetchResult.NotFound) result).orphanIds();
        }

        pushChildren(stack, childIds, maxChildrenPerNode, String.valueOf(frame.id), frame.depth + 1);
    }

    /**
     * Pushes the first {@code limit} ids in reverse, so the first id is
     * popped first. Children deeper than {@code maxDepth} are never pushed.
     */
    private void pushChildren(Deque<Frame> stack, List<Long> ids, int limit, String parentId, int depth) {
        if (ids.isEmpty() || depth > maxDepth)
            return;
        int taken = Math.min(limit, ids.size());
        for (int i = taken - 1; i >= 0; i--) {
            stack.push(new Frame(ids.get(i), parentId, depth));
        }
    }

    /** Starts fetches for the next {@code fanOut - 1} frames on the stack. */
    private void prefetchAhead(Deque<Frame> stack) {
        if (prefetchPool == null)
            return;
        Iterator<Frame> it = stack.iterator();
        for (int i = 0; i < fanOut - 1 && it.hasNext(); i++) {
            Frame next = it.next();
            if (next.prefetch == null && next.depth <= maxDepth) {
                next.prefetch = prefetchPool.submit(() -> fetcher.fetch(next.id));
            }
        }
    }

    /** Stops the prefetch pool, if any. */
    public void shutdown() {
        if (prefetchPool == null)
            return;
        prefetchPool.shutdownNow();
        try {
            if (!prefetchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Comment prefetch pool did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // =====================================================================
    // Traversal State
    // =====================================================================

    private static final class Frame {
        final long id;
        final String parentId;
        final int depth;
        Future<FetchResult> prefetch;

        Frame(long id, String parentId, int depth) {
            this.id = id;
            this.parentId = parentId;
            this.depth = depth;
        }

        FetchResult resolve(ItemFetcher fetcher) throws FetchFailedException {
            if (prefetch == null)
                return fetcher.fetch(id);
            try {
                return prefetch.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                prefetch.cancel(true);
                throw new FetchFailedException(id, "Interrupted while waiting for prefetch", e, false);
            } catch (CancellationException e) {
                throw new FetchFailedException(id, "Prefetch was cancelled", e, false);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof FetchFailedException failed)
                    throw failed;
                throw new FetchFailedException(id, "Prefetch failed: " + e.getCause(), e.getCause(), false);
            }
        }

        void cancel() {
            if (prefetch != null)
                prefetch.cancel(true);
        }
    }

    private static final class TraversalStats {
        int failures;
        int dropped;
        boolean truncated;
        boolean cancelled;
    }
}
