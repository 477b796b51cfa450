package de.bsommerfeld.threadcrawler.crawler;

import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.util.StopSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Traversal semantics of the comment tree crawler: caps, orphan handling,
 * failure isolation and parallel prefetch.
 */
class CommentTreeCrawlerTest {

    private final FakeItemFetcher fetcher = new FakeItemFetcher();
    private final StopSignal stopSignal = new StopSignal();
    private final List<CommentTreeCrawler> created = new ArrayList<>();

    @AfterEach
    void tearDown() {
        created.forEach(CommentTreeCrawler::shutdown);
    }

    // -- Reference Scenario --

    @Test
    void crawl_shouldEmitExpectedCommentsForReferenceTree() {
        fetcher.comment(1, "one", 4L, 5L, 6L)
                .deleted(2)
                .comment(3, "three")
                .comment(4, "four")
                .comment(5, "five")
                .comment(6, "six");

        CommentCrawlResult result = crawler(1, 2, 10, 1).crawl("100", List.of(1L, 2L, 3L));

        assertEquals(List.of("1", "4", "5", "3"), ids(result.comments()));
        assertEquals(1, result.droppedNodes());
        assertFalse(result.truncated());
        assertFalse(fetcher.requested().contains(6L), "breadth-capped child must not be fetched");
    }

    @Test
    void crawl_shouldAnnotateParentAndDepth() {
        fetcher.comment(1, "one", 4L).comment(4, "four", 7L).comment(7, "seven");

        List<Comment> comments = crawler(4, 15, 200, 1).crawl("100", List.of(1L)).comments();

        assertNull(comments.get(0).parentId());
        assertEquals(0, comments.get(0).depth());
        assertEquals("1", comments.get(1).parentId());
        assertEquals(1, comments.get(1).depth());
        assertEquals("4", comments.get(2).parentId());
        assertEquals(2, comments.get(2).depth());
        comments.forEach(c -> assertEquals("100", c.articleId()));
    }

    // -- Caps --

    @Test
    void crawl_shouldNeverEmitMoreThanBudgetAndStopFetching() {
        List<Long> roots = new ArrayList<>();
        for (long id = 1; id <= 50; id++) {
            fetcher.comment(id, "c" + id);
            roots.add(id);
        }

        CommentCrawlResult result = crawler(4, 15, 7, 1).crawl("100", roots);

        assertEquals(7, result.size());
        assertTrue(result.truncated());
        assertEquals(7, fetcher.requested().size(), "no fetch may be issued once the budget is spent");
    }

    @Test
    void crawl_shouldExpandAtMostMaxChildrenPerNode() {
        fetcher.comment(1, "root", 10L, 11L, 12L, 13L, 14L);
        for (long id = 10; id <= 14; id++)
            fetcher.comment(id, "child" + id);

        CommentCrawlResult result = crawler(4, 3, 200, 1).crawl("100", List.of(1L));

        assertEquals(List.of("1", "10", "11", "12"), ids(result.comments()));
    }

    @Test
    void crawl_shouldKeepDepthWithinCapAndConsistentWithParents() {
        // chain 1 -> 2 -> 3 -> ... -> 10
        for (long id = 1; id < 10; id++)
            fetcher.comment(id, "c" + id, id + 1);
        fetcher.comment(10, "c10");

        CommentCrawlResult result = crawler(3, 15, 200, 1).crawl("100", List.of(1L));

        Map<String, Comment> byId = new HashMap<>();
        result.comments().forEach(c -> byId.put(c.id(), c));
        for (Comment c : result.comments()) {
            assertTrue(c.depth() <= 3);
            if (c.parentId() == null) {
                assertEquals(0, c.depth());
            } else {
                assertEquals(byId.get(c.parentId()).depth() + 1, c.depth());
            }
        }
        assertEquals(4, result.size());
        assertFalse(fetcher.requested().contains(5L), "depth is checked before fetching");
    }

    @Test
    void crawl_shouldOnlyFetchTopLevelWithZeroDepth() {
        fetcher.comment(1, "one", 2L).comment(2, "two");

        CommentCrawlResult result = crawler(0, 15, 200, 1).crawl("100", List.of(1L));

        assertEquals(List.of("1"), ids(result.comments()));
        assertEquals(List.of(1L), fetcher.requested());
    }

    @Test
    void crawl_shouldReturnEmptyResultForNoRoots() {
        CommentCrawlResult result = crawler(4, 15, 200, 1).crawl("100", List.of());

        assertTrue(result.comments().isEmpty());
        assertTrue(fetcher.requested().isEmpty());
    }

    // -- Orphans & Failures --

    @Test
    void crawl_shouldWalkRepliesOfDeletedComment() {
        fetcher.deleted(1, 2L).comment(2, "live reply");

        CommentCrawlResult result = crawler(4, 15, 200, 1).crawl("100", List.of(1L));

        assertEquals(List.of("2"), ids(result.comments()));
        assertEquals("1", result.comments().get(0).parentId());
        assertEquals(1, result.comments().get(0).depth());
    }

    @Test
    void crawl_shouldDropTextlessCommentButKeepChildren() {
        fetcher.comment(1, "   ", 2L).comment(2, "reply");

        CommentCrawlResult result = crawler(4, 15, 200, 1).crawl("100", List.of(1L));

        assertEquals(List.of("2"), ids(result.comments()));
        assertEquals(1, result.droppedNodes());
    }

    @Test
    void crawl_shouldIsolateFailedSubtree() {
        fetcher.comment(1, "one", 2L, 3L)
                .comment(2, "two", 20L)
                .comment(20, "unreachable")
                .comment(3, "three", 30L)
                .comment(30, "cousin")
                .comment(4, "sibling")
                .failing(2);

        CommentCrawlResult result = crawler(4, 15, 200, 1).crawl("100", List.of(1L, 4L));

        assertEquals(List.of("1", "3", "30", "4"), ids(result.comments()));
        assertEquals(1, result.fetchFailures());
    }

    @Test
    void crawl_shouldCleanAndTruncateText() {
        fetcher.comment(1, "<p>Tom &amp; Jerry " + "x".repeat(50));

        Comment comment = new CommentTreeCrawler(fetcher, new ItemNormalizer(12, 2000), stopSignal, 4, 15, 200,
                1, 1).crawl("100", List.of(1L)).comments().get(0);

        assertEquals("Tom & Jerry ", comment.text());
    }

    @Test
    void crawl_shouldStopWhenSignalled() {
        fetcher.comment(1, "one").comment(2, "two");
        stopSignal.requestStop();

        CommentCrawlResult result = crawler(4, 15, 200, 1).crawl("100", List.of(1L, 2L));

        assertTrue(result.cancelled());
        assertTrue(result.comments().isEmpty());
    }

    // -- Parallel Prefetch --

    @Test
    void crawl_withFanOut_shouldProduceSameCommentsInSameOrder() {
        List<Long> roots = buildWideTree();

        List<Comment> sequential = crawler(3, 4, 500, 1).crawl("100", roots).comments();
        List<Comment> parallel = crawler(3, 4, 500, 4).crawl("100", roots).comments();

        assertEquals(sequential, parallel);
        Set<String> unique = new HashSet<>(ids(parallel));
        assertEquals(parallel.size(), unique.size(), "each comment exactly once");
    }

    @Test
    void crawl_withFanOut_shouldStillHonorBudget() {
        List<Long> roots = buildWideTree();

        CommentCrawlResult result = crawler(3, 4, 9, 4).crawl("100", roots);

        assertEquals(9, result.size());
        assertTrue(result.truncated());
        assertEquals(ids(crawler(3, 4, 9, 1).crawl("100", roots).comments()), ids(result.comments()));
    }

    // -- Helpers --

    private List<Long> buildWideTree() {
        List<Long> roots = new ArrayList<>();
        long next = 1000;
        for (long r = 1; r <= 5; r++) {
            List<Long> kids = new ArrayList<>();
            for (int k = 0; k < 4; k++) {
                long child = next++;
                long grandChild = next++;
                fetcher.comment(grandChild, "gc" + grandChild);
                fetcher.comment(child, "c" + child, grandChild);
                kids.add(child);
            }
            fetcher.comment(r, "r" + r, kids.toArray(new Long[0]));
            roots.add(r);
        }
        fetcher.deleted(3, 1000L);
        return roots;
    }

    private CommentTreeCrawler crawler(int maxDepth, int maxChildren, int maxTotal, int fanOut) {
        CommentTreeCrawler crawler = new CommentTreeCrawler(fetcher, new ItemNormalizer(1000, 2000), stopSignal,
                maxDepth, maxChildren, maxTotal, fanOut, fanOut);
        created.add(crawler);
        return crawler;
    }

    private static List<String> ids(List<Comment> comments) {
        return comments.stream().map(Comment::id).toList();
    }
}
