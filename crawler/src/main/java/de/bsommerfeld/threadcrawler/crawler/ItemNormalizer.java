package de.bsommerfeld.threadcrawler.crawler;

import de.bsommerfeld.threadcrawler.core.domain.Article;
import de.bsommerfeld.threadcrawler.core.domain.Comment;
import de.bsommerfeld.threadcrawler.core.domain.StoryType;
import de.bsommerfeld.threadcrawler.crawler.fetch.Item;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts raw {@link Item}s into the normalized {@link Article} and
 * {@link Comment} records.
 */
public class ItemNormalizer {

    /** Domain assigned to self posts that link nowhere. */
    public static final String SELF_POST_DOMAIN = "news.ycombinator.com";
    static final String UNKNOWN_DOMAIN = "unknown";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxCommentLength;
    private final int maxStoryTextLength;

    public ItemNormalizer(int maxCommentLength, int maxStoryTextLength) {
        this.maxCommentLength = maxCommentLength;
        this.maxStoryTextLength = maxStoryTextLength;
    }

    public Article toArticle(Item item, long fetchedAtUtc) {
        String url = item.url() == null || item.url().isBlank() ? null : item.url();
        return new Article(
                String.valueOf(item.id()),
                plainTitle(item.title()),
                url,
                extractDomain(url),
                item.score(),
                item.by(),
                item.time(),
                item.descendants(),
                TextCleaner.cleanAndTruncate(item.text(), maxStoryTextLength),
                StoryType.classify(item.type(), item.title(), url),
                fetchedAtUtc);
    }

    /**
     * @param parentId {@code null} for top-level comments
     * @return the comment, or {@code null} if the item has no usable text
     */
    public Comment toComment(Item item, String articleId, String parentId, int depth) {
        String text = TextCleaner.cleanAndTruncate(item.text(), maxCommentLength);
        if (text == null)
            return null;
        return new Comment(String.valueOf(item.id()), articleId, parentId, item.by(), text, item.time(), depth);
    }

    /**
     * Titles arrive as plain text, not markup: angle brackets and ampersands
     * are literal. Only surrounding and repeated whitespace is normalized.
     */
    static String plainTitle(String title) {
        if (title == null)
            return null;
        String collapsed = WHITESPACE.matcher(title).replaceAll(" ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /**
     * Lower-cased host of {@code url} without a leading {@code www.}. Self
     * posts map to {@link #SELF_POST_DOMAIN}, unparsable urls to
     * {@code unknown}.
     */
    public static String extractDomain(String url) {
        if (url == null || url.isBlank())
            return SELF_POST_DOMAIN;
        try {
            String host = new URI(url.trim()).getHost();
            if (host == null || host.isEmpty())
                return UNKNOWN_DOMAIN;
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return UNKNOWN_DOMAIN;
        }
    }
}
