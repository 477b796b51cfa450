package de.bsommerfeld.threadcrawler.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

import java.util.regex.Pattern;

/**
 * Turns the API's HTML fragments into plain text: tags are stripped,
 * paragraph breaks kept as blank lines, entities unescaped and whitespace
 * collapsed.
 */
public final class TextCleaner {

    private static final Pattern PARAGRAPH = Pattern.compile("(?i)<p\\s*/?>");
    private static final Pattern LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\s*\\n\\s*\\n\\s*");
    private static final Document.OutputSettings RAW_OUTPUT = new Document.OutputSettings().prettyPrint(false);

    private TextCleaner() {
    }

    /**
     * @return the plain text, or {@code null} if nothing but markup and
     *         whitespace remains
     */
    public static String clean(String html) {
        if (html == null || html.isBlank())
            return null;

        String marked = LINE_BREAK.matcher(PARAGRAPH.matcher(html).replaceAll("\n\n")).replaceAll("\n");
        String stripped = Jsoup.clean(marked, "", Safelist.none(), RAW_OUTPUT);
        String text = Parser.unescapeEntities(stripped, false);

        text = INLINE_WHITESPACE.matcher(text).replaceAll(" ");
        text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
        text = text.trim();
        return text.isEmpty() ? null : text;
    }

    /** Cuts {@code text} to at most {@code maxLength} characters. */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength)
            return text;
        int end = maxLength;
        // never split a surrogate pair
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1)))
            end--;
        return text.substring(0, end);
    }

    public static String cleanAndTruncate(String html, int maxLength) {
        return truncate(clean(html), maxLength);
    }
}
