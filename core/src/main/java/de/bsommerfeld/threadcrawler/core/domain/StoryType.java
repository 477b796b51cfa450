package de.bsommerfeld.threadcrawler.core.domain;

/**
 * Classification of a listed article as reported (or implied) by the source
 * forum.
 */
public enum StoryType {
    STORY,
    ASK,
    JOB,
    POLL;

    /**
     * Maps the forum's raw item type to a story type. Self posts whose title
     * starts with {@code Ask HN} are reported as plain stories upstream and are
     * promoted to {@link #ASK} here.
     *
     * @param rawType the upstream {@code type} field, may be {@code null}
     * @param title   article title, may be {@code null}
     * @param url     article url, {@code null} for self posts
     */
    public static StoryType classify(String rawType, String title, String url) {
        if ("job".equals(rawType)) {
            return JOB;
        }
        if ("poll".equals(rawType)) {
            return POLL;
        }
        if ((url == null || url.isBlank()) && title != null && title.startsWith("Ask HN")) {
            return ASK;
        }
        return STORY;
    }
}
