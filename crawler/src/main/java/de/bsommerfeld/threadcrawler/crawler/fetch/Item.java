package de.bsommerfeld.threadcrawler.crawler.fetch;

import java.util.List;

/**
 * Raw item as returned by the forum API. Articles and comments share this
 * shape and one id space; which fields are populated depends on {@code type}.
 * Timestamps are Unix epoch seconds.
 *
 * @param id          numeric item id
 * @param type        {@code story}, {@code comment}, {@code job}, {@code poll}
 *                    or {@code pollopt}
 * @param by          author username, {@code null} for deleted items
 * @param time        creation timestamp in epoch seconds
 * @param text        HTML body, {@code null} if absent
 * @param score       points, 0 for comments
 * @param title       title of stories, jobs and polls
 * @param url         linked url of stories, {@code null} for self posts
 * @param parent      parent item id for comments, {@code null} otherwise
 * @param kids        direct child ids in ranked order, never {@code null}
 * @param deleted     set by the API for deleted items
 * @param dead        set by the API for flagged items
 * @param descendants total comment count of stories and polls
 */
public record Item(
        long id,
        String type,
        String by,
        long time,
        String text,
        int score,
        String title,
        String url,
        Long parent,
        List<Long> kids,
        boolean deleted,
        boolean dead,
        int descendants) {

    public Item {
        kids = kids == null ? List.of() : List.copyOf(kids);
    }

    public boolean isGone() {
        return deleted || dead;
    }
}
