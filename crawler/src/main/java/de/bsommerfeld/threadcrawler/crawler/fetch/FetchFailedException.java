package de.bsommerfeld.threadcrawler.crawler.fetch;

/**
 * A fetch could not be completed. {@link #isRetryable()} tells the retry
 * layer whether another attempt may succeed (timeouts, I/O errors, 5xx, 429)
 * or not (other 4xx, malformed payloads, interruption).
 */
public class FetchFailedException extends Exception {

    private final long itemId;
    private final boolean retryable;

    public FetchFailedException(long itemId, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.itemId = itemId;
        this.retryable = retryable;
    }

    public FetchFailedException(long itemId, String message, boolean retryable) {
        this(itemId, message, null, retryable);
    }

    /** The item id, or {@code -1} when a listing fetch failed. */
    public long getItemId() {
        return itemId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
