package de.bsommerfeld.threadcrawler.crawler.fetch;

import de.bsommerfeld.threadcrawler.core.config.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Retries retryable {@link FetchFailedException}s with exponential backoff.
 *
 * <p>
 * Attempt {@code n} (0-based) is followed by a pause of
 * {@code min(baseDelay * 2^n, maxDelay)}. After {@code maxRetries} retries the
 * last failure is rethrown. Non-retryable failures and {@link FetchResult}s of
 * any kind, including {@link FetchResult.NotFound}, are returned or rethrown
 * immediately.
 */
public class RetryingItemFetcher implements ItemFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingItemFetcher.class);

    private final ItemFetcher delegate;
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    public RetryingItemFetcher(ItemFetcher delegate, int maxRetries, long baseDelayMs, long maxDelayMs) {
        this(delegate, maxRetries, baseDelayMs, maxDelayMs, Sleeper.THREAD);
    }

    public RetryingItemFetcher(ItemFetcher delegate, int maxRetries, long baseDelayMs, long maxDelayMs,
            Sleeper sleeper) {
        this.delegate = delegate;
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.sleeper = sleeper;
    }

    @Override
    public FetchResult fetch(long itemId) throws FetchFailedException {
        return withRetry(itemId, () -> delegate.fetch(itemId));
    }

    @Override
    public List<Long> fetchListing(Listing listing) throws FetchFailedException {
        return withRetry(LISTING_ID, () -> delegate.fetchListing(listing));
    }

    private <T> T withRetry(long itemId, Attempt<T> attempt) throws FetchFailedException {
        for (int n = 0;; n++) {
            try {
                return attempt.run();
            } catch (FetchFailedException e) {
                if (!e.isRetryable() || n >= maxRetries) {
                    if (e.isRetryable()) {
                        LOG.warn("Giving up on item {} after {} attempts: {}", itemId, n + 1, e.getMessage());
                    }
                    throw e;
                }
                long delay = backoffMillis(n);
                LOG.debug("Attempt {} for item {} failed ({}), retrying in {}ms", n + 1, itemId, e.getMessage(),
                        delay);
                pause(itemId, delay, e);
            }
        }
    }

    /** {@code min(base * 2^attempt, max)} without overflowing. */
    long backoffMillis(int attempt) {
        if (baseDelayMs == 0)
            return 0;
        int shift = Math.min(attempt, 30);
        long delay = baseDelayMs << shift;
        if (delay < 0 || (delay >> shift) != baseDelayMs)
            return maxDelayMs;
        return Math.min(delay, maxDelayMs);
    }

    private void pause(long itemId, long delay, FetchFailedException lastError) throws FetchFailedException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            FetchFailedException interrupted = new FetchFailedException(itemId,
                    "Interrupted during retry backoff", e, false);
            interrupted.addSuppressed(lastError);
            throw interrupted;
        }
    }

    @FunctionalInterface
    private interface Attempt<T> {
        T run() throws FetchFailedException;
    }
}
