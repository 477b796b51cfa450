package de.bsommerfeld.threadcrawler.crawler.fetch;

import de.bsommerfeld.threadcrawler.core.config.Listing;

import java.util.List;

/**
 * Passes every request through a shared {@link RateLimiter} before handing
 * it to the wrapped fetcher. Sitting below the retry layer, each retry
 * attempt consumes its own slot.
 */
public class RateLimitedItemFetcher implements ItemFetcher {

    private final ItemFetcher delegate;
    private final RateLimiter rateLimiter;

    public RateLimitedItemFetcher(ItemFetcher delegate, RateLimiter rateLimiter) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public FetchResult fetch(long itemId) throws FetchFailedException {
        awaitSlot(itemId);
        return delegate.fetch(itemId);
    }

    @Override
    public List<Long> fetchListing(Listing listing) throws FetchFailedException {
        awaitSlot(LISTING_ID);
        return delegate.fetchListing(listing);
    }

    private void awaitSlot(long itemId) throws FetchFailedException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchFailedException(itemId, "Interrupted while waiting for a request slot", e, false);
        }
    }
}
