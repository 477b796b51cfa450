package de.bsommerfeld.threadcrawler.crawler.fetch;

import de.bsommerfeld.threadcrawler.core.config.Listing;

import java.util.List;

/**
 * Single fetch primitive of the crawler. Implementations are stacked as
 * decorators: {@link RetryingItemFetcher} around {@link RateLimitedItemFetcher}
 * around {@link HttpItemFetcher}. All implementations are thread-safe.
 */
public interface ItemFetcher {

    /** Id used in {@link FetchFailedException} for listing requests. */
    long LISTING_ID = -1;

    /**
     * Fetches one item by id.
     *
     * @return {@link FetchResult.Found} or {@link FetchResult.NotFound}
     * @throws FetchFailedException if the item could not be retrieved
     */
    FetchResult fetch(long itemId) throws FetchFailedException;

    /**
     * Fetches the ranked id list of a listing, best first.
     *
     * @throws FetchFailedException if the listing could not be retrieved
     */
    List<Long> fetchListing(Listing listing) throws FetchFailedException;
}
