package de.bsommerfeld.threadcrawler.crawler.fetch;

import java.util.List;

/**
 * Outcome of a single item fetch that did not fail. Failures are signalled
 * by {@link FetchFailedException} instead.
 */
public sealed interface FetchResult permits FetchResult.Found, FetchResult.NotFound {

    long itemId();

    /** The item exists and is alive. */
    record Found(Item item) implements FetchResult {

        @Override
        public long itemId() {
            return item.id();
        }
    }

    /**
     * The item does not exist, was deleted or is dead. Never retried.
     *
     * @param itemId    requested id
     * @param orphanIds child ids a deleted or dead item still reports, empty
     *                  for items that do not exist
     */
    record NotFound(long itemId, List<Long> orphanIds) implements FetchResult {

        public NotFound {
            orphanIds = orphanIds == null ? List.of() : List.copyOf(orphanIds);
        }

        public NotFound(long itemId) {
            this(itemId, List.of());
        }
    }
}
