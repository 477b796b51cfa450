package de.bsommerfeld.threadcrawler.core.util;

import com.google.inject.Singleton;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by every stage of a crawl run.
 * Workers poll {@link #isStopRequested()} between units of work; nothing is
 * interrupted forcibly.
 */
@Singleton
public class StopSignal {

    private final AtomicBoolean stopped = new AtomicBoolean();

    public void requestStop() {
        stopped.set(true);
    }

    public boolean isStopRequested() {
        return stopped.get();
    }

    /** Clears the flag so the same signal can guard a subsequent run. */
    public void reset() {
        stopped.set(false);
    }
}
