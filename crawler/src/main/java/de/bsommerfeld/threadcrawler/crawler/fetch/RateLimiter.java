package de.bsommerfeld.threadcrawler.crawler.fetch;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval between consecutive upstream requests across
 * all threads.
 *
 * <p>
 * Callers queue on a fair lock, so slots are granted in arrival order. The
 * holder of the lock waits until its slot is due, books the next slot one
 * interval later and releases the lock. Waiting while holding the lock is
 * what keeps the queue strictly FIFO and the spacing exact.
 */
public class RateLimiter {

    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock(true);

    private long nextSlotNanos;

    public RateLimiter(long intervalMillis) {
        this(intervalMillis, System::nanoTime);
    }

    RateLimiter(long intervalMillis, LongSupplier nanoClock) {
        if (intervalMillis < 0)
            throw new IllegalArgumentException("Interval must not be negative: " + intervalMillis);
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(intervalMillis);
        this.nanoClock = nanoClock;
        this.nextSlotNanos = nanoClock.getAsLong();
    }

    /**
     * Blocks until the caller's request slot is due.
     *
     * @throws InterruptedException if interrupted while queued or waiting;
     *                              the slot is not consumed in that case
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long waitNanos = nextSlotNanos - nanoClock.getAsLong();
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
            long now = nanoClock.getAsLong();
            nextSlotNanos = Math.max(now, nextSlotNanos) + intervalNanos;
        } finally {
            lock.unlock();
        }
    }

    public long getIntervalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }
}
