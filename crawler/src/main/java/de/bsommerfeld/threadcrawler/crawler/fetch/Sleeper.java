package de.bsommerfeld.threadcrawler.crawler.fetch;

/**
 * Pause primitive used between retry attempts. Replaced in tests to record
 * the backoff schedule without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
