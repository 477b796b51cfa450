package de.bsommerfeld.threadcrawler.db;

/**
 * Row counts of the persistent store.
 */
public record RepositoryStats(long articles, long comments, long snapshots) {

    public static final RepositoryStats EMPTY = new RepositoryStats(0, 0, 0);
}
