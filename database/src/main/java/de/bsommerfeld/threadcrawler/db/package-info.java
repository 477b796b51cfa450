/**
 * Persistence layer for crawled articles, comments and score history.
 * SQLite-backed in production, in-memory in TEST mode.
 *
 * <pre>
 *   [CrawlOrchestrator / TrendAnalyzer]
 *        |
 *        v
 *   ArticleRepository   write-through cache, single public entry point
 *        |
 *        v
 *   DatabaseService     interface (PROD / TEST swap via Guice)
 *    +---+---+
 *    |       |
 *  SqlDB   TestDB
 * </pre>
 *
 * <h2>Tables</h2>
 * <ul>
 * <li>{@code articles}: one row per article id, counters refreshed on every
 * crawl, {@code first_seen_at} set once</li>
 * <li>{@code comments}: primary key {@code (article_id, id)}, {@code parent_id}
 * is {@code NULL} for top-level comments</li>
 * <li>{@code score_snapshots}: append-only, primary key
 * {@code (article_id, taken_at)} in epoch milliseconds</li>
 * </ul>
 *
 * All statements live in {@code sql/*.sql} and are loaded via
 * {@link de.bsommerfeld.threadcrawler.db.SqlLoader}.
 */
package de.bsommerfeld.threadcrawler.db;
