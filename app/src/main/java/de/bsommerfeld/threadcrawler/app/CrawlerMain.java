package de.bsommerfeld.threadcrawler.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.threadcrawler.analysis.TrendAnalyzer;
import de.bsommerfeld.threadcrawler.analysis.TrendingArticle;
import de.bsommerfeld.threadcrawler.app.config.CrawlerModule;
import de.bsommerfeld.threadcrawler.core.config.ApplicationMode;
import de.bsommerfeld.threadcrawler.core.config.ConfigInvalidException;
import de.bsommerfeld.threadcrawler.core.config.ConfigLoader;
import de.bsommerfeld.threadcrawler.core.config.GlobalConfig;
import de.bsommerfeld.threadcrawler.core.domain.ScoreSnapshot;
import de.bsommerfeld.threadcrawler.core.event.ApplicationEventBus;
import de.bsommerfeld.threadcrawler.core.util.StopSignal;
import de.bsommerfeld.threadcrawler.core.util.StorageUtils;
import de.bsommerfeld.threadcrawler.crawler.CommentTreeCrawler;
import de.bsommerfeld.threadcrawler.crawler.fetch.FetchFailedException;
import de.bsommerfeld.threadcrawler.db.ArticleRepository;
import de.bsommerfeld.threadcrawler.db.RepositoryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 *
 * <pre>
 * thread-crawler [--config &lt;file&gt;] [crawl]
 * thread-crawler [--config &lt;file&gt;] trending [hours] [limit]
 * thread-crawler [--config &lt;file&gt;] history &lt;articleId&gt;
 * thread-crawler [--config &lt;file&gt;] stats
 * </pre>
 */
public final class CrawlerMain {

    static {
        Path logDir = StorageUtils.getLogsDir(ConfigLoader.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CrawlerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    private static final int DEFAULT_TRENDING_HOURS = 24;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private CrawlerMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        List<String> commandArgs = new ArrayList<>();
        Path configPath = ConfigLoader.defaultLocation();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    out.println("--config requires a path");
                    return usage(out);
                }
                configPath = Path.of(args[++i]);
            } else {
                commandArgs.add(args[i]);
            }
        }
        String command = commandArgs.isEmpty() ? "crawl" : commandArgs.remove(0);

        Injector injector;
        try {
            GlobalConfig config = ConfigLoader.load(configPath);
            injector = Guice.createInjector(new CrawlerModule(config, ApplicationMode.get()));
        } catch (ConfigInvalidException e) {
            LOG.error("Invalid configuration: {}", e.getMessage(), e);
            out.println("Invalid configuration: " + e.getMessage());
            return EXIT_INVALID_CONFIG;
        }

        ArticleRepository repository = injector.getInstance(ArticleRepository.class);
        try {
            switch (command) {
                case "crawl":
                    return crawl(injector, repository, out);
                case "trending":
                    return trending(injector.getInstance(TrendAnalyzer.class), commandArgs, out);
                case "history":
                    return history(injector.getInstance(TrendAnalyzer.class), commandArgs, out);
                case "stats":
                    return stats(repository, out);
                default:
                    out.println("Unknown command: " + command);
                    return usage(out);
            }
        } finally {
            repository.shutdown();
        }
    }

    // =====================================================================
    // Commands
    // =====================================================================

    private static int crawl(Injector injector, ArticleRepository repository, PrintStream out) {
        StopSignal stopSignal = injector.getInstance(StopSignal.class);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            stopSignal.requestStop();
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "crawler-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        injector.getInstance(ApplicationEventBus.class).register(injector.getInstance(ProgressLogger.class));
        CommentTreeCrawler commentCrawler = injector.getInstance(CommentTreeCrawler.class);
        try {
            repository.warmup();
            RunSummary summary = injector.getInstance(CrawlOrchestrator.class).run();
            out.println(summary);
            return EXIT_OK;
        } catch (FetchFailedException e) {
            LOG.error("Listing could not be fetched", e);
            out.println("Crawl failed: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            commentCrawler.shutdown();
            finished.countDown();
            removeHook(hook);
        }
    }

    private static int trending(TrendAnalyzer analyzer, List<String> args, PrintStream out) {
        int hours;
        int limit;
        try {
            hours = args.size() > 0 ? Integer.parseInt(args.get(0)) : DEFAULT_TRENDING_HOURS;
            limit = args.size() > 1 ? Integer.parseInt(args.get(1)) : TrendAnalyzer.DEFAULT_LIMIT;
        } catch (NumberFormatException e) {
            out.println("Not a number: " + e.getMessage());
            return usage(out);
        }
        if (hours <= 0) {
            out.println("Window must be positive");
            return usage(out);
        }

        List<TrendingArticle> trending = analyzer.computeTrending(hours, limit);
        out.printf("Trending over the last %dh (%d articles)%n", hours, trending.size());
        trending.forEach(out::println);
        return EXIT_OK;
    }

    private static int history(TrendAnalyzer analyzer, List<String> args, PrintStream out) {
        if (args.isEmpty()) {
            out.println("history requires an article id");
            return usage(out);
        }
        String articleId = args.get(0);
        List<ScoreSnapshot> history = analyzer.history(articleId);
        out.printf("%d snapshots of %s%n", history.size(), articleId);
        for (ScoreSnapshot s : history) {
            out.printf("%s  score %5d  comments %5d  rank %s%n", Instant.ofEpochMilli(s.takenAtMillis()),
                    s.score(), s.commentCount(), s.rank() == null ? "-" : s.rank());
        }
        return EXIT_OK;
    }

    private static int stats(ArticleRepository repository, PrintStream out) {
        RepositoryStats stats = repository.getStats();
        out.printf("articles %d, comments %d, snapshots %d%n", stats.articles(), stats.comments(),
                stats.snapshots());
        return EXIT_OK;
    }

    private static int usage(PrintStream out) {
        out.println("Usage: thread-crawler [--config <file>] [crawl | trending [hours] [limit] "
                + "| history <articleId> | stats]");
        return EXIT_FAILURE;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down, the hook is running
            LOG.debug("Shutdown in progress, keeping hook");
        }
    }
}
