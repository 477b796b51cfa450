package de.bsommerfeld.threadcrawler.app;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the command line in TEST mode against the synthetic item source.
 */
class CrawlerMainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private Path configFile;

    @BeforeEach
    void setUp() {
        System.setProperty("app.mode", "TEST");
        configFile = tempDir.resolve("config.toml");
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("app.mode");
    }

    @Test
    void crawl_shouldRunFullPageAndPrintSummary() {
        int exit = CrawlerMain.run(new String[] { "--config", configFile.toString(), "crawl" }, out);

        assertEquals(CrawlerMain.EXIT_OK, exit);
        assertTrue(output().contains("topstories: 30 listed, 30 crawled"), output());
        assertTrue(Files.exists(configFile), "defaults are written on first start");
    }

    @Test
    void crawl_shouldBeDefaultCommand() {
        assertEquals(CrawlerMain.EXIT_OK, CrawlerMain.run(new String[] { "--config", configFile.toString() }, out));
    }

    @Test
    void run_shouldExitWithConfigCodeOnInvalidValues() throws Exception {
        Files.writeString(configFile, """
                [crawl]
                max-articles = 0
                """);

        assertEquals(CrawlerMain.EXIT_INVALID_CONFIG,
                CrawlerMain.run(new String[] { "--config", configFile.toString() }, out));
    }

    @Test
    void run_shouldExitWithConfigCodeOnMalformedFile() throws Exception {
        Files.writeString(configFile, "[crawl\nmax-articles = ");

        assertEquals(CrawlerMain.EXIT_INVALID_CONFIG,
                CrawlerMain.run(new String[] { "--config", configFile.toString(), "stats" }, out));
    }

    @Test
    void trending_shouldPrintHeaderForEmptyStore() {
        int exit = CrawlerMain.run(new String[] { "--config", configFile.toString(), "trending", "12", "5" }, out);

        assertEquals(CrawlerMain.EXIT_OK, exit);
        assertTrue(output().contains("Trending over the last 12h (0 articles)"), output());
    }

    @Test
    void stats_shouldPrintCounts() {
        assertEquals(CrawlerMain.EXIT_OK,
                CrawlerMain.run(new String[] { "--config", configFile.toString(), "stats" }, out));
        assertTrue(output().contains("articles 0, comments 0, snapshots 0"), output());
    }

    @Test
    void run_shouldPrintUsageForBadArguments() {
        assertEquals(CrawlerMain.EXIT_FAILURE,
                CrawlerMain.run(new String[] { "--config", configFile.toString(), "frobnicate" }, out));
        assertEquals(CrawlerMain.EXIT_FAILURE,
                CrawlerMain.run(new String[] { "--config", configFile.toString(), "history" }, out));
        assertEquals(CrawlerMain.EXIT_FAILURE,
                CrawlerMain.run(new String[] { "--config", configFile.toString(), "trending", "soon" }, out));
        assertEquals(CrawlerMain.EXIT_FAILURE, CrawlerMain.run(new String[] { "--config" }, out));
        assertTrue(output().contains("Usage:"));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
