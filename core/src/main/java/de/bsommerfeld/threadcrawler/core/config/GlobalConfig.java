package de.bsommerfeld.threadcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each field maps to one TOML table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("api")
    private ApiConfig api = new ApiConfig();

    @JsonProperty("crawl")
    private CrawlSettings crawl = new CrawlSettings();

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public ApiConfig getApi() {
        return api;
    }

    public CrawlSettings getCrawl() {
        return crawl;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }
}
