package de.bsommerfeld.threadcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persistence settings. An empty path places the SQLite file in the
 * application data directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("path")
    private String path = "";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
