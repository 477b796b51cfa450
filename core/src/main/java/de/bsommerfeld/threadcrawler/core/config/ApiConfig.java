package de.bsommerfeld.threadcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Upstream API endpoint settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://hacker-news.firebaseio.com/v0";

    @JsonProperty("user-agent")
    private String userAgent = "thread-crawler/1.0";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
