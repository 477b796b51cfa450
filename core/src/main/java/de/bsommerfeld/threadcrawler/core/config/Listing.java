package de.bsommerfeld.threadcrawler.core.config;

import java.util.Locale;

/**
 * Ranked id listings offered by the forum API. Each constant maps to the
 * endpoint stem, e.g. {@code topstories} for {@code /topstories.json}.
 */
public enum Listing {

    TOP("topstories"),
    BEST("beststories"),
    NEW("newstories"),
    ASK("askstories"),
    SHOW("showstories"),
    JOB("jobstories");

    private final String endpoint;

    Listing(String endpoint) {
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    /**
     * Accepts either the endpoint stem ({@code topstories}) or the constant
     * name ({@code top}), case-insensitively.
     *
     * @throws ConfigInvalidException if the value names no known listing
     */
    public static Listing parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigInvalidException("Listing must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Listing listing : values()) {
            if (listing.endpoint.equals(normalized) || listing.name().equalsIgnoreCase(normalized)) {
                return listing;
            }
        }
        throw new ConfigInvalidException("Unknown listing '" + value + "'");
    }
}
