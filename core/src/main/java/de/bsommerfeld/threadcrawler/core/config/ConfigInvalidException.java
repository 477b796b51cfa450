package de.bsommerfeld.threadcrawler.core.config;

/**
 * Raised when the configuration cannot be loaded or violates a constraint.
 * Only ever fatal at startup; nothing in the crawl path catches it.
 */
public class ConfigInvalidException extends RuntimeException {

    public ConfigInvalidException(String message) {
        super(message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
