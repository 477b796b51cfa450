package de.bsommerfeld.threadcrawler.db;

/**
 * A write against the persistent store failed. Carries the id of the entity
 * that could not be written so callers can report it.
 */
public class RepositoryException extends RuntimeException {

    private final String entityId;

    public RepositoryException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
