package de.mirkosertic.mcp.ragsync.store;

/**
 * Base class of all failures reported by the {@link DocumentStore}.
 */
public class StoreException extends Exception {

    public StoreException(final String message) {
        super(message);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
