package de.mirkosertic.mcp.ragsync.store;

/**
 * Thrown when a document without content is inserted.
 */
public class EmptyContentException extends StoreException {

    public EmptyContentException() {
        super("Content must not be empty");
    }
}
