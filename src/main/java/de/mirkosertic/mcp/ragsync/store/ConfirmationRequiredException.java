package de.mirkosertic.mcp.ragsync.store;

/**
 * Thrown when a destructive operation is invoked without explicit confirmation.
 */
public class ConfirmationRequiredException extends StoreException {

    public ConfirmationRequiredException() {
        super("Confirmation required");
    }
}
