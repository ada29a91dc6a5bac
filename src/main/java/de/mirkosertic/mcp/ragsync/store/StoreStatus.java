package de.mirkosertic.mcp.ragsync.store;

/**
 * Document count and last modification time of the store.
 */
public record StoreStatus(int documents, String lastUpdated) {
}
