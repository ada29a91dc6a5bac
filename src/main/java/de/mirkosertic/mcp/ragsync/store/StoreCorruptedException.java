package de.mirkosertic.mcp.ragsync.store;

import java.nio.file.Path;

/**
 * The persisted store file exists but cannot be decoded. The store refuses to start
 * so that the file can be inspected instead of being overwritten with an empty collection.
 */
public class StoreCorruptedException extends StoreException {

    public StoreCorruptedException(final Path storeFile, final Throwable cause) {
        super("Store file " + storeFile + " is corrupted: " + cause.getMessage(), cause);
    }
}
