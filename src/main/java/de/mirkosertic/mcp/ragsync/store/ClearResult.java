package de.mirkosertic.mcp.ragsync.store;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Outcome of {@link DocumentStore#clear(boolean, boolean)}.
 *
 * @param removedCount number of documents that were removed
 * @param backupPath   backup written before truncation, null when no backup was requested
 */
public record ClearResult(int removedCount, @Nullable Path backupPath) {
}
