package de.mirkosertic.mcp.ragsync.sync;

import org.jspecify.annotations.Nullable;

/**
 * A document as listed by the downstream served index.
 */
public record ServedDocument(String id, @Nullable String filePath) {
}
