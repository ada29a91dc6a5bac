package de.mirkosertic.mcp.ragsync.retrieval;

import de.mirkosertic.mcp.ragsync.store.Document;

/**
 * A ranked document with its relevance in [0, 1].
 */
public record ScoredDocument(Document document, double score) {
}
