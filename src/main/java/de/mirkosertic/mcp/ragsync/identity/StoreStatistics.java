package de.mirkosertic.mcp.ragsync.identity;

import java.util.Map;

/**
 * Size and identity breakdown of the store.
 *
 * @param sources document count per source, most frequent first
 */
public record StoreStatistics(
        int totalDocuments,
        String lastUpdated,
        int conversationIdCount,
        int documentIdCount,
        double averageDocumentSize,
        int largestDocument,
        int smallestDocument,
        Map<String, Integer> sources
) {
}
