package de.mirkosertic.mcp.ragsync.api.dto;

import java.util.List;

/**
 * All stored documents, as served to a peer instance that uses this server as its downstream index.
 */
public record DocumentListResponse(
        List<DocumentSummary> documents,
        int count
) {
}
