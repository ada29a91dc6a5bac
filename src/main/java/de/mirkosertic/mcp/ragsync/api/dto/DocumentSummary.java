package de.mirkosertic.mcp.ragsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.mcp.ragsync.store.Document;

/**
 * Listing entry for a stored document, without its content.
 */
public record DocumentSummary(
        String id,
        String source,
        String summary,
        String created,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("content_hash") String contentHash
) {
    public static DocumentSummary of(final Document document) {
        return new DocumentSummary(document.id(), document.source(), document.summary(), document.created(),
                document.filePath(), document.contentHash());
    }
}
