package de.mirkosertic.mcp.ragsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One retrieved document inside a {@link QueryResponse}.
 */
public record ContextEntry(
        String content,
        String source,
        @JsonProperty("document_id") String documentId,
        double relevance
) {
}
