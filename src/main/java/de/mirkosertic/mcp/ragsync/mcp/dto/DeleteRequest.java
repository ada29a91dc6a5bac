package de.mirkosertic.mcp.ragsync.mcp.dto;

import de.mirkosertic.mcp.ragsync.mcp.Description;

/**
 * Arguments of the rag_delete tool.
 */
public record DeleteRequest(
        @Description("Id of the document to delete, as returned by rag_query or rag_insert_text.")
        String id
) {
}
