package de.mirkosertic.mcp.ragsync.mcp.dto;

import de.mirkosertic.mcp.ragsync.mcp.Description;

/**
 * Arguments of the rag_clear tool.
 */
public record ClearRequest(
        @Description("Must be true. Removes every document after writing a backup of the store file.")
        boolean confirm
) {
}
