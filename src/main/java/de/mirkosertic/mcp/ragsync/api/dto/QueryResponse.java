package de.mirkosertic.mcp.ragsync.api.dto;

import java.util.List;

/**
 * Answer to a query: a short response line plus the retrieved context, best match first.
 */
public record QueryResponse(
        String response,
        List<ContextEntry> context
) {
}
