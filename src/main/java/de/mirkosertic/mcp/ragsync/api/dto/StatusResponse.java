package de.mirkosertic.mcp.ragsync.api.dto;

/**
 * Liveness and size of the knowledge base.
 */
public record StatusResponse(
        String status,
        int documents,
        String lastUpdated
) {
    public static StatusResponse online(final int documents, final String lastUpdated) {
        return new StatusResponse("online", documents, lastUpdated);
    }
}
