package de.mirkosertic.mcp.ragsync.api.dto;

/**
 * Response of the insert operation.
 */
public record InsertResponse(
        boolean success,
        String documentId,
        String error
) {
    public static InsertResponse success(final String documentId) {
        return new InsertResponse(true, documentId, null);
    }

    public static InsertResponse error(final String errorMessage) {
        return new InsertResponse(false, null, errorMessage);
    }
}
