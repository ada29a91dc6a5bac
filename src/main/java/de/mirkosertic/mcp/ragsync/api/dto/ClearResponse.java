package de.mirkosertic.mcp.ragsync.api.dto;

/**
 * Response of the clear operation. {@code backup} names the backup file when one was written.
 */
public record ClearResponse(
        boolean success,
        String message,
        String backup,
        String error
) {
    public static ClearResponse success(final String message, final String backup) {
        return new ClearResponse(true, message, backup, null);
    }

    public static ClearResponse error(final String errorMessage) {
        return new ClearResponse(false, null, null, errorMessage);
    }
}
