package de.mirkosertic.mcp.ragsync.api.dto;

/**
 * Simple response DTO for operations that return just a success/message.
 * Used for delete and as the generic error body.
 */
public record SimpleMessageResponse(
        boolean success,
        String message,
        String error
) {
    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
