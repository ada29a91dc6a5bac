package de.mirkosertic.mcp.ragsync.api;

import de.mirkosertic.mcp.ragsync.api.dto.SimpleMessageResponse;

/**
 * Transport neutral outcome of a {@link RagCommand}: an HTTP style status and the response body that
 * gets serialized to JSON.
 */
public record CommandResult(int status, Object body) {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_ERROR = 500;
    public static final int UNAVAILABLE = 503;

    public static CommandResult ok(final Object body) {
        return new CommandResult(OK, body);
    }

    public static CommandResult badRequest(final String message) {
        return new CommandResult(BAD_REQUEST, SimpleMessageResponse.error(message));
    }

    public boolean isSuccess() {
        return status < 400;
    }
}
