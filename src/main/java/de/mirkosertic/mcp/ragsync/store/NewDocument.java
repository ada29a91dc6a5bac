package de.mirkosertic.mcp.ragsync.store;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Insert request for the {@link DocumentStore}. When {@code id} is null the store asks its
 * identity resolver for one.
 */
public record NewDocument(
        @Nullable String id,
        String content,
        @Nullable String source,
        @Nullable String summary,
        @Nullable Map<String, Object> metadata
) {

    public static NewDocument of(final String content, final String source) {
        return new NewDocument(null, content, source, null, null);
    }
}
