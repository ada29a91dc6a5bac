package de.mirkosertic.mcp.ragsync.mcp.dto;

import de.mirkosertic.mcp.ragsync.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Arguments of the rag_insert_text tool.
 */
public record InsertTextRequest(
        @Description("Text to store. Must not be empty.")
        String text,

        @Nullable
        @Description("Origin tag of the text. Default is 'manual'.")
        String source,

        @Nullable
        @Description("Short label shown in listings.")
        String summary,

        @Nullable
        @Description("Additional key/value pairs stored with the document.")
        Map<String, Object> metadata
) {
}
