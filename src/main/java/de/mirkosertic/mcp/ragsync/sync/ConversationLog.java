package de.mirkosertic.mcp.ragsync.sync;

import org.jspecify.annotations.Nullable;

/**
 * What the {@link ConversationLogScanner} learned about a log file.
 */
public record ConversationLog(
        @Nullable String sessionId,
        /** Text of the first summary record, if the log has one. */
        @Nullable String summary,
        int lineCount,
        int messageCount,
        /** Lines that were not valid JSON and were skipped. */
        int malformedLines
) {
}
