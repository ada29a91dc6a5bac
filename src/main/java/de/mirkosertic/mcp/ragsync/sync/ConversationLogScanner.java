package de.mirkosertic.mcp.ragsync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Reads the JSON-lines structure of conversation logs: the session id, the summary record and the number of
 * messages. A line that does not parse is counted and skipped; it never stops the rest of the file.
 * Files that are not JSON-lines are only counted.
 */
public class ConversationLogScanner {

    private static final Logger logger = LoggerFactory.getLogger(ConversationLogScanner.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ConversationLog scan(final String fileName, final String content) {
        final String[] lines = content.split("\\R");
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".jsonl")) {
            return new ConversationLog(null, null, countNonBlank(lines), 0, 0);
        }

        String sessionId = null;
        String summary = null;
        int lineCount = 0;
        int messageCount = 0;
        int malformed = 0;

        for (final String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            lineCount++;
            final JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (final JsonProcessingException e) {
                malformed++;
                logger.debug("Skipping malformed line {} in {}: {}", lineCount, fileName, e.getOriginalMessage());
                continue;
            }
            if (node == null || !node.isObject()) {
                malformed++;
                continue;
            }
            if (sessionId == null) {
                sessionId = textOrNull(node, "sessionId");
            }
            if (summary == null && "summary".equals(textOrNull(node, "type"))) {
                summary = textOrNull(node, "summary");
            }
            if (node.hasNonNull("message")) {
                messageCount++;
            }
        }

        if (malformed > 0) {
            logger.warn("Skipped {} malformed lines in {}", malformed, fileName);
        }
        return new ConversationLog(sessionId, summary, lineCount, messageCount, malformed);
    }

    private static String textOrNull(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static int countNonBlank(final String[] lines) {
        int count = 0;
        for (final String line : lines) {
            if (!line.isBlank()) {
                count++;
            }
        }
        return count;
    }
}
