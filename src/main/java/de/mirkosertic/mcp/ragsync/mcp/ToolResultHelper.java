package de.mirkosertic.mcp.ragsync.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.mcp.ragsync.api.CommandResult;
import de.mirkosertic.mcp.ragsync.api.dto.SimpleMessageResponse;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders command results as MCP tool results: the body as JSON text, flagged as error for any
 * non-success status.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult fromCommandResult(final CommandResult result) {
        return textResult(toJson(result.body()), !result.isSuccess());
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        return textResult(toJson(SimpleMessageResponse.error(errorMessage)), true);
    }

    static String toJson(final Object body) {
        try {
            return OBJECT_MAPPER.writeValueAsString(body);
        } catch (final JsonProcessingException e) {
            logger.error("Cannot serialize tool result of type {}", body.getClass().getName(), e);
            return "{\"success\":false,\"error\":\"Result serialization failed\"}";
        }
    }

    private static McpSchema.CallToolResult textResult(final String json, final boolean isError) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(json)))
                .isError(isError)
                .build();
    }
}
