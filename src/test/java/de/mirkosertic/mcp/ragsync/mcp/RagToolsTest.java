package de.mirkosertic.mcp.ragsync.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.ragsync.api.RagCommand;
import de.mirkosertic.mcp.ragsync.api.RagCommandHandler;
import de.mirkosertic.mcp.ragsync.identity.DuplicateConsolidator;
import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import de.mirkosertic.mcp.ragsync.retrieval.RelevanceEngine;
import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.sync.WatchStateRepository;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the MCP tool layer on top of the command handler.
 */
@DisplayName("RagTools Tests")
class RagToolsTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private DocumentStore store;
    private RagTools tools;

    @BeforeEach
    void setUp() throws Exception {
        final IdentityResolver identityResolver = new IdentityResolver();
        store = DocumentStore.open(tempDir.resolve("store.json"), identityResolver);
        final RagCommandHandler handler = new RagCommandHandler(store, new RelevanceEngine(),
                new DuplicateConsolidator(store, identityResolver, WatchStateRepository.inMemory()),
                null, null, true);
        tools = new RagTools(handler, 5, SearchMode.HYBRID);
    }

    private static String text(final McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    @Test
    @DisplayName("Should register all tools with their schemas")
    void shouldRegisterTools() {
        assertThat(tools.getToolSpecifications())
                .extracting(McpServerFeatures.SyncToolSpecification::tool)
                .extracting(McpSchema.Tool::name)
                .containsExactly("rag_query", "rag_insert_text", "rag_status", "rag_delete", "rag_clear",
                        "rag_consolidate", "rag_statistics", "rag_sync_status", "rag_reconcile");
    }

    @Test
    @DisplayName("Should insert text and query it through the tools")
    void shouldInsertAndQuery() throws Exception {
        final McpSchema.CallToolResult inserted = tools.call("rag_insert_text",
                Map.of("text", "Caffeine backs the event history", "source", "notes"), RagCommand.Insert::fromMap);
        assertThat(inserted.isError()).isFalse();

        final McpSchema.CallToolResult queried = tools.call("rag_query",
                Map.of("query", "event history", "max_results", 3),
                args -> RagCommand.Query.fromMap(args, 5, SearchMode.HYBRID));

        assertThat(queried.isError()).isFalse();
        final JsonNode body = objectMapper.readTree(text(queried));
        assertThat(body.get("context").get(0).get("source").asText()).isEqualTo("notes");
    }

    @Test
    @DisplayName("Should return an error result for invalid arguments")
    void shouldReportInvalidArguments() throws Exception {
        final McpSchema.CallToolResult result = tools.call("rag_query", null,
                args -> RagCommand.Query.fromMap(args, 5, SearchMode.HYBRID));

        assertThat(result.isError()).isTrue();
        assertThat(objectMapper.readTree(text(result)).get("error").asText()).isEqualTo("Query must not be empty");
    }

    @Test
    @DisplayName("Should flag failed commands as errors")
    void shouldFlagFailedCommands() {
        final McpSchema.CallToolResult result = tools.call("rag_clear", Map.of(), RagCommand.Clear::fromMap);

        assertThat(result.isError()).isTrue();
        assertThat(store.status().documents()).isZero();
    }

    @Test
    @DisplayName("Should answer sync status as unavailable without file synchronization")
    void shouldReportSyncUnavailable() {
        final McpSchema.CallToolResult result = tools.call("rag_sync_status", Map.of(),
                args -> new RagCommand.SyncStatus());

        assertThat(result.isError()).isTrue();
        assertThat(text(result)).contains("not configured");
    }
}
