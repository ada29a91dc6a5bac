package de.mirkosertic.mcp.ragsync.mcp;

import de.mirkosertic.mcp.ragsync.api.CommandResult;
import de.mirkosertic.mcp.ragsync.api.RagCommand;
import de.mirkosertic.mcp.ragsync.api.RagCommandHandler;
import de.mirkosertic.mcp.ragsync.mcp.dto.ClearRequest;
import de.mirkosertic.mcp.ragsync.mcp.dto.ConsolidateRequest;
import de.mirkosertic.mcp.ragsync.mcp.dto.DeleteRequest;
import de.mirkosertic.mcp.ragsync.mcp.dto.InsertTextRequest;
import de.mirkosertic.mcp.ragsync.mcp.dto.QueryRequest;
import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * MCP tools over the knowledge base. Each tool parses its arguments into a {@link RagCommand} and runs
 * it through the shared {@link RagCommandHandler}.
 */
public class RagTools {

    private static final Logger logger = LoggerFactory.getLogger(RagTools.class);

    private static final String QUERY_DESCRIPTION = """
            Search the knowledge base built from synced conversation logs and inserted notes. \
            Ranking is lexical: a document containing the exact query text scores highest, otherwise the share \
            of query words found in the document decides. There is no synonym or stemming support, so use the \
            words you expect in the text. \
            Returns a response line and the matching documents with source, document_id and relevance (0..1).""";

    private final RagCommandHandler handler;
    private final int defaultMaxResults;
    private final SearchMode defaultMode;

    public RagTools(final RagCommandHandler handler, final int defaultMaxResults, final SearchMode defaultMode) {
        this.handler = handler;
        this.defaultMaxResults = defaultMaxResults;
        this.defaultMode = defaultMode;
    }

    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(tool("rag_query", QUERY_DESCRIPTION,
                SchemaGenerator.generateSchema(QueryRequest.class),
                args -> RagCommand.Query.fromMap(args, defaultMaxResults, defaultMode)));

        tools.add(tool("rag_insert_text",
                "Store a piece of text in the knowledge base. Identical text is stored only once; "
                        + "text mentioning a conversation session id is filed under that conversation.",
                SchemaGenerator.generateSchema(InsertTextRequest.class),
                RagCommand.Insert::fromMap));

        tools.add(tool("rag_status",
                "Check that the knowledge base is online and get its document count and last update time.",
                SchemaGenerator.emptySchema(),
                args -> new RagCommand.Status()));

        tools.add(tool("rag_delete",
                "Delete one document by id. Synced documents come back if their file changes again.",
                SchemaGenerator.generateSchema(DeleteRequest.class),
                RagCommand.Delete::fromMap));

        tools.add(tool("rag_clear",
                "Remove ALL documents. Requires confirm=true. A backup of the store file is written first.",
                SchemaGenerator.generateSchema(ClearRequest.class),
                RagCommand.Clear::fromMap));

        tools.add(tool("rag_consolidate",
                "Merge duplicate documents: several documents of the same conversation, identical content, "
                        + "or the same source file. Keeps the newest of each group and backs up the store first. "
                        + "Use dry_run=true to preview.",
                SchemaGenerator.generateSchema(ConsolidateRequest.class),
                RagCommand.Consolidate::fromMap));

        tools.add(tool("rag_statistics",
                "Document counts by id type, content size figures and document count per source.",
                SchemaGenerator.emptySchema(),
                args -> new RagCommand.Statistics()));

        tools.add(tool("rag_sync_status",
                "Counters of the file synchronization: watcher events, suppressed duplicates, queue depth, "
                        + "indexed/unchanged/failed files and the last full scan and reconciliation times.",
                SchemaGenerator.emptySchema(),
                args -> new RagCommand.SyncStatus()));

        tools.add(tool("rag_reconcile",
                "Run a reconciliation pass now: remove documents whose source files are gone (a few per pass) "
                        + "and report files that have no document yet.",
                SchemaGenerator.emptySchema(),
                args -> new RagCommand.Reconcile()));

        return tools;
    }

    private McpServerFeatures.SyncToolSpecification tool(final String name, final String description,
                                                         final McpSchema.JsonSchema schema,
                                                         final Function<Map<String, Object>, RagCommand> parser) {
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name)
                        .description(description)
                        .inputSchema(schema)
                        .build())
                .callHandler((exchange, request) -> call(name, request.arguments(), parser))
                .build();
    }

    McpSchema.CallToolResult call(final String name, final Map<String, Object> arguments,
                                  final Function<Map<String, Object>, RagCommand> parser) {
        final RagCommand command;
        try {
            command = parser.apply(arguments != null ? arguments : Map.of());
        } catch (final IllegalArgumentException e) {
            logger.debug("Invalid arguments for {}: {}", name, e.getMessage());
            return ToolResultHelper.createErrorResult(e.getMessage());
        }
        logger.info("Tool {} called", name);
        final CommandResult result = handler.handle(command);
        return ToolResultHelper.fromCommandResult(result);
    }
}
