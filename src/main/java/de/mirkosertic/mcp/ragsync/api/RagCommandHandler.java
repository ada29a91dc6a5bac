package de.mirkosertic.mcp.ragsync.api;

import de.mirkosertic.mcp.ragsync.api.dto.ClearResponse;
import de.mirkosertic.mcp.ragsync.api.dto.DocumentListResponse;
import de.mirkosertic.mcp.ragsync.api.dto.DocumentSummary;
import de.mirkosertic.mcp.ragsync.api.dto.InsertResponse;
import de.mirkosertic.mcp.ragsync.api.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.ragsync.api.dto.StatusResponse;
import de.mirkosertic.mcp.ragsync.identity.ConsolidationReport;
import de.mirkosertic.mcp.ragsync.identity.DuplicateConsolidator;
import de.mirkosertic.mcp.ragsync.retrieval.QueryResponseFormatter;
import de.mirkosertic.mcp.ragsync.retrieval.RelevanceEngine;
import de.mirkosertic.mcp.ragsync.retrieval.ScoredDocument;
import de.mirkosertic.mcp.ragsync.store.ClearResult;
import de.mirkosertic.mcp.ragsync.store.ConfirmationRequiredException;
import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentNotFoundException;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.EmptyContentException;
import de.mirkosertic.mcp.ragsync.store.NewDocument;
import de.mirkosertic.mcp.ragsync.store.StoreException;
import de.mirkosertic.mcp.ragsync.store.StoreStatus;
import de.mirkosertic.mcp.ragsync.sync.ReconciliationResult;
import de.mirkosertic.mcp.ragsync.sync.ReconciliationService;
import de.mirkosertic.mcp.ragsync.sync.SyncScheduler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes {@link RagCommand}s against the store and the sync components. Shared by the HTTP and the MCP
 * transport, which only differ in how they parse requests and render {@link CommandResult}s.
 * <p>
 * Store errors never escape: typed failures map to 400/404, anything else to 500.
 */
public class RagCommandHandler implements RagCommand.Visitor<CommandResult> {

    private static final Logger logger = LoggerFactory.getLogger(RagCommandHandler.class);

    private final DocumentStore store;
    private final RelevanceEngine relevanceEngine;
    private final DuplicateConsolidator consolidator;
    private final @Nullable SyncScheduler syncScheduler;
    private final @Nullable ReconciliationService reconciliationService;
    private final boolean backupOnClear;

    public RagCommandHandler(final DocumentStore store,
                             final RelevanceEngine relevanceEngine,
                             final DuplicateConsolidator consolidator,
                             final @Nullable SyncScheduler syncScheduler,
                             final @Nullable ReconciliationService reconciliationService,
                             final boolean backupOnClear) {
        this.store = store;
        this.relevanceEngine = relevanceEngine;
        this.consolidator = consolidator;
        this.syncScheduler = syncScheduler;
        this.reconciliationService = reconciliationService;
        this.backupOnClear = backupOnClear;
    }

    public CommandResult handle(final RagCommand command) {
        try {
            return command.accept(this);
        } catch (final RuntimeException e) {
            logger.error("Unexpected error handling {}", command, e);
            return new CommandResult(CommandResult.INTERNAL_ERROR,
                    SimpleMessageResponse.error("Internal error: " + e.getMessage()));
        }
    }

    @Override
    public CommandResult visitQuery(final RagCommand.Query command) {
        final List<ScoredDocument> results = relevanceEngine.rank(command.query(), store.list(),
                command.maxResults(), command.mode());
        logger.debug("Query '{}' ({}) matched {} documents", command.query(), command.mode().wireName(), results.size());
        return CommandResult.ok(QueryResponseFormatter.format(command.query(), results));
    }

    @Override
    public CommandResult visitInsert(final RagCommand.Insert command) {
        try {
            final String id = store.insert(new NewDocument(null, command.text(), command.source(),
                    command.summary(), command.metadata()));
            logger.info("Inserted document {} from {}", id, command.source());
            return CommandResult.ok(InsertResponse.success(id));
        } catch (final EmptyContentException e) {
            return new CommandResult(CommandResult.BAD_REQUEST, InsertResponse.error(e.getMessage()));
        } catch (final StoreException e) {
            logger.error("Insert failed", e);
            return new CommandResult(CommandResult.INTERNAL_ERROR, InsertResponse.error(e.getMessage()));
        }
    }

    @Override
    public CommandResult visitDelete(final RagCommand.Delete command) {
        try {
            store.delete(command.id());
            logger.info("Deleted document {}", command.id());
            return CommandResult.ok(SimpleMessageResponse.success("Document " + command.id() + " deleted"));
        } catch (final DocumentNotFoundException e) {
            return new CommandResult(CommandResult.NOT_FOUND, SimpleMessageResponse.error(e.getMessage()));
        } catch (final StoreException e) {
            logger.error("Delete of {} failed", command.id(), e);
            return new CommandResult(CommandResult.INTERNAL_ERROR, SimpleMessageResponse.error(e.getMessage()));
        }
    }

    @Override
    public CommandResult visitClear(final RagCommand.Clear command) {
        try {
            final ClearResult result = store.clear(command.confirm(), backupOnClear);
            final String backup = result.backupPath() != null ? result.backupPath().toString() : null;
            return CommandResult.ok(ClearResponse.success(
                    "Removed " + result.removedCount() + " documents", backup));
        } catch (final ConfirmationRequiredException e) {
            return new CommandResult(CommandResult.BAD_REQUEST, ClearResponse.error(e.getMessage()));
        } catch (final StoreException e) {
            logger.error("Clear failed", e);
            return new CommandResult(CommandResult.INTERNAL_ERROR, ClearResponse.error(e.getMessage()));
        }
    }

    @Override
    public CommandResult visitStatus(final RagCommand.Status command) {
        final StoreStatus status = store.status();
        return CommandResult.ok(StatusResponse.online(status.documents(), status.lastUpdated()));
    }

    @Override
    public CommandResult visitListDocuments(final RagCommand.ListDocuments command) {
        final List<Document> documents = store.list();
        final List<DocumentSummary> summaries = new ArrayList<>(documents.size());
        for (final Document document : documents) {
            summaries.add(DocumentSummary.of(document));
        }
        return CommandResult.ok(new DocumentListResponse(summaries, summaries.size()));
    }

    @Override
    public CommandResult visitConsolidate(final RagCommand.Consolidate command) {
        try {
            final ConsolidationReport report = consolidator.consolidate(command.dryRun());
            return CommandResult.ok(report);
        } catch (final StoreException e) {
            logger.error("Consolidation failed", e);
            return new CommandResult(CommandResult.INTERNAL_ERROR, SimpleMessageResponse.error(e.getMessage()));
        }
    }

    @Override
    public CommandResult visitStatistics(final RagCommand.Statistics command) {
        return CommandResult.ok(consolidator.statistics());
    }

    @Override
    public CommandResult visitSyncStatus(final RagCommand.SyncStatus command) {
        if (syncScheduler == null) {
            return new CommandResult(CommandResult.UNAVAILABLE,
                    SimpleMessageResponse.error("File synchronization is not configured"));
        }
        return CommandResult.ok(syncScheduler.getStatistics());
    }

    @Override
    public CommandResult visitReconcile(final RagCommand.Reconcile command) {
        if (reconciliationService == null) {
            return new CommandResult(CommandResult.UNAVAILABLE,
                    SimpleMessageResponse.error("Reconciliation is not configured"));
        }
        final ReconciliationResult result = reconciliationService.reconcile();
        if (!result.executed()) {
            logger.info("Reconciliation requested while a tick was running, skipped");
        }
        return CommandResult.ok(result);
    }
}
