package de.mirkosertic.mcp.ragsync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.ragsync.api.RagCommandHandler;
import de.mirkosertic.mcp.ragsync.config.ApplicationConfig;
import de.mirkosertic.mcp.ragsync.config.BuildInfo;
import de.mirkosertic.mcp.ragsync.config.LoggingConfigurator;
import de.mirkosertic.mcp.ragsync.http.RagApiServlet;
import de.mirkosertic.mcp.ragsync.http.RagHttpServer;
import de.mirkosertic.mcp.ragsync.identity.DuplicateConsolidator;
import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import de.mirkosertic.mcp.ragsync.mcp.RagStdioServerTransportProvider;
import de.mirkosertic.mcp.ragsync.mcp.RagTools;
import de.mirkosertic.mcp.ragsync.retrieval.RelevanceEngine;
import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.StoreCorruptedException;
import de.mirkosertic.mcp.ragsync.store.StoreException;
import de.mirkosertic.mcp.ragsync.sync.ConversationLogScanner;
import de.mirkosertic.mcp.ragsync.sync.DirectoryWatcherService;
import de.mirkosertic.mcp.ragsync.sync.FileEventDebouncer;
import de.mirkosertic.mcp.ragsync.sync.FilePatternMatcher;
import de.mirkosertic.mcp.ragsync.sync.HttpServedIndexClient;
import de.mirkosertic.mcp.ragsync.sync.ReconciliationService;
import de.mirkosertic.mcp.ragsync.sync.ServedIndexClient;
import de.mirkosertic.mcp.ragsync.sync.SyncExecutorService;
import de.mirkosertic.mcp.ragsync.sync.SyncScheduler;
import de.mirkosertic.mcp.ragsync.sync.SyncStatisticsTracker;
import de.mirkosertic.mcp.ragsync.sync.WatchStateRepository;
import de.mirkosertic.mcp.ragsync.sync.WatchedRoots;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main entry point of the RAG sync server.
 * Wires all services by hand, starts file synchronization and exposes the knowledge base over HTTP
 * and, when enabled, over MCP STDIO.
 */
public class RagSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(RagSyncApplication.class);

    private final ApplicationConfig config;
    private final DocumentStore store;
    private final WatchStateRepository watchStates;
    private final WatchedRoots watchedRoots;
    private final SyncExecutorService scanExecutor;
    private final SyncScheduler syncScheduler;
    private final DirectoryWatcherService watcherService;
    private final FileEventDebouncer debouncer;
    private final ReconciliationService reconciliationService;
    private final RagCommandHandler commandHandler;
    private final SearchMode defaultMode;

    private RagHttpServer httpServer;
    private McpSyncServer mcpServer;

    public RagSyncApplication(final ApplicationConfig config) throws StoreException {
        this.config = config;
        this.defaultMode = SearchMode.fromWireName(config.getDefaultMode(), SearchMode.HYBRID);

        final IdentityResolver identityResolver = new IdentityResolver();
        this.store = DocumentStore.open(Paths.get(config.getStorePath()), identityResolver);

        final String stateFile = config.getStateFile();
        this.watchStates = new WatchStateRepository(
                stateFile != null && !stateFile.isBlank() ? Paths.get(stateFile) : null);

        final FilePatternMatcher patternMatcher =
                new FilePatternMatcher(config.getIncludePatterns(), config.getExcludePatterns());
        this.watchedRoots = new WatchedRoots(config.getDirectories(), patternMatcher);

        final SyncStatisticsTracker statistics = new SyncStatisticsTracker();
        this.scanExecutor = new SyncExecutorService(config.getThreadPoolSize());
        this.syncScheduler = new SyncScheduler(
                store,
                identityResolver,
                new ConversationLogScanner(),
                watchStates,
                watchedRoots,
                statistics,
                config.getQueueCapacity());

        this.watcherService = new DirectoryWatcherService(patternMatcher, config.getWatchPollIntervalMs());
        this.debouncer = new FileEventDebouncer(
                syncScheduler::enqueue,
                statistics,
                config.getWatchDebounceMs(),
                config.getDuplicateWindowMs(),
                config.getEventHistoryTtlMs());

        final String downstreamUrl = config.getDownstreamUrl();
        final ServedIndexClient servedIndex = downstreamUrl != null && !downstreamUrl.isBlank()
                ? new HttpServedIndexClient(downstreamUrl, config.getDownstreamTimeoutMs())
                : null;
        this.reconciliationService = new ReconciliationService(
                store,
                watchStates,
                watchedRoots,
                statistics,
                servedIndex,
                config.getOrphanBatchLimit(),
                config.getCorruptionRatio());

        this.commandHandler = new RagCommandHandler(
                store,
                new RelevanceEngine(),
                new DuplicateConsolidator(store, identityResolver, watchStates),
                syncScheduler,
                reconciliationService,
                config.isBackupOnClear());
    }

    /**
     * Start synchronization, reconciliation and the transports, then block until shutdown.
     */
    public void start() throws Exception {
        logger.info("Starting RAG sync server {}", BuildInfo.describe());
        watchStates.load();

        if (watchedRoots.getRoots().isEmpty()) {
            logger.info("No directories configured, file synchronization disabled");
        } else {
            syncScheduler.start(scanExecutor, config.getFullScanIntervalMs(), config.isSyncOnStartup());
            if (config.isWatchEnabled()) {
                startWatching();
            }
            if (config.isReconciliationEnabled()) {
                reconciliationService.start(config.getReconciliationIntervalMs());
            }
        }

        if (config.isHttpEnabled()) {
            httpServer = new RagHttpServer(config.getHttpHost(), config.getHttpPort(),
                    new RagApiServlet(commandHandler, config.getDefaultMaxResults(), defaultMode));
            httpServer.start();
        }

        if (config.isMcpEnabled()) {
            startMcpServer();
            monitorParentProcess();
        }

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    private void startWatching() {
        for (final Path root : watchedRoots.getRoots()) {
            if (!watchedRoots.isAvailable(root)) {
                logger.warn("Not watching {}: directory does not exist", root);
                continue;
            }
            try {
                watcherService.watchDirectory(root, debouncer);
                logger.info("Watching {}", root);
            } catch (final IOException e) {
                logger.error("Cannot watch {}, relying on periodic full scans", root, e);
            }
        }
    }

    private void startMcpServer() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();
        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP RAG Sync Server",
                BuildInfo.getVersion());
        final RagStdioServerTransportProvider transportProvider =
                new RagStdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));
        final RagTools tools = new RagTools(commandHandler, config.getDefaultMaxResults(), defaultMode);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started");
    }

    // An MCP client that dies without closing stdin would otherwise leave this process running
    private void monitorParentProcess() {
        ProcessHandle.current().parent().ifPresent(parent -> {
            parent.onExit().thenRun(() -> {
                logger.info("Parent process terminated, shutting down...");
                System.exit(0);
            });
            logger.info("Monitoring parent process PID: {}", parent.pid());
        });
    }

    /**
     * Stop all services: transports first, then reconciliation, the watcher (flushing pending events
     * into the queue) and finally the sync worker, which drains the queue and saves the watch state.
     */
    public void shutdown() {
        logger.info("Shutting down RAG sync server...");

        if (httpServer != null) {
            httpServer.stop();
        }

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            reconciliationService.stop();
        } catch (final Exception e) {
            logger.error("Error stopping reconciliation", e);
        }

        try {
            watcherService.stopAll();
            debouncer.stop();
        } catch (final Exception e) {
            logger.error("Error stopping directory watcher", e);
        }

        try {
            syncScheduler.stop();
        } catch (final Exception e) {
            logger.error("Error stopping sync scheduler", e);
        }

        scanExecutor.shutdown();
        logger.info("RAG sync server shutdown complete");
    }

    public static void main(final String[] args) {
        // Logging must be configured before anything logs, so read the profile directly
        final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
        LoggingConfigurator.configure(deployedMode);

        try {
            final ApplicationConfig config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Store: {}, directories: {}", config.getStorePath(), config.getDirectories());
            }

            final RagSyncApplication app = new RagSyncApplication(config);
            app.start();
        } catch (final StoreCorruptedException e) {
            logger.error("FATAL: {}. Fix or restore the store file before starting again.", e.getMessage(), e);
            System.exit(1);
        } catch (final Exception e) {
            logger.error("Failed to start RAG sync server", e);
            System.err.println("Failed to start RAG sync server: " + e.getMessage());
            System.exit(1);
        }
    }
}
