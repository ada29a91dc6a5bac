package de.mirkosertic.mcp.ragsync.sync;

import com.google.common.util.concurrent.Striped;
import de.mirkosertic.mcp.ragsync.identity.ContentHasher;
import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentNotFoundException;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.NewDocument;
import de.mirkosertic.mcp.ragsync.store.StoreException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Drives file changes into the {@link DocumentStore}.
 * <p>
 * Debounced watcher events arrive through a bounded queue and are processed in arrival order by a single
 * {@code sync-worker} thread. A periodic full scan hashes every watched file on the
 * {@link SyncExecutorService} pool, catching anything the watcher missed. Both paths, and reconciliation,
 * may hit the same file at the same time; a striped per-path lock serializes them and every operation is
 * idempotent, so they converge on the same state.
 * <p>
 * A file whose hash matches its {@link WatchState} only gets its check time updated. Changed or new files
 * are written with {@link DocumentStore#replace}, which removes the previous document and inserts the new
 * one atomically.
 */
public class SyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SyncScheduler.class);

    static final String SUMMARY_PREFIX = "Conversation log: ";

    private final DocumentStore store;
    private final IdentityResolver identityResolver;
    private final ConversationLogScanner logScanner;
    private final WatchStateRepository watchStates;
    private final WatchedRoots watchedRoots;
    private final SyncStatisticsTracker statistics;
    private final BlockingQueue<FileEvent> eventQueue;
    private final Striped<Lock> pathLocks = Striped.lock(64);
    private final AtomicBoolean scanRunning = new AtomicBoolean(false);

    private @Nullable SyncExecutorService scanExecutor;
    private @Nullable ScheduledExecutorService scanScheduler;
    private @Nullable Thread worker;
    private volatile boolean running = false;

    public SyncScheduler(final DocumentStore store,
                         final IdentityResolver identityResolver,
                         final ConversationLogScanner logScanner,
                         final WatchStateRepository watchStates,
                         final WatchedRoots watchedRoots,
                         final SyncStatisticsTracker statistics,
                         final int queueCapacity) {
        this.store = store;
        this.identityResolver = identityResolver;
        this.logScanner = logScanner;
        this.watchStates = watchStates;
        this.watchedRoots = watchedRoots;
        this.statistics = statistics;
        this.eventQueue = new LinkedBlockingQueue<>(Math.max(1, queueCapacity));
    }

    /**
     * Queue a debounced event for the sync worker. Never blocks; when the queue is full the event is
     * dropped and the next full scan picks up the change.
     */
    public boolean enqueue(final FileEvent event) {
        if (eventQueue.offer(event)) {
            return true;
        }
        statistics.incrementEventsDropped();
        logger.warn("Sync queue full, dropping {} event for {}", event.type(), event.path());
        return false;
    }

    /**
     * Start the sync worker and, if {@code fullScanIntervalMs} is positive, the periodic full scan.
     */
    public synchronized void start(final SyncExecutorService executor, final long fullScanIntervalMs,
                                   final boolean scanOnStartup) {
        if (running) {
            return;
        }
        running = true;
        this.scanExecutor = executor;

        final Thread thread = new Thread(this::processQueue, "sync-worker");
        thread.setDaemon(true);
        thread.start();
        this.worker = thread;

        if (fullScanIntervalMs > 0 || scanOnStartup) {
            final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "sync-full-scan");
                t.setDaemon(true);
                return t;
            });
            if (scanOnStartup) {
                scheduler.execute(this::fullScan);
            }
            if (fullScanIntervalMs > 0) {
                scheduler.scheduleWithFixedDelay(this::fullScan, fullScanIntervalMs, fullScanIntervalMs,
                        TimeUnit.MILLISECONDS);
            }
            this.scanScheduler = scheduler;
        }
        logger.info("Sync scheduler started (full scan interval {} ms, roots {})",
                fullScanIntervalMs, watchedRoots.getRoots());
    }

    private void processQueue() {
        logger.debug("Sync worker started");
        while (running || !eventQueue.isEmpty()) {
            final FileEvent event;
            try {
                event = eventQueue.poll(500, TimeUnit.MILLISECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                continue;
            }
            statistics.recordOutcome(process(event));
            if (eventQueue.isEmpty()) {
                saveWatchState();
            }
        }
        logger.debug("Sync worker stopped");
    }

    public SyncOutcome process(final FileEvent event) {
        return switch (event.type()) {
            case CREATED, MODIFIED -> syncFile(event.path());
            case DELETED -> removeFile(event.path());
        };
    }

    /**
     * Bring the store in line with the current content of {@code path}.
     */
    public SyncOutcome syncFile(final Path path) {
        final Path file = path.toAbsolutePath().normalize();
        final String key = file.toString();
        final Lock lock = pathLocks.get(key);
        lock.lock();
        try {
            final byte[] bytes;
            final long lastModified;
            try {
                lastModified = Files.getLastModifiedTime(file).toMillis();
                bytes = Files.readAllBytes(file);
            } catch (final NoSuchFileException e) {
                logger.debug("File vanished before it could be synced: {}", file);
                return SyncOutcome.SKIPPED;
            } catch (final IOException e) {
                logger.warn("Cannot read {}, retrying on the next cycle: {}", file, e.getMessage());
                return SyncOutcome.FAILED;
            }

            final long now = System.currentTimeMillis();
            if (bytes.length == 0) {
                logger.debug("Skipping empty file: {}", file);
                return SyncOutcome.SKIPPED;
            }

            final String fileHash = ContentHasher.sha256(bytes);
            final Optional<WatchState> previous = watchStates.get(file);
            if (previous.isPresent() && fileHash.equals(previous.get().lastHash())
                    && store.get(previous.get().documentId()).isPresent()) {
                watchStates.put(previous.get().checkedAt(now));
                return SyncOutcome.UNCHANGED;
            }

            final String content = new String(bytes, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                logger.debug("Skipping blank file: {}", file);
                return SyncOutcome.SKIPPED;
            }

            final String fileName = file.getFileName().toString();
            final ConversationLog log = logScanner.scan(fileName, content);
            statistics.addMalformedLines(log.malformedLines());

            final String summary = log.summary() != null ? log.summary() : SUMMARY_PREFIX + fileName;
            final String documentId = identityResolver.resolve(fileName, content, key, summary);
            final String previousId = previous
                    .map(WatchState::documentId)
                    .filter(id -> !watchStates.isReferencedElsewhere(id, key))
                    .orElse(null);

            final String storedId;
            try {
                storedId = store.replace(previousId,
                        new NewDocument(documentId, content, key, summary, buildMetadata(file, bytes.length, fileHash, log)));
            } catch (final StoreException e) {
                logger.error("Failed to store {}: {}", file, e.getMessage(), e);
                return SyncOutcome.FAILED;
            }

            watchStates.put(new WatchState(key, storedId, fileHash, bytes.length, lastModified, now));
            logger.info("Synced {} as {}", file, storedId);
            return SyncOutcome.INDEXED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the document that {@code path} produced. A path without document counts as consistent.
     */
    public SyncOutcome removeFile(final Path path) {
        final Path file = path.toAbsolutePath().normalize();
        final String key = file.toString();
        final Lock lock = pathLocks.get(key);
        lock.lock();
        try {
            if (Files.exists(file)) {
                // Deleted and recreated within the debounce window
                return syncFile(file);
            }

            final Optional<WatchState> state = watchStates.remove(file);
            final String documentId = state.map(WatchState::documentId)
                    .or(() -> findDocumentIdByPath(key))
                    .orElse(null);
            if (documentId == null) {
                logger.debug("No document recorded for deleted file {}", file);
                return SyncOutcome.ALREADY_CONSISTENT;
            }
            if (watchStates.isReferencedElsewhere(documentId, key)) {
                logger.debug("Document {} still backed by another file, keeping it", documentId);
                return SyncOutcome.REMOVED;
            }

            try {
                store.delete(documentId);
                logger.info("Removed document {} for deleted file {}", documentId, file);
                return SyncOutcome.REMOVED;
            } catch (final DocumentNotFoundException e) {
                return SyncOutcome.ALREADY_CONSISTENT;
            } catch (final StoreException e) {
                logger.error("Failed to remove document {} for {}: {}", documentId, file, e.getMessage(), e);
                state.ifPresent(watchStates::put);
                return SyncOutcome.FAILED;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sync every watched file on disk. Skipped when a scan is already running.
     *
     * @return number of files examined, -1 when skipped
     */
    public int fullScan() {
        if (!scanRunning.compareAndSet(false, true)) {
            logger.debug("Full scan already running, skipping");
            return -1;
        }
        try {
            final Set<Path> files = watchedRoots.collectFilesOnDisk();
            logger.debug("Full scan of {} files", files.size());

            final SyncExecutorService executor = this.scanExecutor;
            if (executor == null) {
                for (final Path file : files) {
                    statistics.recordOutcome(syncFile(file));
                }
            } else {
                final List<Future<?>> futures = new ArrayList<>(files.size());
                for (final Path file : files) {
                    futures.add(executor.submit(() -> statistics.recordOutcome(syncFile(file))));
                }
                for (final Future<?> future : futures) {
                    try {
                        future.get();
                    } catch (final ExecutionException e) {
                        logger.error("Error during full scan", e.getCause());
                    }
                }
            }
            statistics.recordFullScan();
            saveWatchState();
            return files.size();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Full scan interrupted");
            return -1;
        } catch (final RuntimeException e) {
            // Keeps the scheduled scan alive
            logger.error("Full scan failed", e);
            return -1;
        } finally {
            scanRunning.set(false);
        }
    }

    public int getQueueDepth() {
        return eventQueue.size();
    }

    public SyncStatistics getStatistics() {
        return statistics.snapshot(eventQueue.size(), watchStates::size);
    }

    /**
     * Stop the periodic scan, let the worker drain the queue and persist the watch state.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (scanScheduler != null) {
            scanScheduler.shutdownNow();
        }
        if (worker != null) {
            try {
                worker.join(TimeUnit.SECONDS.toMillis(10));
                if (worker.isAlive()) {
                    logger.warn("Sync worker did not drain the queue in time, {} events left", eventQueue.size());
                    worker.interrupt();
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        saveWatchState();
        logger.info("Sync scheduler stopped");
    }

    private Optional<String> findDocumentIdByPath(final String filePath) {
        for (final Document document : store.list()) {
            if (filePath.equals(document.filePath())) {
                return Optional.of(document.id());
            }
        }
        return Optional.empty();
    }

    private void saveWatchState() {
        try {
            watchStates.saveIfDirty();
        } catch (final IOException e) {
            logger.warn("Failed to save watch state: {}", e.getMessage());
        }
    }

    private static Map<String, Object> buildMetadata(final Path file, final long size, final String fileHash,
                                                     final ConversationLog log) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Document.FILE_PATH, file.toString());
        metadata.put(Document.FILE_NAME, file.getFileName().toString());
        metadata.put("file_hash", fileHash);
        metadata.put("file_size", size);
        metadata.put("imported_at", Instant.now().toString());
        metadata.put("line_count", log.lineCount());
        metadata.put("message_count", log.messageCount());
        metadata.put("malformed_lines", log.malformedLines());
        if (log.sessionId() != null) {
            metadata.put("session_id", log.sessionId());
        }
        return metadata;
    }
}
