package de.mirkosertic.mcp.ragsync.sync;

import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentNotFoundException;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.StoreException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Repairs drift between the watched files, the local store and an optional downstream index.
 * <p>
 * Each tick compares three sets:
 * <ol>
 *   <li>A: matching files on disk,</li>
 *   <li>B: local documents that recorded a {@code file_path},</li>
 *   <li>C: documents listed by the downstream index, if one is configured.</li>
 * </ol>
 * A document in B or C is an orphan when its path is not in A, no file in A has the same base name, and no
 * file in A is linked to its id through a {@link WatchState}. Documents under a root that is currently
 * unreachable are never orphans. At most {@code batchLimit} orphans are removed per tick so that a
 * transiently incomplete A cannot wipe the store, and a tick whose file listing failed part way removes
 * nothing at all. Files in A without a document are only counted; the
 * {@link SyncScheduler} owns inserts.
 * <p>
 * Ticks never overlap: a call while one is running returns {@link ReconciliationResult#skipped()}.
 */
public class ReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

    private final DocumentStore store;
    private final WatchStateRepository watchStates;
    private final WatchedRoots watchedRoots;
    private final SyncStatisticsTracker statistics;
    private final @Nullable ServedIndexClient servedIndex;
    private final int batchLimit;
    private final double corruptionRatio;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private @Nullable ScheduledExecutorService timer;

    public ReconciliationService(final DocumentStore store,
                                 final WatchStateRepository watchStates,
                                 final WatchedRoots watchedRoots,
                                 final SyncStatisticsTracker statistics,
                                 final @Nullable ServedIndexClient servedIndex,
                                 final int batchLimit,
                                 final double corruptionRatio) {
        this.store = store;
        this.watchStates = watchStates;
        this.watchedRoots = watchedRoots;
        this.statistics = statistics;
        this.servedIndex = servedIndex;
        this.batchLimit = Math.max(0, batchLimit);
        this.corruptionRatio = corruptionRatio;
    }

    public synchronized void start(final long intervalMs) {
        if (timer != null) {
            return;
        }
        final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "reconciliation");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        this.timer = executor;
        logger.info("Reconciliation scheduled every {} ms (batch limit {})", intervalMs, batchLimit);
    }

    private void tick() {
        try {
            reconcile();
        } catch (final RuntimeException e) {
            // An escaping exception would cancel the schedule
            logger.error("Reconciliation tick failed", e);
        }
    }

    public ReconciliationResult reconcile() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Reconciliation already running, skipping this trigger");
            return ReconciliationResult.skipped();
        }
        try {
            return doReconcile();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private ReconciliationResult doReconcile() {
        final long startTime = System.currentTimeMillis();

        // Set A
        final WatchedRoots.DiskSnapshot snapshot = watchedRoots.snapshot();
        final Set<String> filesOnDisk = new HashSet<>();
        final Set<String> baseNamesOnDisk = new HashSet<>();
        for (final Path file : snapshot.files()) {
            filesOnDisk.add(file.toString());
            baseNamesOnDisk.add(file.getFileName().toString());
        }
        final Set<String> aliasedIds = watchStates.documentIdsFor(filesOnDisk);
        final OrphanCheck orphanCheck = new OrphanCheck(filesOnDisk, baseNamesOnDisk, aliasedIds);

        // Set B
        final List<Document> tracked = new ArrayList<>();
        final Set<String> trackedPaths = new HashSet<>();
        for (final Document document : store.list()) {
            if (document.filePath() != null) {
                tracked.add(document);
                trackedPaths.add(document.filePath());
            }
        }
        final List<Document> localOrphans = new ArrayList<>();
        for (final Document document : tracked) {
            if (orphanCheck.isOrphan(document.id(), document.filePath(), document.fileName())) {
                localOrphans.add(document);
            }
        }

        int missing = 0;
        for (final String file : filesOnDisk) {
            if (!trackedPaths.contains(file) && watchStates.get(Paths.get(file)).isEmpty()) {
                missing++;
            }
        }

        // Set C
        int servedCount = -1;
        long reportedCount = -1;
        boolean corruptionSuspected = false;
        final List<ServedDocument> downstreamOrphans = new ArrayList<>();
        if (servedIndex != null) {
            try {
                final List<ServedDocument> served = servedIndex.listDocuments();
                reportedCount = servedIndex.reportedDocumentCount();
                servedCount = served.size();
                if (servedCount < corruptionRatio * reportedCount) {
                    corruptionSuspected = true;
                    logger.warn("Downstream index lists {} documents but reports {}; the index looks inconsistent, "
                            + "a full resync is recommended. Skipping downstream orphan removal.", servedCount, reportedCount);
                } else {
                    for (final ServedDocument document : served) {
                        if (document.filePath() != null
                                && orphanCheck.isOrphan(document.id(), document.filePath(), baseName(document.filePath()))) {
                            downstreamOrphans.add(document);
                        }
                    }
                }
            } catch (final IOException e) {
                logger.warn("Cannot reach downstream index, reconciling local store only: {}", e.getMessage());
            }
        }

        final List<String> removed = new ArrayList<>();
        if (!snapshot.complete()) {
            logger.warn("File listing was incomplete, no orphans removed this tick");
            localOrphans.clear();
            downstreamOrphans.clear();
        }
        for (final Document orphan : localOrphans) {
            if (removed.size() >= batchLimit) {
                break;
            }
            if (removeLocal(orphan)) {
                removed.add(orphan.id());
            }
        }
        for (final ServedDocument orphan : downstreamOrphans) {
            if (removed.size() >= batchLimit) {
                break;
            }
            if (removeDownstream(orphan)) {
                removed.add(orphan.id());
            }
        }

        final int deferred = localOrphans.size() + downstreamOrphans.size() - removed.size();
        if (deferred > 0) {
            logger.info("{} orphans deferred to the next reconciliation tick", deferred);
        }

        final long duration = System.currentTimeMillis() - startTime;
        statistics.recordReconciliation(removed.size());
        logger.info("Reconciliation done in {}ms: disk={}, tracked={}, served={}, orphans={}/{}, removed={}, missing={}",
                duration, filesOnDisk.size(), tracked.size(), servedCount,
                localOrphans.size(), downstreamOrphans.size(), removed.size(), missing);

        return new ReconciliationResult(true, filesOnDisk.size(), tracked.size(), servedCount, reportedCount,
                localOrphans.size(), downstreamOrphans.size(), List.copyOf(removed), missing,
                corruptionSuspected, duration);
    }

    private boolean removeLocal(final Document orphan) {
        try {
            store.delete(orphan.id());
            logger.info("Removed orphan {} ({} no longer exists)", orphan.id(), orphan.filePath());
        } catch (final DocumentNotFoundException e) {
            logger.debug("Orphan {} already gone", orphan.id());
        } catch (final StoreException e) {
            logger.error("Failed to remove orphan {}: {}", orphan.id(), e.getMessage(), e);
            return false;
        }
        if (orphan.filePath() != null) {
            watchStates.remove(orphan.filePath());
        }
        return true;
    }

    private boolean removeDownstream(final ServedDocument orphan) {
        if (servedIndex == null) {
            return false;
        }
        try {
            servedIndex.deleteDocument(orphan.id());
            logger.info("Removed orphan {} from downstream index ({} no longer exists)", orphan.id(), orphan.filePath());
            return true;
        } catch (final IOException e) {
            logger.warn("Failed to remove orphan {} from downstream index: {}", orphan.id(), e.getMessage());
            return false;
        }
    }

    private static @Nullable String baseName(final String filePath) {
        final Path fileName = Paths.get(filePath).getFileName();
        return fileName != null ? fileName.toString() : null;
    }

    /**
     * Stop the timer between ticks; a running tick finishes first.
     */
    public synchronized void stop() {
        if (timer == null) {
            return;
        }
        timer.shutdown();
        try {
            if (!timer.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Reconciliation tick did not finish in time, interrupting");
                timer.shutdownNow();
            }
        } catch (final InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timer = null;
        logger.info("Reconciliation stopped");
    }

    private final class OrphanCheck {

        private final Set<String> filesOnDisk;
        private final Set<String> baseNamesOnDisk;
        private final Set<String> aliasedIds;

        OrphanCheck(final Set<String> filesOnDisk, final Set<String> baseNamesOnDisk, final Set<String> aliasedIds) {
            this.filesOnDisk = filesOnDisk;
            this.baseNamesOnDisk = baseNamesOnDisk;
            this.aliasedIds = aliasedIds;
        }

        boolean isOrphan(final String id, final String filePath, final @Nullable String fileName) {
            if (filesOnDisk.contains(filePath)) {
                return false;
            }
            if (fileName != null && baseNamesOnDisk.contains(fileName)) {
                return false;
            }
            if (aliasedIds.contains(id)) {
                return false;
            }
            return !watchedRoots.isUnderUnavailableRoot(Paths.get(filePath));
        }
    }
}
