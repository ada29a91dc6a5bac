package de.mirkosertic.mcp.ragsync.sync;

/**
 * Snapshot of the synchronization counters since startup.
 */
public record SyncStatistics(
        /** Raw watcher notifications that passed the file filter. */
        long eventsReceived,
        /** Notifications dropped as duplicates of a recent identical event. */
        long eventsSuppressed,
        /** Debounced events lost because the sync queue was full. */
        long eventsDropped,
        /** Debounced events currently waiting for the sync worker. */
        int queueDepth,
        long filesIndexed,
        long filesUnchanged,
        long filesSkipped,
        long filesRemoved,
        long filesFailed,
        long malformedLines,
        long fullScans,
        long reconciliations,
        long orphansRemoved,
        /** Epoch millis of the last completed full scan, 0 if none ran yet. */
        long lastFullScanMs,
        /** Epoch millis of the last completed reconciliation, 0 if none ran yet. */
        long lastReconciliationMs,
        int trackedFiles
) {
}
