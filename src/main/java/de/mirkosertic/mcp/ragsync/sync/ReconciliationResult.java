package de.mirkosertic.mcp.ragsync.sync;

import java.util.List;

/**
 * Outcome of one reconciliation tick.
 */
public record ReconciliationResult(
        /** False when the tick was skipped because another one was still running. */
        boolean executed,
        /** Size of set A, the watched files on disk. */
        int filesOnDisk,
        /** Size of set B, local documents with a recorded file path. */
        int trackedDocuments,
        /** Size of set C, or -1 without downstream index. */
        int servedDocuments,
        /** Document count the downstream index reported, or -1. */
        long reportedServedCount,
        int localOrphans,
        int downstreamOrphans,
        /** Ids removed this tick, local first, never more than the batch limit. */
        List<String> removedIds,
        /** Files on disk without a document; left for the sync scheduler. */
        int missingDocuments,
        boolean corruptionSuspected,
        long durationMs
) {

    public static ReconciliationResult skipped() {
        return new ReconciliationResult(false, 0, 0, -1, -1, 0, 0, List.of(), 0, false, 0);
    }

    /**
     * Orphans that exceeded the batch limit and wait for the next tick.
     */
    public int deferredOrphans() {
        return Math.max(0, localOrphans + downstreamOrphans - removedIds.size());
    }
}
