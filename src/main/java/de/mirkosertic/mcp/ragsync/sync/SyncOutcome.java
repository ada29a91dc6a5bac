package de.mirkosertic.mcp.ragsync.sync;

/**
 * Result of synchronizing a single path.
 */
public enum SyncOutcome {
    /** Content was new or changed and the store was updated. */
    INDEXED,
    /** Hash matched the recorded state, only the check time moved. */
    UNCHANGED,
    /** File was empty, vanished or had nothing to index. */
    SKIPPED,
    /** The document linked to a deleted file was removed. */
    REMOVED,
    /** A deleted file had no document left, nothing to do. */
    ALREADY_CONSISTENT,
    /** Transient error, the next watcher event or full scan retries. */
    FAILED
}
