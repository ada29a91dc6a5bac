package de.mirkosertic.mcp.ragsync.sync;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Counters for watcher, sync worker, full scan and reconciliation.
 * Thread-safe for use from all sync threads.
 */
public class SyncStatisticsTracker {

    private final AtomicLong eventsReceived = new AtomicLong(0);
    private final AtomicLong eventsSuppressed = new AtomicLong(0);
    private final AtomicLong eventsDropped = new AtomicLong(0);
    private final AtomicLong filesIndexed = new AtomicLong(0);
    private final AtomicLong filesUnchanged = new AtomicLong(0);
    private final AtomicLong filesSkipped = new AtomicLong(0);
    private final AtomicLong filesRemoved = new AtomicLong(0);
    private final AtomicLong filesFailed = new AtomicLong(0);
    private final AtomicLong malformedLines = new AtomicLong(0);
    private final AtomicLong fullScans = new AtomicLong(0);
    private final AtomicLong reconciliations = new AtomicLong(0);
    private final AtomicLong orphansRemoved = new AtomicLong(0);
    private final AtomicLong lastFullScanMs = new AtomicLong(0);
    private final AtomicLong lastReconciliationMs = new AtomicLong(0);

    public void incrementEventsReceived() {
        eventsReceived.incrementAndGet();
    }

    public void incrementEventsSuppressed() {
        eventsSuppressed.incrementAndGet();
    }

    public void incrementEventsDropped() {
        eventsDropped.incrementAndGet();
    }

    public void recordOutcome(final SyncOutcome outcome) {
        switch (outcome) {
            case INDEXED -> filesIndexed.incrementAndGet();
            case UNCHANGED -> filesUnchanged.incrementAndGet();
            case SKIPPED -> filesSkipped.incrementAndGet();
            case REMOVED, ALREADY_CONSISTENT -> filesRemoved.incrementAndGet();
            case FAILED -> filesFailed.incrementAndGet();
        }
    }

    public void addMalformedLines(final long count) {
        malformedLines.addAndGet(count);
    }

    public void recordFullScan() {
        fullScans.incrementAndGet();
        lastFullScanMs.set(System.currentTimeMillis());
    }

    public void recordReconciliation(final int removedOrphans) {
        reconciliations.incrementAndGet();
        orphansRemoved.addAndGet(removedOrphans);
        lastReconciliationMs.set(System.currentTimeMillis());
    }

    public SyncStatistics snapshot(final int queueDepth, final IntSupplier trackedFiles) {
        return new SyncStatistics(
                eventsReceived.get(),
                eventsSuppressed.get(),
                eventsDropped.get(),
                queueDepth,
                filesIndexed.get(),
                filesUnchanged.get(),
                filesSkipped.get(),
                filesRemoved.get(),
                filesFailed.get(),
                malformedLines.get(),
                fullScans.get(),
                reconciliations.get(),
                orphansRemoved.get(),
                lastFullScanMs.get(),
                lastReconciliationMs.get(),
                trackedFiles.getAsInt()
        );
    }
}
