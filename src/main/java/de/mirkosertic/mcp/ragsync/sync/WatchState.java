package de.mirkosertic.mcp.ragsync.sync;

/**
 * What the sync scheduler last saw for one watched file.
 */
public record WatchState(
        String filePath,
        /** Id of the document this file produced; shared when several files have identical content. */
        String documentId,
        /** SHA-256 of the raw file bytes. */
        String lastHash,
        long lastSize,
        /** Epoch millis of the file's last modification. */
        long lastModifiedTime,
        /** Epoch millis of the last time the file was hashed. */
        long lastCheckedTime
) {

    public WatchState checkedAt(final long checkedTimeMs) {
        return new WatchState(filePath, documentId, lastHash, lastSize, lastModifiedTime, checkedTimeMs);
    }

    public WatchState withDocumentId(final String newDocumentId) {
        return new WatchState(filePath, newDocumentId, lastHash, lastSize, lastModifiedTime, lastCheckedTime);
    }
}
