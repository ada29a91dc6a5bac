package de.mirkosertic.mcp.ragsync.sync;

import java.nio.file.Path;

/**
 * A debounced change of a watched file, queued for the {@link SyncScheduler}.
 */
public record FileEvent(FileEventType type, Path path) {

    public static FileEvent created(final Path path) {
        return new FileEvent(FileEventType.CREATED, path);
    }

    public static FileEvent modified(final Path path) {
        return new FileEvent(FileEventType.MODIFIED, path);
    }

    public static FileEvent deleted(final Path path) {
        return new FileEvent(FileEventType.DELETED, path);
    }
}
