package de.mirkosertic.mcp.ragsync.sync;

import java.nio.file.Path;

/**
 * Receives raw, already filtered notifications from the {@link DirectoryWatcherService}.
 */
public interface FileChangeListener {

    void onFileCreated(Path file);

    void onFileModified(Path file);

    void onFileDeleted(Path file);
}
