package de.mirkosertic.mcp.ragsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches directory trees with the JDK {@link WatchService} and forwards changes of matching files.
 * <p>
 * Files rejected by the {@link FilePatternMatcher} never reach the listener. Directories created while
 * watching are registered on the fly; matching files already inside them are reported as created.
 */
public class DirectoryWatcherService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcherService.class);

    private final FilePatternMatcher patternMatcher;
    private final long pollIntervalMs;
    private final Map<WatchKey, WatchInfo> watchKeys = new ConcurrentHashMap<>();
    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final ExecutorService watchExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "directory-watcher");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WatchService watchService;

    public DirectoryWatcherService(final FilePatternMatcher patternMatcher, final long pollIntervalMs) {
        this.patternMatcher = patternMatcher;
        this.pollIntervalMs = pollIntervalMs;
    }

    public synchronized void watchDirectory(final Path directory, final FileChangeListener listener) throws IOException {
        if (watchService == null) {
            watchService = FileSystems.getDefault().newWatchService();
        }

        registerRecursive(directory, listener, false);

        if (loopStarted.compareAndSet(false, true)) {
            watchExecutor.execute(this::processEvents);
        }
    }

    public int getWatchedDirectoryCount() {
        return watchKeys.size();
    }

    private void registerRecursive(final Path directory, final FileChangeListener listener,
                                   final boolean reportExistingFiles) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(directory) && patternMatcher.shouldSkipDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, new WatchInfo(dir, listener));
                logger.debug("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (reportExistingFiles && attrs.isRegularFile() && patternMatcher.shouldInclude(file)) {
                    listener.onFileCreated(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException e) {
                logger.warn("Cannot access {} while registering watches: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void processEvents() {
        logger.info("Directory watcher started");

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final WatchInfo watchInfo = watchKeys.get(key);
            if (watchInfo == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();

                if (kind == OVERFLOW) {
                    // Lost events are picked up by the next full scan
                    logger.warn("Watch event overflow in {}", watchInfo.directory());
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = watchInfo.directory().resolve(pathEvent.context());

                try {
                    dispatch(kind, fullPath, watchInfo.listener());
                } catch (final IOException | RuntimeException e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            if (!key.reset()) {
                watchKeys.remove(key);
                logger.info("Watch key for {} no longer valid, removed from tracking", watchInfo.directory());
            }
        }

        logger.info("Directory watcher stopped");
    }

    private void dispatch(final WatchEvent.Kind<?> kind, final Path fullPath, final FileChangeListener listener) throws IOException {
        if (kind == ENTRY_CREATE && Files.isDirectory(fullPath)) {
            if (!patternMatcher.shouldSkipDirectory(fullPath)) {
                registerRecursive(fullPath, listener, true);
            }
            return;
        }
        if (!patternMatcher.shouldInclude(fullPath)) {
            return;
        }
        if (kind == ENTRY_CREATE) {
            if (Files.isRegularFile(fullPath)) {
                listener.onFileCreated(fullPath);
            }
        } else if (kind == ENTRY_MODIFY) {
            if (Files.isRegularFile(fullPath)) {
                listener.onFileModified(fullPath);
            }
        } else if (kind == ENTRY_DELETE) {
            listener.onFileDeleted(fullPath);
        }
    }

    /**
     * Stop the watch loop and release all OS watch registrations.
     */
    public synchronized void stopAll() {
        logger.info("Stopping all directory watchers");
        watchExecutor.shutdownNow();

        if (watchService != null) {
            try {
                watchService.close();
            } catch (final IOException e) {
                logger.warn("Error closing watch service", e);
            }
        }

        watchKeys.clear();
    }

    private record WatchInfo(Path directory, FileChangeListener listener) {
    }
}
