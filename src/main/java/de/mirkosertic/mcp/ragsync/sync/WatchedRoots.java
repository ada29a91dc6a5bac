package de.mirkosertic.mcp.ragsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The configured root directories together with the file filter, shared by the full scan,
 * the watcher setup and reconciliation.
 */
public class WatchedRoots {

    private static final Logger logger = LoggerFactory.getLogger(WatchedRoots.class);

    private final List<Path> roots;
    private final FilePatternMatcher patternMatcher;

    public WatchedRoots(final List<String> directories, final FilePatternMatcher patternMatcher) {
        final List<Path> resolved = new ArrayList<>();
        for (final String directory : directories) {
            resolved.add(Paths.get(directory).toAbsolutePath().normalize());
        }
        this.roots = List.copyOf(resolved);
        this.patternMatcher = patternMatcher;
    }

    public List<Path> getRoots() {
        return roots;
    }

    public FilePatternMatcher getPatternMatcher() {
        return patternMatcher;
    }

    public boolean isAvailable(final Path root) {
        return Files.isDirectory(root);
    }

    /**
     * True if the path lies under a configured root that currently is not reachable, for example an
     * unmounted volume. Files there are neither present nor known to be gone.
     */
    public boolean isUnderUnavailableRoot(final Path file) {
        final Path normalized = file.toAbsolutePath().normalize();
        for (final Path root : roots) {
            if (normalized.startsWith(root) && !isAvailable(root)) {
                return true;
            }
        }
        return false;
    }

    /**
     * All matching regular files below the available roots, as normalized absolute paths.
     */
    public Set<Path> collectFilesOnDisk() {
        return snapshot().files();
    }

    /**
     * Walk all available roots. The snapshot is incomplete when a root could not be walked to the end.
     */
    public DiskSnapshot snapshot() {
        final Set<Path> result = new LinkedHashSet<>();
        boolean complete = true;
        for (final Path root : roots) {
            if (!isAvailable(root)) {
                logger.warn("Skipping non-existent or non-directory root: {}", root);
                continue;
            }
            try (final Stream<Path> paths = Files.walk(root)) {
                paths.filter(Files::isRegularFile)
                        .filter(patternMatcher::shouldInclude)
                        .forEach(file -> result.add(file.toAbsolutePath().normalize()));
            } catch (final IOException | UncheckedIOException e) {
                logger.warn("Error walking root {}: {}", root, e.getMessage());
                complete = false;
            }
        }
        return new DiskSnapshot(result, complete);
    }

    /**
     * Files found on disk and whether every available root was walked completely.
     */
    public record DiskSnapshot(Set<Path> files, boolean complete) {
    }
}
