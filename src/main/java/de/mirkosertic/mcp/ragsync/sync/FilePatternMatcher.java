package de.mirkosertic.mcp.ragsync.sync;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files take part in synchronization. Include globs match the file name
 * (for example {@code *.jsonl}), exclude globs match the full path.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(FilePatternMatcher::globMatcher)
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(FilePatternMatcher::globMatcher)
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        if (isExcluded(file)) {
            return false;
        }
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        if (includeMatchers.isEmpty()) {
            return true;
        }
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if a directory matches an exclude glob, so neither it nor anything below it is watched.
     * Globs of the form {@code **}{@code /name/**} are also tried against the directory with a trailing child.
     */
    public boolean shouldSkipDirectory(final Path directory) {
        return isExcluded(directory) || isExcluded(directory.resolve("_"));
    }

    private boolean isExcluded(final Path path) {
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static PathMatcher globMatcher(final String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }
}
