package de.mirkosertic.mcp.ragsync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilePatternMatcher Tests")
class FilePatternMatcherTest {

    private final FilePatternMatcher matcher =
            new FilePatternMatcher(List.of("*.jsonl", "*.md"), List.of("**/node_modules/**", "**/*.tmp.jsonl"));

    @Test
    @DisplayName("Should include files by name pattern")
    void shouldIncludeByName() {
        assertThat(matcher.shouldInclude(Path.of("/logs/project/session.jsonl"))).isTrue();
        assertThat(matcher.shouldInclude(Path.of("/logs/README.md"))).isTrue();
        assertThat(matcher.shouldInclude(Path.of("/logs/image.png"))).isFalse();
    }

    @Test
    @DisplayName("Should exclude by full path pattern")
    void shouldExcludeByPath() {
        assertThat(matcher.shouldInclude(Path.of("/logs/node_modules/pkg/log.jsonl"))).isFalse();
        assertThat(matcher.shouldInclude(Path.of("/logs/session.tmp.jsonl"))).isFalse();
    }

    @Test
    @DisplayName("Should skip excluded directories")
    void shouldSkipExcludedDirectories() {
        assertThat(matcher.shouldSkipDirectory(Path.of("/logs/node_modules"))).isTrue();
        assertThat(matcher.shouldSkipDirectory(Path.of("/logs/project"))).isFalse();
    }

    @Test
    @DisplayName("Should include everything without include patterns")
    void shouldIncludeAllWithoutPatterns() {
        final FilePatternMatcher all = new FilePatternMatcher(List.of(), List.of());

        assertThat(all.shouldInclude(Path.of("/logs/anything.bin"))).isTrue();
    }
}
