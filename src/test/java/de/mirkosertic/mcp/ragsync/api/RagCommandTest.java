package de.mirkosertic.mcp.ragsync.api;

import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RagCommand Tests")
class RagCommandTest {

    @Test
    @DisplayName("Should apply defaults to a query without options")
    void shouldDefaultQueryOptions() {
        final RagCommand.Query query = RagCommand.Query.fromMap(Map.of("query", "caching"), 5, SearchMode.HYBRID);

        assertThat(query.maxResults()).isEqualTo(5);
        assertThat(query.mode()).isEqualTo(SearchMode.HYBRID);
    }

    @Test
    @DisplayName("Should read snake_case options and accept numbers as strings")
    void shouldParseQueryOptions() {
        final RagCommand.Query query = RagCommand.Query.fromMap(
                Map.of("query", "caching", "max_results", "3", "mode", "KEYWORD"), 5, SearchMode.HYBRID);

        assertThat(query.maxResults()).isEqualTo(3);
        assertThat(query.mode()).isEqualTo(SearchMode.KEYWORD);
    }

    @Test
    @DisplayName("Should reject invalid queries")
    void shouldRejectInvalidQueries() {
        assertThatThrownBy(() -> RagCommand.Query.fromMap(Map.of(), 5, SearchMode.HYBRID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Query");
        assertThatThrownBy(() -> RagCommand.Query.fromMap(Map.of("query", "x", "max_results", 0), 5, SearchMode.HYBRID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_results");
        assertThatThrownBy(() -> RagCommand.Query.fromMap(Map.of("query", "x", "max_results", "many"), 5, SearchMode.HYBRID))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RagCommand.Query.fromMap(Map.of("query", "x", "mode", "vector"), 5, SearchMode.HYBRID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vector");
    }

    @Test
    @DisplayName("Should default the insert source and drop null metadata values")
    void shouldNormalizeInsert() {
        final Map<String, Object> metadata = new HashMap<>();
        metadata.put("topic", "build");
        metadata.put("empty", null);

        final RagCommand.Insert insert = RagCommand.Insert.fromMap(Map.of("text", "note", "metadata", metadata));

        assertThat(insert.source()).isEqualTo(RagCommand.Insert.DEFAULT_SOURCE);
        assertThat(insert.summary()).isNull();
        assertThat(insert.metadata()).containsExactly(Map.entry("topic", "build"));
    }

    @Test
    @DisplayName("Should reject metadata that is not an object")
    void shouldRejectScalarMetadata() {
        assertThatThrownBy(() -> RagCommand.Insert.fromMap(Map.of("text", "note", "metadata", "flat")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("metadata");
    }

    @Test
    @DisplayName("Should require confirmation flags to be given explicitly")
    void shouldDefaultFlagsToFalse() {
        assertThat(RagCommand.Clear.fromMap(Map.of()).confirm()).isFalse();
        assertThat(RagCommand.Clear.fromMap(Map.of("confirm", "true")).confirm()).isTrue();
        assertThat(RagCommand.Consolidate.fromMap(Map.of()).dryRun()).isFalse();
        assertThat(RagCommand.Consolidate.fromMap(Map.of("dry_run", true)).dryRun()).isTrue();
    }

    @Test
    @DisplayName("Should reject a delete without id")
    void shouldRejectDeleteWithoutId() {
        assertThatThrownBy(() -> RagCommand.Delete.fromMap(Map.of("id", " ")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
