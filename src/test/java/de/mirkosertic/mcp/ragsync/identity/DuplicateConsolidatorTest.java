package de.mirkosertic.mcp.ragsync.identity;

import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.NewDocument;
import de.mirkosertic.mcp.ragsync.sync.WatchState;
import de.mirkosertic.mcp.ragsync.sync.WatchStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Tests for duplicate consolidation and store statistics.
 */
@DisplayName("DuplicateConsolidator Tests")
class DuplicateConsolidatorTest {

    private static final String UUID = "3f2504e0-4f89-41d3-9a0c-0305e82c3301";

    @TempDir
    Path tempDir;

    private DocumentStore store;
    private WatchStateRepository watchStates;
    private DuplicateConsolidator consolidator;

    @BeforeEach
    void setUp() throws Exception {
        final IdentityResolver identityResolver = new IdentityResolver();
        store = DocumentStore.open(tempDir.resolve("store.json"), identityResolver);
        watchStates = WatchStateRepository.inMemory();
        consolidator = new DuplicateConsolidator(store, identityResolver, watchStates);
    }

    private void insert(final String id, final String content) throws Exception {
        store.insert(new NewDocument(id, content, "manual", null, null));
    }

    @Nested
    @DisplayName("Content duplicates")
    class ContentDuplicates {

        @Test
        @DisplayName("Should keep only the newest of several documents with the same content")
        void shouldConvergeToNewest() throws Exception {
            insert("note-1", "the same body");
            insert("note-2", "the same body");
            insert("note-3", "the same body");
            insert("other", "a different body");

            final ConsolidationReport report = consolidator.consolidate(false);

            assertThat(report.dryRun()).isFalse();
            assertThat(report.documentsBefore()).isEqualTo(4);
            assertThat(report.documentsAfter()).isEqualTo(2);
            assertThat(report.contentDuplicates()).isEqualTo(2);
            assertThat(report.removedIds()).containsExactlyInAnyOrder("note-1", "note-2");
            assertThat(report.backupPath()).isNotNull();
            assertThat(Path.of(report.backupPath())).exists();
            assertThat(store.list()).extracting(Document::id).containsExactly("note-3", "other");
        }

        @Test
        @DisplayName("Should not change anything on a dry run")
        void shouldNotMutateOnDryRun() throws Exception {
            insert("note-1", "the same body");
            insert("note-2", "the same body");
            final String lastUpdated = store.status().lastUpdated();

            final ConsolidationReport report = consolidator.consolidate(true);

            assertThat(report.dryRun()).isTrue();
            assertThat(report.removedIds()).containsExactly("note-1");
            assertThat(report.documentsAfter()).isEqualTo(1);
            assertThat(report.backupPath()).isNull();
            assertThat(store.list()).hasSize(2);
            assertThat(store.status().lastUpdated()).isEqualTo(lastUpdated);
        }

        @Test
        @DisplayName("Should move watch states of removed documents to the survivor")
        void shouldRepointWatchStates() throws Exception {
            insert("note-1", "the same body");
            insert("note-2", "the same body");
            watchStates.put(new WatchState("/logs/a.jsonl", "note-1", "h", 1, 1, 1));

            consolidator.consolidate(false);

            assertThat(watchStates.get(Path.of("/logs/a.jsonl"))).get()
                    .extracting(WatchState::documentId).isEqualTo("note-2");
        }
    }

    @Nested
    @DisplayName("Conversation groups")
    class ConversationGroups {

        @Test
        @DisplayName("Should merge documents of one conversation and record the superseded ids")
        void shouldMergeConversation() throws Exception {
            store.insert(NewDocument.of("sessionId: " + UUID + " first part", "manual"));
            insert("note-1", "session_id=" + UUID + " second part");

            final ConsolidationReport report = consolidator.consolidate(false);

            assertThat(report.conversationGroups()).isEqualTo(1);
            assertThat(report.conversationDuplicates()).isEqualTo(1);
            assertThat(store.list()).singleElement().satisfies(document -> {
                assertThat(document.id()).isEqualTo("note-1");
                assertThat(document.metadata().get(Document.ORIGINAL_IDS))
                        .isEqualTo(List.of(IdentityResolver.CONVERSATION_PREFIX + UUID));
            });
        }
    }

    @Test
    @DisplayName("Should keep content that was synced after the consolidation started")
    void shouldKeepConcurrentlySyncedContent() throws Exception {
        final String conversationId = IdentityResolver.CONVERSATION_PREFIX + UUID;
        insert("note-1", "sessionId: " + UUID + " early note");
        insert(conversationId, "version one");

        final DocumentStore syncingStore = spy(store);
        doAnswer(invocation -> {
            // The sync worker replaces the conversation right before the merge is applied
            syncingStore.replace(conversationId, new NewDocument(conversationId, "version two", "manual", null, null));
            return invocation.callRealMethod();
        }).when(syncingStore).applyMerge(any());

        final ConsolidationReport report =
                new DuplicateConsolidator(syncingStore, new IdentityResolver(), watchStates).consolidate(false);

        assertThat(report.removedIds()).containsExactly("note-1");
        assertThat(syncingStore.get(conversationId)).hasValueSatisfying(document -> {
            assertThat(document.content()).isEqualTo("version two");
            assertThat(document.metadata().get(Document.ORIGINAL_IDS)).isEqualTo(List.of("note-1"));
        });
    }

    @Test
    @DisplayName("Should merge documents read from the same file")
    void shouldMergeSameFile() throws Exception {
        store.insert(new NewDocument("old", "first version", "/logs/a.jsonl", null,
                Map.of(Document.FILE_PATH, "/logs/a.jsonl")));
        store.insert(new NewDocument("new", "second version", "/logs/a.jsonl", null,
                Map.of(Document.FILE_PATH, "/logs/a.jsonl")));

        final ConsolidationReport report = consolidator.consolidate(false);

        assertThat(report.fileDuplicates()).isEqualTo(1);
        assertThat(store.list()).extracting(Document::id).containsExactly("new");
    }

    @Test
    @DisplayName("Should be a no-op without duplicates")
    void shouldDoNothingWithoutDuplicates() throws Exception {
        store.insert(NewDocument.of("LightRAG is a retrieval system", "manual"));
        store.insert(NewDocument.of("Another note", "manual"));

        final ConsolidationReport report = consolidator.consolidate(false);

        assertThat(report.changed()).isFalse();
        assertThat(report.documentsAfter()).isEqualTo(report.documentsBefore());
        assertThat(report.backupPath()).isNull();
        assertThat(store.list()).hasSize(2);
    }

    @Test
    @DisplayName("Should compute statistics by id type, size and source")
    void shouldComputeStatistics() throws Exception {
        store.insert(NewDocument.of("abc", "manual"));
        store.insert(NewDocument.of("abcdefghij", "manual"));
        store.insert(NewDocument.of("sessionId: " + UUID, "cli"));

        final StoreStatistics statistics = consolidator.statistics();

        assertThat(statistics.totalDocuments()).isEqualTo(3);
        assertThat(statistics.conversationIdCount()).isEqualTo(1);
        assertThat(statistics.documentIdCount()).isEqualTo(2);
        assertThat(statistics.smallestDocument()).isEqualTo(3);
        assertThat(statistics.largestDocument()).isEqualTo(("sessionId: " + UUID).length());
        assertThat(statistics.sources()).containsExactly(Map.entry("manual", 2), Map.entry("cli", 1));
    }

    @Test
    @DisplayName("Should report zero sizes for an empty store")
    void shouldHandleEmptyStore() {
        final StoreStatistics statistics = consolidator.statistics();

        assertThat(statistics.totalDocuments()).isZero();
        assertThat(statistics.smallestDocument()).isZero();
        assertThat(statistics.averageDocumentSize()).isZero();
    }
}
