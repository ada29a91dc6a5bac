package de.mirkosertic.mcp.ragsync.sync;

import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.NewDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for orphan detection and bounded removal.
 */
@DisplayName("ReconciliationService Tests")
class ReconciliationServiceTest {

    @TempDir
    Path tempDir;

    private Path logs;
    private DocumentStore store;
    private WatchStateRepository watchStates;
    private WatchedRoots roots;
    private SyncStatisticsTracker statistics;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        logs = Files.createDirectories(tempDir.resolve("logs"));
        final IdentityResolver identityResolver = new IdentityResolver();
        store = DocumentStore.open(tempDir.resolve("store.json"), identityResolver);
        watchStates = WatchStateRepository.inMemory();
        statistics = new SyncStatisticsTracker();
        roots = new WatchedRoots(List.of(logs.toString()), new FilePatternMatcher(List.of("*.jsonl"), List.of()));
        scheduler = new SyncScheduler(store, identityResolver, new ConversationLogScanner(), watchStates, roots,
                statistics, 100);
    }

    private ReconciliationService service(final ServedIndexClient servedIndex) {
        return new ReconciliationService(store, watchStates, roots, statistics, servedIndex, 5, 0.5);
    }

    private List<Path> syncFiles(final int count) throws IOException {
        final List<Path> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            final Path file = Files.writeString(logs.resolve("log-" + i + ".jsonl"),
                    "{\"type\":\"user\",\"message\":\"entry " + i + "\"}\n");
            scheduler.syncFile(file);
            files.add(file);
        }
        return files;
    }

    @Nested
    @DisplayName("Local orphans")
    class LocalOrphans {

        @Test
        @DisplayName("Should remove at most five orphans per tick")
        void shouldRemoveInBatches() throws Exception {
            for (final Path file : syncFiles(8)) {
                Files.delete(file);
            }
            final ReconciliationService service = service(null);

            final ReconciliationResult first = service.reconcile();
            assertThat(first.localOrphans()).isEqualTo(8);
            assertThat(first.removedIds()).hasSize(5);
            assertThat(first.deferredOrphans()).isEqualTo(3);
            assertThat(store.list()).hasSize(3);

            final ReconciliationResult second = service.reconcile();
            assertThat(second.removedIds()).hasSize(3);
            assertThat(store.list()).isEmpty();
            assertThat(watchStates.size()).isZero();

            assertThat(service.reconcile().removedIds()).isEmpty();
            assertThat(statistics.snapshot(0, () -> 0).orphansRemoved()).isEqualTo(8);
            assertThat(statistics.snapshot(0, () -> 0).reconciliations()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should keep documents whose file still exists")
        void shouldKeepLiveDocuments() throws Exception {
            final List<Path> files = syncFiles(3);
            Files.delete(files.get(0));

            final ReconciliationResult result = service(null).reconcile();

            assertThat(result.filesOnDisk()).isEqualTo(2);
            assertThat(result.trackedDocuments()).isEqualTo(3);
            assertThat(result.removedIds()).hasSize(1);
            assertThat(store.list()).hasSize(2);
        }

        @Test
        @DisplayName("Should keep a document whose file moved to another directory under the same name")
        void shouldMatchByBaseName() throws Exception {
            final Path file = syncFiles(1).get(0);
            Files.move(file, Files.createDirectories(logs.resolve("archive")).resolve(file.getFileName()));

            assertThat(service(null).reconcile().localOrphans()).isZero();
            assertThat(store.list()).hasSize(1);
        }

        @Test
        @DisplayName("Should keep documents under a root that is not available")
        void shouldKeepDocumentsOfUnavailableRoot() throws Exception {
            final Path file = syncFiles(1).get(0);
            Files.delete(file);
            Files.delete(logs);

            final ReconciliationResult result = service(null).reconcile();

            assertThat(result.localOrphans()).isZero();
            assertThat(store.list()).hasSize(1);
        }

        @Test
        @DisplayName("Should ignore documents that were not synced from files")
        void shouldIgnoreManualDocuments() throws Exception {
            store.insert(NewDocument.of("a manual note", "manual"));

            final ReconciliationResult result = service(null).reconcile();

            assertThat(result.trackedDocuments()).isZero();
            assertThat(store.list()).hasSize(1);
        }

        @Test
        @DisplayName("Should count files that have no document yet")
        void shouldCountMissingDocuments() throws Exception {
            Files.writeString(logs.resolve("new.jsonl"), "{\"message\":\"x\"}\n");

            final ReconciliationResult result = service(null).reconcile();

            assertThat(result.missingDocuments()).isEqualTo(1);
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Downstream index")
    class DownstreamIndex {

        @Test
        @DisplayName("Should delete downstream documents whose file is gone")
        void shouldRemoveDownstreamOrphans() throws Exception {
            final Path live = syncFiles(1).get(0);
            final ServedIndexClient servedIndex = mock(ServedIndexClient.class);
            when(servedIndex.listDocuments()).thenReturn(List.of(
                    new ServedDocument("doc_live", live.toString()),
                    new ServedDocument("doc_gone", logs.resolve("gone.jsonl").toString()),
                    new ServedDocument("doc_manual", null)));
            when(servedIndex.reportedDocumentCount()).thenReturn(3L);

            final ReconciliationResult result = service(servedIndex).reconcile();

            assertThat(result.downstreamOrphans()).isEqualTo(1);
            assertThat(result.removedIds()).containsExactly("doc_gone");
            assertThat(result.corruptionSuspected()).isFalse();
            verify(servedIndex).deleteDocument("doc_gone");
            verify(servedIndex, never()).deleteDocument("doc_live");
        }

        @Test
        @DisplayName("Should skip downstream removal when the index lists far fewer documents than it reports")
        void shouldDetectCorruption() throws Exception {
            final ServedIndexClient servedIndex = mock(ServedIndexClient.class);
            when(servedIndex.listDocuments()).thenReturn(List.of(
                    new ServedDocument("doc_gone", logs.resolve("gone.jsonl").toString())));
            when(servedIndex.reportedDocumentCount()).thenReturn(100L);

            final ReconciliationResult result = service(servedIndex).reconcile();

            assertThat(result.corruptionSuspected()).isTrue();
            assertThat(result.servedDocuments()).isEqualTo(1);
            assertThat(result.reportedServedCount()).isEqualTo(100);
            verify(servedIndex, never()).deleteDocument(anyString());
        }

        @Test
        @DisplayName("Should reconcile the local store when the downstream index is unreachable")
        void shouldTolerateUnreachableIndex() throws Exception {
            Files.delete(syncFiles(1).get(0));
            final ServedIndexClient servedIndex = mock(ServedIndexClient.class);
            when(servedIndex.listDocuments()).thenThrow(new IOException("connection refused"));

            final ReconciliationResult result = service(servedIndex).reconcile();

            assertThat(result.servedDocuments()).isEqualTo(-1);
            assertThat(result.removedIds()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should skip a reconcile call while another one is running")
    void shouldBeSingleFlight() throws Exception {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final ServedIndexClient servedIndex = mock(ServedIndexClient.class);
        when(servedIndex.listDocuments()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        final ReconciliationService service = service(servedIndex);

        final CompletableFuture<ReconciliationResult> running = CompletableFuture.supplyAsync(service::reconcile);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isRunning()).isTrue();
        assertThat(service.reconcile().executed()).isFalse();

        release.countDown();
        assertThat(running.get(5, TimeUnit.SECONDS).executed()).isTrue();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should expose the result shape of a skipped tick")
    void shouldDescribeSkippedTick() {
        assertThat(ReconciliationResult.skipped()).extracting(ReconciliationResult::executed,
                        ReconciliationResult::removedIds)
                .containsExactly(false, List.of());
    }

    @Test
    @DisplayName("Should leave metadata of kept documents untouched")
    void shouldNotRewriteKeptDocuments() throws Exception {
        syncFiles(2);
        final Map<String, Object> before = store.list().get(0).metadata();

        service(null).reconcile();

        assertThat(store.list().get(0).metadata()).isEqualTo(before);
    }
}
