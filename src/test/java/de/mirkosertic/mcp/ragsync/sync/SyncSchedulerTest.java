package de.mirkosertic.mcp.ragsync.sync;

import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for turning file changes into store updates.
 */
@DisplayName("SyncScheduler Tests")
class SyncSchedulerTest {

    private static final String LOG = """
            {"type":"summary","summary":"Refactoring the parser"}
            {"type":"user","message":{"role":"user","content":"hello"}}
            {"type":"assistant","message":{"role":"assistant","content":"hi"}}
            """;

    @TempDir
    Path tempDir;

    private Path logs;
    private DocumentStore store;
    private WatchStateRepository watchStates;
    private SyncStatisticsTracker statistics;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        logs = Files.createDirectories(tempDir.resolve("logs"));
        final IdentityResolver identityResolver = new IdentityResolver();
        store = DocumentStore.open(tempDir.resolve("store.json"), identityResolver);
        watchStates = WatchStateRepository.inMemory();
        statistics = new SyncStatisticsTracker();
        final WatchedRoots roots = new WatchedRoots(List.of(logs.toString()),
                new FilePatternMatcher(List.of("*.jsonl"), List.of()));
        scheduler = new SyncScheduler(store, identityResolver, new ConversationLogScanner(), watchStates, roots,
                statistics, 100);
    }

    @Nested
    @DisplayName("Syncing files")
    class SyncingFiles {

        @Test
        @DisplayName("Should index a new log with summary and file metadata")
        void shouldIndexNewFile() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);

            assertThat(scheduler.syncFile(file)).isEqualTo(SyncOutcome.INDEXED);

            assertThat(store.list()).singleElement().satisfies(document -> {
                assertThat(document.id()).startsWith(IdentityResolver.DOCUMENT_PREFIX);
                assertThat(document.summary()).isEqualTo("Refactoring the parser");
                assertThat(document.source()).isEqualTo(file.toAbsolutePath().normalize().toString());
                assertThat(document.filePath()).isEqualTo(document.source());
                assertThat(document.fileName()).isEqualTo("a.jsonl");
                assertThat(document.metadata()).containsEntry("message_count", 2);
            });
            assertThat(watchStates.get(file)).isPresent();
        }

        @Test
        @DisplayName("Should report unchanged files without touching the store")
        void shouldBeIdempotent() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
            scheduler.syncFile(file);
            final String lastUpdated = store.status().lastUpdated();

            assertThat(scheduler.syncFile(file)).isEqualTo(SyncOutcome.UNCHANGED);
            assertThat(scheduler.syncFile(file)).isEqualTo(SyncOutcome.UNCHANGED);

            assertThat(store.list()).hasSize(1);
            assertThat(store.status().lastUpdated()).isEqualTo(lastUpdated);
        }

        @Test
        @DisplayName("Should replace the document when the file changes")
        void shouldReplaceChangedFile() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
            scheduler.syncFile(file);
            final String firstId = store.list().get(0).id();

            Files.writeString(file, LOG + "{\"type\":\"user\",\"message\":\"more\"}\n");
            assertThat(scheduler.syncFile(file)).isEqualTo(SyncOutcome.INDEXED);

            assertThat(store.list()).singleElement().satisfies(document -> {
                assertThat(document.id()).isNotEqualTo(firstId);
                assertThat(document.metadata()).containsEntry("message_count", 3);
            });
            assertThat(watchStates.get(file)).get().extracting(WatchState::documentId)
                    .isEqualTo(store.list().get(0).id());
        }

        @Test
        @DisplayName("Should file a log under its session UUID")
        void shouldUseSessionIdFromFileName() throws Exception {
            final String uuid = "0b5c6f4e-6f2a-4e59-9f6a-1d2b3c4d5e6f";
            final Path file = Files.writeString(logs.resolve(uuid + ".jsonl"), LOG);

            scheduler.syncFile(file);

            assertThat(store.get(IdentityResolver.CONVERSATION_PREFIX + uuid)).isPresent();
        }

        @Test
        @DisplayName("Should count malformed lines and keep the rest")
        void shouldCountMalformedLines() throws Exception {
            final Path file = Files.writeString(logs.resolve("broken.jsonl"),
                    "{\"type\":\"user\",\"message\":\"ok\"}\n{not json\n{\"type\":\"user\",\"message\":\"fine\"}\n");

            assertThat(scheduler.syncFile(file)).isEqualTo(SyncOutcome.INDEXED);

            assertThat(scheduler.getStatistics().malformedLines()).isEqualTo(1);
            assertThat(store.list()).singleElement()
                    .satisfies(document -> assertThat(document.metadata()).containsEntry("malformed_lines", 1));
        }

        @Test
        @DisplayName("Should skip empty files")
        void shouldSkipEmptyFile() throws Exception {
            final Path file = Files.writeString(logs.resolve("empty.jsonl"), "");

            assertThat(scheduler.syncFile(file)).isEqualTo(SyncOutcome.SKIPPED);
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Identical files")
    class IdenticalFiles {

        @Test
        @DisplayName("Should store identical files once and keep the document until both are gone")
        void shouldShareDocument() throws Exception {
            final Path a = Files.writeString(logs.resolve("a.jsonl"), LOG);
            final Path b = Files.writeString(logs.resolve("b.jsonl"), LOG);

            scheduler.syncFile(a);
            scheduler.syncFile(b);

            assertThat(store.list()).hasSize(1);
            final String id = store.list().get(0).id();
            assertThat(watchStates.get(a)).get().extracting(WatchState::documentId).isEqualTo(id);
            assertThat(watchStates.get(b)).get().extracting(WatchState::documentId).isEqualTo(id);

            Files.delete(a);
            assertThat(scheduler.removeFile(a)).isEqualTo(SyncOutcome.REMOVED);
            assertThat(store.get(id)).isPresent();

            Files.delete(b);
            assertThat(scheduler.removeFile(b)).isEqualTo(SyncOutcome.REMOVED);
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deleting files")
    class DeletingFiles {

        @Test
        @DisplayName("Should remove the document of a deleted file")
        void shouldRemoveDocument() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
            scheduler.syncFile(file);

            Files.delete(file);

            assertThat(scheduler.process(FileEvent.deleted(file))).isEqualTo(SyncOutcome.REMOVED);
            assertThat(store.list()).isEmpty();
            assertThat(watchStates.get(file)).isEmpty();
        }

        @Test
        @DisplayName("Should treat a second delete as consistent")
        void shouldTolerateRepeatedDelete() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
            scheduler.syncFile(file);
            Files.delete(file);
            scheduler.removeFile(file);

            assertThat(scheduler.removeFile(file)).isEqualTo(SyncOutcome.ALREADY_CONSISTENT);
        }

        @Test
        @DisplayName("Should re-sync a file that still exists when its delete event arrives")
        void shouldResyncRecreatedFile() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);

            assertThat(scheduler.process(FileEvent.deleted(file))).isEqualTo(SyncOutcome.INDEXED);
            assertThat(store.list()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Full scan")
    class FullScan {

        @Test
        @DisplayName("Should index all matching files and ignore the rest")
        void shouldScanMatchingFiles() throws Exception {
            Files.writeString(logs.resolve("a.jsonl"), LOG);
            Files.writeString(Files.createDirectories(logs.resolve("nested")).resolve("b.jsonl"), LOG + "\n{}");
            Files.writeString(logs.resolve("notes.txt"), "ignored");

            assertThat(scheduler.fullScan()).isEqualTo(2);

            assertThat(store.list()).hasSize(2);
            assertThat(scheduler.getStatistics().fullScans()).isEqualTo(1);
            assertThat(scheduler.getStatistics().trackedFiles()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should re-import files after the store was cleared")
        void shouldReimportAfterClear() throws Exception {
            Files.writeString(logs.resolve("a.jsonl"), LOG);
            scheduler.fullScan();

            store.clear(true, false);
            scheduler.fullScan();

            assertThat(store.list()).extracting(Document::fileName).containsExactly("a.jsonl");
        }

        @Test
        @DisplayName("Should run the full scan on the executor pool")
        void shouldScanWithExecutor() throws Exception {
            Files.writeString(logs.resolve("a.jsonl"), LOG);
            Files.writeString(logs.resolve("b.jsonl"), LOG + "\n{}");
            final SyncExecutorService executor = new SyncExecutorService(2);
            try {
                scheduler.start(executor, 0, false);

                assertThat(scheduler.fullScan()).isEqualTo(2);
                assertThat(store.list()).hasSize(2);
            } finally {
                scheduler.stop();
                executor.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Concurrent access")
    class ConcurrentAccess {

        private List<SyncOutcome> runTogether(final List<Callable<SyncOutcome>> tasks) throws Exception {
            final ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
            final CountDownLatch startGate = new CountDownLatch(1);
            try {
                final List<Future<SyncOutcome>> futures = new ArrayList<>();
                for (final Callable<SyncOutcome> task : tasks) {
                    futures.add(pool.submit(() -> {
                        startGate.await();
                        return task.call();
                    }));
                }
                startGate.countDown();
                final List<SyncOutcome> outcomes = new ArrayList<>();
                for (final Future<SyncOutcome> future : futures) {
                    outcomes.add(future.get(10, TimeUnit.SECONDS));
                }
                return outcomes;
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should index a file once when the worker and a full scan sync it at the same time")
        void shouldConvergeOnConcurrentSync() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
            final List<Callable<SyncOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> scheduler.syncFile(file));
            }

            final List<SyncOutcome> outcomes = runTogether(tasks);

            assertThat(outcomes).containsOnly(SyncOutcome.INDEXED, SyncOutcome.UNCHANGED);
            assertThat(outcomes).filteredOn(outcome -> outcome == SyncOutcome.INDEXED).hasSize(1);
            assertThat(store.list()).hasSize(1);
            assertThat(watchStates.size()).isEqualTo(1);
            assertThat(watchStates.get(file)).map(WatchState::documentId).contains(store.list().get(0).id());
        }

        @Test
        @DisplayName("Should remove a deleted file once when delete and sync race on the same path")
        void shouldConvergeOnConcurrentDeleteAndSync() throws Exception {
            final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
            scheduler.syncFile(file);
            Files.delete(file);
            final List<Callable<SyncOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                tasks.add(() -> scheduler.removeFile(file));
                tasks.add(() -> scheduler.syncFile(file));
            }

            final List<SyncOutcome> outcomes = runTogether(tasks);

            assertThat(outcomes).filteredOn(outcome -> outcome == SyncOutcome.REMOVED).hasSize(1);
            assertThat(outcomes).doesNotContain(SyncOutcome.FAILED, SyncOutcome.INDEXED);
            assertThat(store.list()).isEmpty();
            assertThat(watchStates.size()).isZero();
        }
    }

    @Test
    @DisplayName("Should process queued events on the sync worker")
    void shouldProcessQueuedEvents() throws Exception {
        final Path file = Files.writeString(logs.resolve("a.jsonl"), LOG);
        final SyncExecutorService executor = new SyncExecutorService(1);
        try {
            scheduler.start(executor, 0, false);

            assertThat(scheduler.enqueue(FileEvent.created(file))).isTrue();
        } finally {
            scheduler.stop();
            executor.shutdown();
        }

        assertThat(store.list()).hasSize(1);
        assertThat(scheduler.getStatistics().filesIndexed()).isEqualTo(1);
        assertThat(scheduler.getQueueDepth()).isZero();
    }
}
