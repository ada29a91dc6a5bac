package de.mirkosertic.mcp.ragsync.sync;

import de.mirkosertic.mcp.ragsync.api.RagCommandHandler;
import de.mirkosertic.mcp.ragsync.http.RagApiServlet;
import de.mirkosertic.mcp.ragsync.http.RagHttpServer;
import de.mirkosertic.mcp.ragsync.identity.DuplicateConsolidator;
import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import de.mirkosertic.mcp.ragsync.retrieval.RelevanceEngine;
import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.NewDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the client against a peer server instance acting as downstream index.
 */
@DisplayName("HttpServedIndexClient Tests")
class HttpServedIndexClientTest {

    @TempDir
    Path tempDir;

    private DocumentStore peerStore;
    private RagHttpServer peer;
    private HttpServedIndexClient client;

    @BeforeEach
    void setUp() throws Exception {
        final IdentityResolver identityResolver = new IdentityResolver();
        peerStore = DocumentStore.open(tempDir.resolve("peer.json"), identityResolver);
        final RagCommandHandler handler = new RagCommandHandler(peerStore, new RelevanceEngine(),
                new DuplicateConsolidator(peerStore, identityResolver, WatchStateRepository.inMemory()),
                null, null, false);
        peer = new RagHttpServer("127.0.0.1", 0, new RagApiServlet(handler, 5, SearchMode.HYBRID));
        peer.start();
        client = new HttpServedIndexClient("http://127.0.0.1:" + peer.getPort(), 2000);
    }

    @AfterEach
    void tearDown() {
        peer.stop();
    }

    @Test
    @DisplayName("Should list served documents with their file paths")
    void shouldListDocuments() throws Exception {
        final String synced = peerStore.insert(new NewDocument(null, "synced body", "/logs/a.jsonl", null,
                Map.of(Document.FILE_PATH, "/logs/a.jsonl")));
        final String manual = peerStore.insert(NewDocument.of("manual body", "manual"));

        final List<ServedDocument> documents = client.listDocuments();

        assertThat(documents).containsExactly(
                new ServedDocument(synced, "/logs/a.jsonl"),
                new ServedDocument(manual, null));
        assertThat(client.reportedDocumentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should delete documents on the peer")
    void shouldDeleteDocument() throws Exception {
        final String id = peerStore.insert(NewDocument.of("to be removed", "manual"));

        client.deleteDocument(id);

        assertThat(peerStore.list()).isEmpty();
    }

    @Test
    @DisplayName("Should fail with an IOException on error responses")
    void shouldFailOnErrorStatus() {
        assertThatThrownBy(() -> client.deleteDocument("doc_missing"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("404");
    }

    @Test
    @DisplayName("Should fail with an IOException when the peer is down")
    void shouldFailWhenUnreachable() {
        peer.stop();

        assertThatThrownBy(() -> client.listDocuments()).isInstanceOf(IOException.class);
    }
}
