package de.mirkosertic.mcp.ragsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ServedIndexClient} for a peer server speaking this server's HTTP API
 * ({@code GET /status}, {@code GET /documents}, {@code POST /delete}).
 */
public class HttpServedIndexClient implements ServedIndexClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpServedIndexClient.class);

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpServedIndexClient(final String baseUrl, final long timeoutMs) {
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.timeout = Duration.ofMillis(timeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public long reportedDocumentCount() throws IOException {
        final JsonNode status = send(HttpRequest.newBuilder(baseUri.resolve("status")).GET());
        if (!status.has("documents")) {
            throw new IOException("Downstream status response has no document count");
        }
        return status.get("documents").asLong();
    }

    @Override
    public List<ServedDocument> listDocuments() throws IOException {
        final JsonNode listing = send(HttpRequest.newBuilder(baseUri.resolve("documents")).GET());
        final JsonNode documents = listing.get("documents");
        if (documents == null || !documents.isArray()) {
            throw new IOException("Downstream listing response has no documents array");
        }
        final List<ServedDocument> result = new ArrayList<>(documents.size());
        for (final JsonNode document : documents) {
            final JsonNode filePath = document.get("file_path");
            result.add(new ServedDocument(
                    document.path("id").asText(),
                    filePath != null && filePath.isTextual() ? filePath.asText() : null));
        }
        return result;
    }

    @Override
    public void deleteDocument(final String id) throws IOException {
        final String body = objectMapper.writeValueAsString(Map.of("id", id));
        send(HttpRequest.newBuilder(baseUri.resolve("delete"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body)));
        logger.debug("Deleted {} from downstream index {}", id, baseUri);
    }

    private JsonNode send(final HttpRequest.Builder builder) throws IOException {
        final HttpRequest request = builder.timeout(timeout).build();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + request.uri(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Downstream " + request.method() + " " + request.uri()
                    + " returned HTTP " + response.statusCode());
        }
        return objectMapper.readTree(response.body());
    }
}
