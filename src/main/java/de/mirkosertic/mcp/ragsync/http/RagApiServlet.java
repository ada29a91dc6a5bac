package de.mirkosertic.mcp.ragsync.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.ragsync.api.CommandResult;
import de.mirkosertic.mcp.ragsync.api.RagCommand;
import de.mirkosertic.mcp.ragsync.api.RagCommandHandler;
import de.mirkosertic.mcp.ragsync.api.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON front end of the command handler. Every response, including errors and preflight requests,
 * carries permissive CORS headers so browser based clients can call the API directly.
 */
public class RagApiServlet extends HttpServlet {

    private static final Logger logger = LoggerFactory.getLogger(RagApiServlet.class);

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final transient RagCommandHandler handler;
    private final transient ObjectMapper objectMapper;
    private final int defaultMaxResults;
    private final SearchMode defaultMode;

    public RagApiServlet(final RagCommandHandler handler, final int defaultMaxResults, final SearchMode defaultMode) {
        this.handler = handler;
        this.defaultMaxResults = defaultMaxResults;
        this.defaultMode = defaultMode;
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    protected void service(final HttpServletRequest req, final HttpServletResponse resp) throws IOException {
        addCorsHeaders(resp);

        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            resp.setStatus(HttpServletResponse.SC_OK);
            return;
        }

        final String path = req.getPathInfo() != null ? req.getPathInfo() : req.getServletPath();
        final ApiRoute route = ApiRoute.resolve(req.getMethod(), path);
        if (route == null) {
            logger.debug("No route for {} {}", req.getMethod(), path);
            sendJson(resp, HttpServletResponse.SC_NOT_FOUND, SimpleMessageResponse.error("Unknown endpoint"));
            return;
        }

        final Map<String, Object> body;
        try {
            body = route.hasBody() ? readBody(req) : Map.of();
        } catch (final JsonProcessingException e) {
            logger.debug("Invalid JSON on {}: {}", route.path(), e.getOriginalMessage());
            sendJson(resp, HttpServletResponse.SC_BAD_REQUEST, SimpleMessageResponse.error("Invalid JSON body"));
            return;
        }

        final RagCommand command;
        try {
            command = toCommand(route, body);
        } catch (final IllegalArgumentException e) {
            sendJson(resp, HttpServletResponse.SC_BAD_REQUEST, SimpleMessageResponse.error(e.getMessage()));
            return;
        }

        final CommandResult result = handler.handle(command);
        sendJson(resp, result.status(), result.body());
    }

    private RagCommand toCommand(final ApiRoute route, final Map<String, Object> body) {
        return switch (route) {
            case STATUS -> new RagCommand.Status();
            case DOCUMENTS -> new RagCommand.ListDocuments();
            case QUERY -> RagCommand.Query.fromMap(body, defaultMaxResults, defaultMode);
            case INSERT -> RagCommand.Insert.fromMap(body);
            case DELETE -> RagCommand.Delete.fromMap(body);
            case CLEAR -> RagCommand.Clear.fromMap(body);
        };
    }

    private Map<String, Object> readBody(final HttpServletRequest req) throws IOException {
        final String raw;
        try (final InputStream in = req.getInputStream()) {
            raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        if (raw.isBlank()) {
            return Map.of();
        }
        final Map<String, Object> parsed = objectMapper.readValue(raw, BODY_TYPE);
        return parsed != null ? parsed : Map.of();
    }

    private static void addCorsHeaders(final HttpServletResponse resp) {
        resp.setHeader("Access-Control-Allow-Origin", "*");
        resp.setHeader("Access-Control-Allow-Headers", "Content-Type");
        resp.setHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
    }

    private void sendJson(final HttpServletResponse resp, final int status, final Object body) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(resp.getOutputStream(), body);
    }
}
