package de.mirkosertic.mcp.ragsync.retrieval;

import de.mirkosertic.mcp.ragsync.api.dto.ContextEntry;
import de.mirkosertic.mcp.ragsync.api.dto.QueryResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns ranked documents into the query response returned to clients.
 */
public final class QueryResponseFormatter {

    static final String UNKNOWN_SOURCE = "unknown";

    private QueryResponseFormatter() {
    }

    public static QueryResponse format(final String query, final List<ScoredDocument> results) {
        if (results.isEmpty()) {
            return new QueryResponse("Response for: \"" + query + "\"", List.of());
        }
        final List<ContextEntry> context = new ArrayList<>(results.size());
        for (final ScoredDocument result : results) {
            final String source = result.document().source();
            context.add(new ContextEntry(
                    result.document().content(),
                    source != null ? source : UNKNOWN_SOURCE,
                    result.document().id(),
                    result.score()));
        }
        return new QueryResponse("Based on the available knowledge, here is the answer for: \"" + query + "\"", context);
    }
}
