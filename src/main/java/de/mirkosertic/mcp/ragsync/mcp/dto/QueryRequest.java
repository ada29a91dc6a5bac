package de.mirkosertic.mcp.ragsync.mcp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.mcp.ragsync.mcp.Description;
import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import org.jspecify.annotations.Nullable;

/**
 * Arguments of the rag_query tool.
 */
public record QueryRequest(
        @Description("Free text query. Documents containing the whole query verbatim rank highest, "
                + "then documents sharing the most query words.")
        String query,

        @Nullable
        @JsonProperty("max_results")
        @Description("Maximum number of documents to return. Default is 5.")
        Integer maxResults,

        @Nullable
        @Description("Scoring mode. 'keyword' uses plain word overlap; 'hybrid' and 'semantic' add term "
                + "frequency and phrase bonuses. Default is hybrid.")
        SearchMode mode
) {
}
