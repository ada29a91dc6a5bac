package de.mirkosertic.mcp.ragsync.mcp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.mcp.ragsync.mcp.Description;
import org.jspecify.annotations.Nullable;

/**
 * Arguments of the rag_consolidate tool.
 */
public record ConsolidateRequest(
        @Nullable
        @JsonProperty("dry_run")
        @Description("Only report what would be merged, change nothing. Default is false.")
        Boolean dryRun
) {
}
