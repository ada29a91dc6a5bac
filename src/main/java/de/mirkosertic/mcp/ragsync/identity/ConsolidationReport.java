package de.mirkosertic.mcp.ragsync.identity;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of a consolidation run.
 *
 * @param dryRun                   true if nothing was changed
 * @param documentsBefore          store size before the run
 * @param documentsAfter           store size after the run, or the planned size for a dry run
 * @param conversationGroups       UUID groups with more than one member
 * @param conversationDuplicates   documents removed because another one holds the same conversation
 * @param contentDuplicates        documents removed because another one has the same content hash
 * @param fileDuplicates           documents removed because another one was read from the same file
 * @param removedIds               every removed (or, for a dry run, removable) id
 * @param backupPath               backup written before the change, null for a dry run or a no-op
 */
public record ConsolidationReport(
        boolean dryRun,
        int documentsBefore,
        int documentsAfter,
        int conversationGroups,
        int conversationDuplicates,
        int contentDuplicates,
        int fileDuplicates,
        List<String> removedIds,
        @Nullable String backupPath
) {

    public boolean changed() {
        return !removedIds.isEmpty();
    }
}
