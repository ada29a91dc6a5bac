package de.mirkosertic.mcp.ragsync.store;

import java.util.List;
import java.util.Set;

/**
 * Changes a consolidation wants to apply: documents to overwrite (matched by id) and ids to remove.
 */
public record MergePlan(List<Document> updated, Set<String> removedIds) {

    public MergePlan {
        updated = List.copyOf(updated);
        removedIds = Set.copyOf(removedIds);
    }

    public boolean isEmpty() {
        return updated.isEmpty() && removedIds.isEmpty();
    }
}
