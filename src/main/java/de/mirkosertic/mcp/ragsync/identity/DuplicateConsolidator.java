package de.mirkosertic.mcp.ragsync.identity;

import de.mirkosertic.mcp.ragsync.store.Document;
import de.mirkosertic.mcp.ragsync.store.DocumentStore;
import de.mirkosertic.mcp.ragsync.store.MergePlan;
import de.mirkosertic.mcp.ragsync.store.StoreException;
import de.mirkosertic.mcp.ragsync.sync.WatchStateRepository;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Merges documents that describe the same thing into one canonical record.
 * <p>
 * Three passes run over the surviving documents, each keeping the newest member of a group (latest
 * {@code created}, ties going to the later store position):
 * <ol>
 *   <li>same conversation UUID, taken from a {@code conv_} id, the content or the source; the canonical
 *       document records the superseded ids in {@code original_ids},</li>
 *   <li>same {@code content_hash},</li>
 *   <li>same {@code file_path}.</li>
 * </ol>
 * Planning and applying run as one store mutation under the store's write lock, after a backup. Watch
 * states that pointed at a removed id are moved to the id that replaced it.
 */
public class DuplicateConsolidator {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateConsolidator.class);

    private final DocumentStore store;
    private final IdentityResolver identityResolver;
    private final WatchStateRepository watchStates;

    public DuplicateConsolidator(final DocumentStore store, final IdentityResolver identityResolver,
                                 final WatchStateRepository watchStates) {
        this.store = store;
        this.identityResolver = identityResolver;
        this.watchStates = watchStates;
    }

    public ConsolidationReport consolidate(final boolean dryRun) throws StoreException {
        if (dryRun) {
            final Plan plan = plan(store.list());
            logger.info("Consolidation dry run: {} documents, {} removable ({} conversation, {} content, {} file)",
                    plan.documentsBefore(), plan.removedIds().size(), plan.conversationDuplicates(),
                    plan.contentDuplicates(), plan.fileDuplicates());
            return plan.toReport(true, null);
        }

        // Planned under the store's write lock, so a concurrent sync cannot be overwritten by a stale copy
        final AtomicReference<Plan> applied = new AtomicReference<>();
        final Path backup = store.applyMerge(documents -> {
            final Plan plan = plan(documents);
            applied.set(plan);
            return plan.toMergePlan();
        });
        final Plan plan = applied.get();

        if (backup == null) {
            logger.info("Consolidation found nothing to do in {} documents", plan.documentsBefore());
            return plan.toReport(false, null);
        }
        final int repointed = watchStates.repoint(resolveChains(plan.replacedBy()));
        logger.info("Consolidated {} documents into {} ({} conversation, {} content, {} file duplicates), "
                        + "{} watch states re-pointed",
                plan.documentsBefore(), plan.documentsAfter(), plan.conversationDuplicates(),
                plan.contentDuplicates(), plan.fileDuplicates(), repointed);
        return plan.toReport(false, backup.toString());
    }

    private Plan plan(final List<Document> documents) {
        final Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            positions.put(documents.get(i).id(), i);
        }

        final LinkedHashMap<String, Document> survivors = new LinkedHashMap<>();
        for (final Document document : documents) {
            survivors.put(document.id(), document);
        }
        final Map<String, String> replacedBy = new LinkedHashMap<>();
        final Map<String, Document> updated = new LinkedHashMap<>();

        // Conversation groups
        final Map<String, List<Document>> conversationGroups = groupBy(survivors.values(), this::conversationUuid);
        int conversationDuplicates = 0;
        for (final Map.Entry<String, List<Document>> group : conversationGroups.entrySet()) {
            final Document canonical = newest(group.getValue(), positions);
            final Set<String> originalIds = new LinkedHashSet<>(originalIds(canonical));
            for (final Document member : group.getValue()) {
                if (member != canonical) {
                    originalIds.add(member.id());
                    originalIds.addAll(originalIds(member));
                    survivors.remove(member.id());
                    replacedBy.put(member.id(), canonical.id());
                    conversationDuplicates++;
                }
            }
            originalIds.remove(canonical.id());
            final Document merged = canonical.withMetadata(Document.ORIGINAL_IDS, List.copyOf(originalIds));
            survivors.put(canonical.id(), merged);
            updated.put(canonical.id(), merged);
            logger.debug("Conversation {}: keeping {}, superseding {}", group.getKey(), canonical.id(), originalIds);
        }

        final int contentDuplicates = removeDuplicates(survivors, positions, replacedBy, updated,
                document -> Optional.ofNullable(document.contentHash()));
        final int fileDuplicates = removeDuplicates(survivors, positions, replacedBy, updated,
                document -> Optional.ofNullable(document.filePath()));

        final List<Document> toUpdate = new ArrayList<>();
        for (final Document document : updated.values()) {
            if (survivors.containsKey(document.id())) {
                toUpdate.add(document);
            }
        }
        return new Plan(documents.size(), survivors.size(), conversationGroups.size(), conversationDuplicates,
                contentDuplicates, fileDuplicates, replacedBy, toUpdate);
    }

    /**
     * Counts by id type and size over the current store content.
     */
    public StoreStatistics statistics() {
        final List<Document> documents = store.list();
        int conversations = 0;
        int hashed = 0;
        long totalSize = 0;
        int largest = 0;
        int smallest = documents.isEmpty() ? 0 : Integer.MAX_VALUE;
        final Map<String, Integer> sources = new HashMap<>();
        for (final Document document : documents) {
            if (document.id().startsWith(IdentityResolver.CONVERSATION_PREFIX)) {
                conversations++;
            } else if (document.id().startsWith(IdentityResolver.DOCUMENT_PREFIX)) {
                hashed++;
            }
            final int size = document.content().length();
            totalSize += size;
            largest = Math.max(largest, size);
            smallest = Math.min(smallest, size);
            sources.merge(document.source() != null ? document.source() : "unknown", 1, Integer::sum);
        }

        final Map<String, Integer> sortedSources = new LinkedHashMap<>();
        sources.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .forEach(e -> sortedSources.put(e.getKey(), e.getValue()));

        final double average = documents.isEmpty() ? 0.0 : (double) totalSize / documents.size();
        return new StoreStatistics(documents.size(), store.status().lastUpdated(), conversations, hashed,
                average, largest, smallest, sortedSources);
    }

    private Optional<String> conversationUuid(final Document document) {
        return IdentityResolver.uuidFromId(document.id())
                .or(() -> identityResolver.extractUuid(null, document.content(), document.source(), null));
    }

    private static int removeDuplicates(final LinkedHashMap<String, Document> survivors,
                                        final Map<String, Integer> positions,
                                        final Map<String, String> replacedBy,
                                        final Map<String, Document> updated,
                                        final Function<Document, Optional<String>> keyFunction) {
        int removed = 0;
        for (final List<Document> group : groupBy(survivors.values(), keyFunction).values()) {
            final Document canonical = newest(group, positions);
            for (final Document member : group) {
                if (member != canonical) {
                    survivors.remove(member.id());
                    updated.remove(member.id());
                    replacedBy.put(member.id(), canonical.id());
                    removed++;
                }
            }
        }
        return removed;
    }

    /**
     * Groups with at least two members, in order of first appearance.
     */
    private static Map<String, List<Document>> groupBy(final Collection<Document> documents,
                                                       final Function<Document, Optional<String>> keyFunction) {
        final Map<String, List<Document>> groups = new LinkedHashMap<>();
        for (final Document document : documents) {
            keyFunction.apply(document)
                    .ifPresent(key -> groups.computeIfAbsent(key, k -> new ArrayList<>()).add(document));
        }
        groups.values().removeIf(members -> members.size() < 2);
        return groups;
    }

    private static Document newest(final List<Document> group, final Map<String, Integer> positions) {
        Document best = group.get(0);
        for (final Document candidate : group) {
            final int byCreated = createdInstant(candidate).compareTo(createdInstant(best));
            if (byCreated > 0 || (byCreated == 0 && position(candidate, positions) >= position(best, positions))) {
                best = candidate;
            }
        }
        return best;
    }

    private static int position(final Document document, final Map<String, Integer> positions) {
        return positions.getOrDefault(document.id(), -1);
    }

    private static Instant createdInstant(final Document document) {
        if (document.created() == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(document.created());
        } catch (final DateTimeParseException e) {
            logger.debug("Document {} has unparseable created timestamp {}", document.id(), document.created());
            return Instant.EPOCH;
        }
    }

    private static List<String> originalIds(final Document document) {
        final Object value = document.metadata().get(Document.ORIGINAL_IDS);
        if (value instanceof List<?> list) {
            final List<String> ids = new ArrayList<>(list.size());
            for (final Object id : list) {
                if (id != null) {
                    ids.add(id.toString());
                }
            }
            return ids;
        }
        return List.of();
    }

    private record Plan(int documentsBefore, int documentsAfter, int conversationGroups,
                        int conversationDuplicates, int contentDuplicates, int fileDuplicates,
                        Map<String, String> replacedBy, List<Document> updated) {

        List<String> removedIds() {
            return List.copyOf(replacedBy.keySet());
        }

        MergePlan toMergePlan() {
            if (replacedBy.isEmpty()) {
                return new MergePlan(List.of(), Set.of());
            }
            return new MergePlan(updated, replacedBy.keySet());
        }

        ConsolidationReport toReport(final boolean dryRun, final @Nullable String backupPath) {
            return new ConsolidationReport(dryRun, documentsBefore, documentsAfter, conversationGroups,
                    conversationDuplicates, contentDuplicates, fileDuplicates, removedIds(), backupPath);
        }
    }

    /**
     * A document removed in the content pass may itself have replaced one from the conversation pass;
     * follow the chain to the final survivor.
     */
    private static Map<String, String> resolveChains(final Map<String, String> replacedBy) {
        final Map<String, String> resolved = new HashMap<>();
        for (final String removedId : replacedBy.keySet()) {
            String target = replacedBy.get(removedId);
            int hops = 0;
            while (replacedBy.containsKey(target) && hops++ < replacedBy.size()) {
                target = replacedBy.get(target);
            }
            resolved.put(removedId, target);
        }
        return resolved;
    }
}
