package de.mirkosertic.mcp.ragsync.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.mcp.ragsync.identity.ContentHasher;
import de.mirkosertic.mcp.ragsync.identity.IdentityResolver;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owns the document collection and its JSON persistence.
 * <p>
 * Every mutation holds the write lock while it changes the in-memory collection and rewrites the whole
 * store file, so writers are serialized and readers always see a complete state. The file is written to a
 * sibling temp file first and then moved over the live one. When that write fails the in-memory change is
 * rolled back and the failure propagates to the caller.
 * <p>
 * Destructive operations ({@link #clear}, {@link #applyMerge}) copy the live file to
 * {@code <name>.bak.<unix_seconds>} before they touch anything.
 */
public class DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

    private final Path storeFile;
    private final IdentityResolver identityResolver;
    private final ObjectMapper objectMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Insertion order is the tie breaker for ranking, so keep it
    private final LinkedHashMap<String, Document> documents = new LinkedHashMap<>();
    private String lastUpdated;

    private DocumentStore(final Path storeFile, final IdentityResolver identityResolver) {
        this.storeFile = storeFile;
        this.identityResolver = identityResolver;
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.lastUpdated = Instant.now().toString();
    }

    /**
     * Open the store backed by the given file, creating an empty one if it does not exist.
     *
     * @throws StoreCorruptedException if the file exists but cannot be decoded
     * @throws StoreException          if the file cannot be read or created
     */
    public static DocumentStore open(final Path storeFile, final IdentityResolver identityResolver) throws StoreException {
        final DocumentStore store = new DocumentStore(storeFile.toAbsolutePath(), identityResolver);
        store.load();
        return store;
    }

    private void load() throws StoreException {
        if (!Files.exists(storeFile)) {
            logger.info("Store file {} does not exist, creating an empty store", storeFile);
            try {
                final Path parent = storeFile.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                persist();
            } catch (final IOException e) {
                throw new StoreException("Cannot create store file " + storeFile, e);
            }
            return;
        }

        final StoreFile content;
        try {
            content = objectMapper.readValue(storeFile.toFile(), StoreFile.class);
        } catch (final JsonProcessingException e) {
            logger.error("Store file {} cannot be decoded, refusing to start with an empty collection", storeFile, e);
            throw new StoreCorruptedException(storeFile, e);
        } catch (final IOException e) {
            throw new StoreException("Cannot read store file " + storeFile, e);
        }

        if (content == null) {
            throw new StoreCorruptedException(storeFile, new IOException("empty document"));
        }
        if (content.documents() != null) {
            for (final Document document : content.documents()) {
                if (document.id() == null) {
                    logger.warn("Skipping stored document without id");
                    continue;
                }
                documents.put(document.id(), document);
            }
        }
        if (content.lastUpdated() != null) {
            lastUpdated = content.lastUpdated();
        }
        logger.info("Loaded {} documents from {}", documents.size(), storeFile);
    }

    /**
     * Insert a document.
     * <p>
     * If the resolved id already exists with the same content hash the call is a no-op. If it exists with
     * different content the old record is replaced.
     *
     * @return the id of the stored document
     */
    public String insert(final NewDocument newDocument) throws StoreException {
        return replace(null, newDocument);
    }

    /**
     * Delete {@code previousId} (when present) and insert {@code newDocument} as one atomic step with a
     * single persist. Concurrent readers see either the old or the new state, never the gap in between.
     */
    public String replace(final @Nullable String previousId, final NewDocument newDocument) throws StoreException {
        final Document document = prepare(newDocument);

        lock.writeLock().lock();
        try {
            final Document existing = documents.get(document.id());
            if (existing != null && document.contentHash().equals(existing.contentHash())
                    && (previousId == null || previousId.equals(document.id()))) {
                logger.debug("Document {} already stored with identical content", document.id());
                return existing.id();
            }

            final LinkedHashMap<String, Document> snapshot = new LinkedHashMap<>(documents);
            final String snapshotUpdated = lastUpdated;

            if (previousId != null) {
                documents.remove(previousId);
            }
            if (existing != null && document.contentHash().equals(existing.contentHash())) {
                // Another source already produced this content, keep the older record
                commit(snapshot, snapshotUpdated);
                return existing.id();
            }
            documents.remove(document.id());
            documents.put(document.id(), document);
            commit(snapshot, snapshotUpdated);
            logger.debug("Stored document {} (replaced {})", document.id(), previousId);
            return document.id();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(final String id) throws StoreException {
        lock.writeLock().lock();
        try {
            if (!documents.containsKey(id)) {
                throw new DocumentNotFoundException(id);
            }
            final LinkedHashMap<String, Document> snapshot = new LinkedHashMap<>(documents);
            final String snapshotUpdated = lastUpdated;
            documents.remove(id);
            commit(snapshot, snapshotUpdated);
            logger.debug("Deleted document {}", id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every document.
     *
     * @param confirm must be true, guards against accidental calls
     * @param backup  write a backup of the store file before truncating
     * @throws ConfirmationRequiredException if {@code confirm} is false
     * @throws StoreException                if the backup cannot be written, the collection is left untouched
     */
    public ClearResult clear(final boolean confirm, final boolean backup) throws StoreException {
        if (!confirm) {
            throw new ConfirmationRequiredException();
        }
        lock.writeLock().lock();
        try {
            final Path backupPath = backup ? writeBackup() : null;
            final LinkedHashMap<String, Document> snapshot = new LinkedHashMap<>(documents);
            final String snapshotUpdated = lastUpdated;
            final int removed = documents.size();
            documents.clear();
            commit(snapshot, snapshotUpdated);
            logger.info("Cleared store, removed {} documents (backup: {})", removed, backupPath);
            return new ClearResult(removed, backupPath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply a consolidation. The planner sees the live collection and runs under the write lock, so no
     * insert or replace can land between planning and applying. A non-empty plan is applied after backing
     * up the store file, with a single persist.
     *
     * @return the backup file, or null if the plan was empty
     */
    public @Nullable Path applyMerge(final Function<List<Document>, MergePlan> planner) throws StoreException {
        lock.writeLock().lock();
        try {
            final MergePlan plan = planner.apply(List.copyOf(documents.values()));
            if (plan.isEmpty()) {
                return null;
            }
            final Path backupPath = writeBackup();
            final LinkedHashMap<String, Document> snapshot = new LinkedHashMap<>(documents);
            final String snapshotUpdated = lastUpdated;
            for (final Document document : plan.updated()) {
                if (documents.containsKey(document.id())) {
                    documents.put(document.id(), document);
                }
            }
            for (final String id : plan.removedIds()) {
                documents.remove(id);
            }
            commit(snapshot, snapshotUpdated);
            logger.info("Merged {} documents and removed {} (backup: {})", plan.updated().size(),
                    plan.removedIds().size(), backupPath);
            return backupPath;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Document> get(final String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(documents.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all documents in insertion order.
     */
    public List<Document> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(documents.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Document> findByHash(final String contentHash) {
        lock.readLock().lock();
        try {
            for (final Document document : documents.values()) {
                if (contentHash.equals(document.contentHash())) {
                    return Optional.of(document);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public StoreStatus status() {
        lock.readLock().lock();
        try {
            return new StoreStatus(documents.size(), lastUpdated);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getStoreFile() {
        return storeFile;
    }

    private Document prepare(final NewDocument newDocument) throws EmptyContentException {
        final String content = newDocument.content();
        if (content == null || content.isBlank()) {
            throw new EmptyContentException();
        }
        final String id = newDocument.id() != null && !newDocument.id().isBlank()
                ? newDocument.id()
                : identityResolver.resolve(null, content, newDocument.source(), newDocument.summary());

        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (newDocument.metadata() != null) {
            metadata.putAll(newDocument.metadata());
        }
        metadata.put(Document.CONTENT_HASH, ContentHasher.sha256(content));

        return new Document(id, content, newDocument.source(), newDocument.summary(),
                Instant.now().toString(), metadata);
    }

    private void commit(final LinkedHashMap<String, Document> snapshot, final String snapshotUpdated) throws StoreException {
        lastUpdated = Instant.now().toString();
        try {
            persist();
        } catch (final IOException e) {
            documents.clear();
            documents.putAll(snapshot);
            lastUpdated = snapshotUpdated;
            throw new StoreException("Failed to persist store file " + storeFile + ": " + e.getMessage(), e);
        }
    }

    private void persist() throws IOException {
        final Path tempFile = storeFile.resolveSibling(storeFile.getFileName() + ".tmp");
        objectMapper.writeValue(tempFile.toFile(), new StoreFile(new ArrayList<>(documents.values()), lastUpdated));
        try {
            Files.move(tempFile, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(tempFile, storeFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path writeBackup() throws StoreException {
        long timestamp = Instant.now().getEpochSecond();
        Path backupPath = backupPathFor(timestamp);
        while (Files.exists(backupPath)) {
            backupPath = backupPathFor(++timestamp);
        }
        try {
            if (Files.exists(storeFile)) {
                Files.copy(storeFile, backupPath);
            } else {
                objectMapper.writeValue(backupPath.toFile(), new StoreFile(new ArrayList<>(documents.values()), lastUpdated));
            }
        } catch (final IOException e) {
            throw new StoreException("Failed to write backup " + backupPath + ": " + e.getMessage(), e);
        }
        logger.info("Backup written to {}", backupPath);
        return backupPath;
    }

    private Path backupPathFor(final long epochSeconds) {
        return storeFile.resolveSibling(storeFile.getFileName() + ".bak." + epochSeconds);
    }

    /**
     * On-disk layout of the store file.
     */
    public record StoreFile(List<Document> documents, String lastUpdated) {
    }
}
