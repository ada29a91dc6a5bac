package de.mirkosertic.mcp.ragsync.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory {@link WatchState} table keyed by file path, optionally persisted as YAML.
 * <p>
 * Mutations only mark the table dirty; {@link #saveIfDirty()} writes it. The sync scheduler calls that
 * whenever its queue runs empty, after each full scan and on shutdown. Without a state file the table lives
 * in memory only and the first full scan after a restart re-hashes everything.
 */
public class WatchStateRepository {

    private static final Logger logger = LoggerFactory.getLogger(WatchStateRepository.class);

    private final @Nullable Path stateFile;
    private final Yaml yaml;
    private final Map<String, WatchState> states = new ConcurrentHashMap<>();
    private final AtomicBoolean dirty = new AtomicBoolean(false);

    public WatchStateRepository(final @Nullable Path stateFile) {
        this.stateFile = stateFile;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    public static WatchStateRepository inMemory() {
        return new WatchStateRepository(null);
    }

    public Optional<WatchState> get(final Path file) {
        return Optional.ofNullable(states.get(key(file)));
    }

    public void put(final WatchState state) {
        states.put(state.filePath(), state);
        dirty.set(true);
    }

    public Optional<WatchState> remove(final Path file) {
        return remove(key(file));
    }

    public Optional<WatchState> remove(final String filePath) {
        final WatchState removed = states.remove(filePath);
        if (removed != null) {
            dirty.set(true);
        }
        return Optional.ofNullable(removed);
    }

    public Collection<WatchState> all() {
        return List.copyOf(states.values());
    }

    public int size() {
        return states.size();
    }

    /**
     * True if a file other than {@code exceptFile} is linked to the document.
     */
    public boolean isReferencedElsewhere(final String documentId, final String exceptFile) {
        for (final WatchState state : states.values()) {
            if (documentId.equals(state.documentId()) && !state.filePath().equals(exceptFile)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Document ids linked from any of the given files.
     */
    public Set<String> documentIdsFor(final Set<String> filePaths) {
        final Set<String> ids = new HashSet<>();
        for (final WatchState state : states.values()) {
            if (filePaths.contains(state.filePath())) {
                ids.add(state.documentId());
            }
        }
        return ids;
    }

    /**
     * Move links from superseded document ids to their replacement.
     *
     * @param replacements superseded id to surviving id
     * @return number of states that changed
     */
    public int repoint(final Map<String, String> replacements) {
        int changed = 0;
        for (final WatchState state : List.copyOf(states.values())) {
            final String replacement = replacements.get(state.documentId());
            if (replacement != null) {
                states.put(state.filePath(), state.withDocumentId(replacement));
                changed++;
            }
        }
        if (changed > 0) {
            dirty.set(true);
        }
        return changed;
    }

    public static String key(final Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    public synchronized void load() {
        if (stateFile == null || !Files.exists(stateFile)) {
            logger.debug("No watch state file to load");
            return;
        }
        try (final Reader reader = Files.newBufferedReader(stateFile)) {
            final Map<String, Object> root = yaml.load(reader);
            if (root == null || !(root.get("files") instanceof List<?> files)) {
                logger.debug("Watch state file is empty: {}", stateFile);
                return;
            }
            for (final Object entry : files) {
                if (entry instanceof Map<?, ?> map && map.get("filePath") != null && map.get("documentId") != null) {
                    final WatchState state = fromMap(map);
                    states.put(state.filePath(), state);
                }
            }
            logger.info("Loaded watch state for {} files from {}", states.size(), stateFile);
        } catch (final IOException e) {
            logger.error("Failed to load watch state file: {}", stateFile, e);
        } catch (final ClassCastException | YAMLException e) {
            // Only costs a re-hash of every file on the next scan
            logger.error("Invalid watch state file {}, starting without state", stateFile, e);
            states.clear();
        }
    }

    public synchronized void saveIfDirty() throws IOException {
        if (stateFile == null || !dirty.getAndSet(false)) {
            return;
        }
        final List<Map<String, Object>> files = new ArrayList<>();
        for (final WatchState state : states.values()) {
            files.add(toMap(state));
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("files", files);

        final Path parent = stateFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path tempFile = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            try (final Writer writer = Files.newBufferedWriter(tempFile,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                yaml.dump(root, writer);
            }
            try {
                Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            dirty.set(true);
            throw e;
        }
        logger.debug("Saved watch state for {} files", files.size());
    }

    private static Map<String, Object> toMap(final WatchState state) {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("filePath", state.filePath());
        map.put("documentId", state.documentId());
        map.put("lastHash", state.lastHash());
        map.put("lastSize", state.lastSize());
        map.put("lastModifiedTime", state.lastModifiedTime());
        map.put("lastCheckedTime", state.lastCheckedTime());
        return map;
    }

    private static WatchState fromMap(final Map<?, ?> map) {
        return new WatchState(
                (String) map.get("filePath"),
                (String) map.get("documentId"),
                (String) map.get("lastHash"),
                longValue(map.get("lastSize")),
                longValue(map.get("lastModifiedTime")),
                longValue(map.get("lastCheckedTime"))
        );
    }

    private static long longValue(final @Nullable Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
