package de.mirkosertic.mcp.ragsync.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored knowledge base entry, serialized as-is into the store file.
 *
 * @param id       unique id, stable across re-syncs of the same source
 * @param content  full text body
 * @param source   origin tag, the file path for synced files
 * @param summary  short human readable label
 * @param created  ISO-8601 timestamp of the insertion that produced this record
 * @param metadata open map, always carries {@link #CONTENT_HASH}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Document(
        String id,
        String content,
        @Nullable String source,
        @Nullable String summary,
        String created,
        Map<String, Object> metadata
) {

    public static final String CONTENT_HASH = "content_hash";
    public static final String FILE_PATH = "file_path";
    public static final String FILE_NAME = "file_name";
    public static final String ORIGINAL_IDS = "original_ids";

    public Document {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @JsonIgnore
    public @Nullable String contentHash() {
        return stringMetadata(CONTENT_HASH);
    }

    @JsonIgnore
    public @Nullable String filePath() {
        return stringMetadata(FILE_PATH);
    }

    @JsonIgnore
    public @Nullable String fileName() {
        return stringMetadata(FILE_NAME);
    }

    /**
     * Copy of this document with one metadata entry replaced.
     */
    public Document withMetadata(final String key, final Object value) {
        final Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Document(id, content, source, summary, created, copy);
    }

    private @Nullable String stringMetadata(final String key) {
        final Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
