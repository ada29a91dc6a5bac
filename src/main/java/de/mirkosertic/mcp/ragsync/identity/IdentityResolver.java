package de.mirkosertic.mcp.ragsync.identity;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives stable document ids.
 * <p>
 * A conversation UUID found in the file name, the content, the source or the summary (in that order)
 * yields {@code conv_<uuid>}. Without one, the id is {@code doc_} followed by a truncated SHA-256 of the
 * content, so identical bodies always map to the same id regardless of where they came from.
 * <p>
 * The resolver holds no state and is safe to share between threads.
 */
public class IdentityResolver {

    public static final String CONVERSATION_PREFIX = "conv_";
    public static final String DOCUMENT_PREFIX = "doc_";

    static final int HASH_ID_LENGTH = 16;

    private static final String UUID_REGEX =
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private static final Pattern UUID_PATTERN = Pattern.compile(UUID_REGEX, Pattern.CASE_INSENSITIVE);

    private static final Pattern SESSION_KEY_PATTERN = Pattern.compile(
            "session_?id[\"']?\\s*[:=]\\s*[\"']?(" + UUID_REGEX + ")", Pattern.CASE_INSENSITIVE);

    private static final Pattern LOG_FILE_REFERENCE_PATTERN = Pattern.compile(
            "(" + UUID_REGEX + ")\\.jsonl", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONVERSATION_ID_PATTERN = Pattern.compile(
            Pattern.quote(CONVERSATION_PREFIX) + "(" + UUID_REGEX + ")");

    /**
     * Resolve the canonical id for a document.
     *
     * @param fileName base name of the originating file, null for documents that were not read from disk
     * @param content  document body
     * @param source   origin tag, may embed a UUID
     * @param summary  label, may embed a UUID
     */
    public String resolve(final @Nullable String fileName, final String content,
                          final @Nullable String source, final @Nullable String summary) {
        return extractUuid(fileName, content, source, summary)
                .map(uuid -> CONVERSATION_PREFIX + uuid)
                .orElseGet(() -> hashId(content));
    }

    public Optional<String> extractUuid(final @Nullable String fileName, final @Nullable String content,
                                        final @Nullable String source, final @Nullable String summary) {
        Optional<String> uuid = findUuid(fileName);
        if (uuid.isEmpty()) {
            uuid = findUuidInContent(content);
        }
        if (uuid.isEmpty()) {
            uuid = findUuid(source);
        }
        if (uuid.isEmpty()) {
            uuid = findUuid(summary);
        }
        return uuid;
    }

    /**
     * Looks for a session id key first, then for a reference to a {@code <uuid>.jsonl} log file.
     */
    public Optional<String> findUuidInContent(final @Nullable String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        final Matcher sessionMatcher = SESSION_KEY_PATTERN.matcher(content);
        if (sessionMatcher.find()) {
            return Optional.of(sessionMatcher.group(1).toLowerCase(Locale.ROOT));
        }
        final Matcher referenceMatcher = LOG_FILE_REFERENCE_PATTERN.matcher(content);
        if (referenceMatcher.find()) {
            return Optional.of(referenceMatcher.group(1).toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public static boolean isConversationId(final @Nullable String id) {
        return id != null && CONVERSATION_ID_PATTERN.matcher(id).matches();
    }

    public static Optional<String> uuidFromId(final @Nullable String id) {
        if (id == null) {
            return Optional.empty();
        }
        final Matcher matcher = CONVERSATION_ID_PATTERN.matcher(id);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    static String hashId(final String content) {
        return DOCUMENT_PREFIX + ContentHasher.sha256(content).substring(0, HASH_ID_LENGTH);
    }

    private static Optional<String> findUuid(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        final Matcher matcher = UUID_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().toLowerCase(Locale.ROOT)) : Optional.empty();
    }
}
