package de.mirkosertic.mcp.ragsync.api;

import de.mirkosertic.mcp.ragsync.retrieval.SearchMode;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every request the server understands, whatever transport it came from.
 * <p>
 * Variants validate their payload on construction and throw {@link IllegalArgumentException} for bad
 * input. {@code fromMap} factories read the snake_case argument names used on the wire. Dispatch goes
 * through {@link Visitor}, so adding a variant breaks every handler until it covers the new case.
 */
public sealed interface RagCommand {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitQuery(Query command);

        R visitInsert(Insert command);

        R visitDelete(Delete command);

        R visitClear(Clear command);

        R visitStatus(Status command);

        R visitListDocuments(ListDocuments command);

        R visitConsolidate(Consolidate command);

        R visitStatistics(Statistics command);

        R visitSyncStatus(SyncStatus command);

        R visitReconcile(Reconcile command);
    }

    record Query(String query, int maxResults, SearchMode mode) implements RagCommand {

        public Query {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("Query must not be empty");
            }
            if (maxResults < 1) {
                throw new IllegalArgumentException("max_results must be at least 1, got " + maxResults);
            }
            if (mode == null) {
                throw new IllegalArgumentException("mode must not be null");
            }
        }

        public static Query fromMap(final Map<String, Object> args, final int defaultMaxResults,
                                    final SearchMode defaultMode) {
            return new Query(
                    CommandArguments.string(args, "query"),
                    CommandArguments.integer(args, "max_results", defaultMaxResults),
                    SearchMode.fromWireName(CommandArguments.string(args, "mode"), defaultMode));
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitQuery(this);
        }
    }

    /**
     * Empty text is not rejected here; the store reports it with its own error.
     */
    record Insert(String text, String source, @Nullable String summary, Map<String, Object> metadata)
            implements RagCommand {

        public static final String DEFAULT_SOURCE = "manual";

        public Insert {
            if (text == null) {
                text = "";
            }
            if (source == null || source.isBlank()) {
                source = DEFAULT_SOURCE;
            }
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }

        public static Insert fromMap(final Map<String, Object> args) {
            return new Insert(
                    CommandArguments.string(args, "text"),
                    CommandArguments.string(args, "source"),
                    CommandArguments.string(args, "summary"),
                    CommandArguments.map(args, "metadata"));
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitInsert(this);
        }
    }

    record Delete(String id) implements RagCommand {

        public Delete {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Document id must not be empty");
            }
        }

        public static Delete fromMap(final Map<String, Object> args) {
            return new Delete(CommandArguments.string(args, "id"));
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    /**
     * An unconfirmed clear is a valid command; the store refuses to run it.
     */
    record Clear(boolean confirm) implements RagCommand {

        public static Clear fromMap(final Map<String, Object> args) {
            return new Clear(CommandArguments.bool(args, "confirm", false));
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitClear(this);
        }
    }

    record Status() implements RagCommand {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitStatus(this);
        }
    }

    record ListDocuments() implements RagCommand {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitListDocuments(this);
        }
    }

    record Consolidate(boolean dryRun) implements RagCommand {

        public static Consolidate fromMap(final Map<String, Object> args) {
            return new Consolidate(CommandArguments.bool(args, "dry_run", false));
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitConsolidate(this);
        }
    }

    record Statistics() implements RagCommand {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitStatistics(this);
        }
    }

    record SyncStatus() implements RagCommand {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitSyncStatus(this);
        }
    }

    record Reconcile() implements RagCommand {

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitReconcile(this);
        }
    }

    /**
     * Lenient readers for loosely typed JSON arguments.
     */
    final class CommandArguments {

        private CommandArguments() {
        }

        static @Nullable String string(final Map<String, Object> args, final String key) {
            final Object value = args.get(key);
            return value != null ? value.toString() : null;
        }

        static int integer(final Map<String, Object> args, final String key, final int defaultValue) {
            final Object value = args.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (value instanceof Number number) {
                return number.intValue();
            }
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
            }
        }

        static boolean bool(final Map<String, Object> args, final String key, final boolean defaultValue) {
            final Object value = args.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (value instanceof Boolean b) {
                return b;
            }
            return Boolean.parseBoolean(value.toString().trim());
        }

        static Map<String, Object> map(final Map<String, Object> args, final String key) {
            final Object value = args.get(key);
            if (value == null) {
                return Map.of();
            }
            if (!(value instanceof Map<?, ?> raw)) {
                throw new IllegalArgumentException(key + " must be an object");
            }
            final Map<String, Object> result = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : raw.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    result.put(entry.getKey().toString(), entry.getValue());
                }
            }
            return result;
        }
    }
}
