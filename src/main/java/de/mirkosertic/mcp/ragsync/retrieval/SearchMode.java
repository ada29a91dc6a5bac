package de.mirkosertic.mcp.ragsync.retrieval;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Scoring variant requested by a query.
 */
public enum SearchMode {

    /** Word overlap with phrase, frequency and bigram bonuses. */
    HYBRID,
    /** Same scoring as {@link #HYBRID}, accepted for client compatibility. */
    SEMANTIC,
    /** Plain word overlap. */
    KEYWORD;

    public boolean usesImprovedScoring() {
        return this != KEYWORD;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a mode name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SearchMode fromWireName(final @Nullable String name, final SearchMode fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        for (final SearchMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode '" + name + "', expected one of hybrid, semantic, keyword");
    }
}
