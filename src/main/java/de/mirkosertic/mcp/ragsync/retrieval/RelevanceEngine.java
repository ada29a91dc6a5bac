package de.mirkosertic.mcp.ragsync.retrieval;

import de.mirkosertic.mcp.ragsync.store.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical relevance scoring over document snapshots.
 * <p>
 * {@link SearchMode#KEYWORD} scores an exact phrase hit with 0.9 and otherwise the share of query words
 * found in the document, scaled to 0.8. The other modes scale the word share to 0.7 and add bonuses for
 * short documents containing the phrase, for frequent query words and for query word pairs appearing
 * side by side in the document.
 * <p>
 * Stateless and thread safe.
 */
public class RelevanceEngine {

    static final double KEYWORD_EXACT_SCORE = 0.9;
    static final double KEYWORD_OVERLAP_WEIGHT = 0.8;

    static final double EXACT_SCORE = 0.9;
    static final double EXACT_SHORT_DOCUMENT_BONUS = 0.1;
    static final int SHORT_DOCUMENT_LENGTH = 1000;
    static final double OVERLAP_WEIGHT = 0.7;
    static final double TERM_FREQUENCY_LIMIT = 0.1;
    static final double FREQUENCY_BONUS_CAP = 0.15;
    static final double BIGRAM_BONUS = 0.05;
    static final double BIGRAM_BONUS_CAP = 0.15;

    private static final Pattern WORD_PATTERN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Score all documents, drop those scoring zero and return the best {@code limit} in descending order.
     * Equal scores keep the order of {@code documents}.
     */
    public List<ScoredDocument> rank(final String query, final List<Document> documents, final int limit,
                                     final SearchMode mode) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        final QueryTerms terms = QueryTerms.of(query);
        final List<ScoredDocument> scored = new ArrayList<>();
        for (final Document document : documents) {
            final double score = score(terms, document.content(), mode);
            if (score > 0) {
                scored.add(new ScoredDocument(document, score));
            }
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(ScoredDocument::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }

    public double score(final String query, final String content, final SearchMode mode) {
        return score(QueryTerms.of(query), content, mode);
    }

    private double score(final QueryTerms terms, final String content, final SearchMode mode) {
        if (content == null || content.isEmpty() || terms.phrase().isEmpty()) {
            return 0;
        }
        // A query without word characters can still match literally
        return mode.usesImprovedScoring()
                ? improvedScore(terms, content)
                : keywordScore(terms, content);
    }

    private double keywordScore(final QueryTerms terms, final String content) {
        final String lowerContent = content.toLowerCase(Locale.ROOT);
        if (lowerContent.contains(terms.phrase())) {
            return KEYWORD_EXACT_SCORE;
        }
        if (terms.words().isEmpty()) {
            return 0;
        }
        final Set<String> contentWords = new LinkedHashSet<>(tokenize(lowerContent));
        final long shared = terms.words().stream().filter(contentWords::contains).count();
        return (double) shared / terms.words().size() * KEYWORD_OVERLAP_WEIGHT;
    }

    private double improvedScore(final QueryTerms terms, final String content) {
        final String lowerContent = content.toLowerCase(Locale.ROOT);
        if (lowerContent.contains(terms.phrase())) {
            final double lengthFactor = Math.min(1.0, (double) SHORT_DOCUMENT_LENGTH / Math.max(content.length(), 1));
            return Math.min(1.0, EXACT_SCORE + EXACT_SHORT_DOCUMENT_BONUS * lengthFactor);
        }

        if (terms.words().isEmpty()) {
            return 0;
        }
        final List<String> contentTokens = tokenize(lowerContent);
        final Map<String, Integer> counts = new HashMap<>();
        for (final String token : contentTokens) {
            counts.merge(token, 1, Integer::sum);
        }

        final List<String> shared = new ArrayList<>();
        for (final String word : terms.words()) {
            if (counts.containsKey(word)) {
                shared.add(word);
            }
        }
        if (shared.isEmpty()) {
            return 0;
        }

        final double base = (double) shared.size() / terms.words().size() * OVERLAP_WEIGHT;

        double frequencySum = 0;
        for (final String word : shared) {
            final double termFrequency = (double) counts.get(word) / contentTokens.size();
            frequencySum += Math.min(termFrequency, TERM_FREQUENCY_LIMIT);
        }
        final double frequencyBonus = Math.min(frequencySum / shared.size(), FREQUENCY_BONUS_CAP);

        double bigramBonus = 0;
        final List<String> words = terms.words();
        for (int i = 0; i < words.size() - 1; i++) {
            if (lowerContent.contains(words.get(i) + " " + words.get(i + 1))) {
                bigramBonus += BIGRAM_BONUS;
            }
        }
        bigramBonus = Math.min(bigramBonus, BIGRAM_BONUS_CAP);

        return Math.min(1.0, base + frequencyBonus + bigramBonus);
    }

    static List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        final Matcher matcher = WORD_PATTERN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Lowercased query phrase plus its distinct words in order of first appearance.
     */
    private record QueryTerms(String phrase, List<String> words) {

        static QueryTerms of(final String query) {
            final String phrase = query == null ? "" : query.toLowerCase(Locale.ROOT).trim();
            return new QueryTerms(phrase, List.copyOf(new LinkedHashSet<>(tokenize(phrase))));
        }
    }
}
