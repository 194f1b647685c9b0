package com.proposalpilot.orchestrator.text;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic term extraction over search titles and snippets.
 *
 * Pure utility (static methods, no state). The same input always yields
 * the same terms in the same order: ties in frequency are broken
 * alphabetically.
 */
public final class KeywordExtractor {

    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "from", "that", "this", "are", "was", "were", "has", "have",
            "had", "its", "their", "our", "your", "you", "they", "them", "will", "can", "may", "into",
            "about", "over", "more", "most", "also", "than", "such", "how", "what", "why", "when",
            "where", "which", "who", "new", "use", "using", "used", "all", "any", "not", "but", "out",
            "per", "via", "inc", "ltd", "llc", "corp", "company", "companies", "industry", "industries",
            "based", "top", "best", "guide", "report", "2023", "2024", "2025", "2026", "www", "com",
            "http", "https", "html");

    private KeywordExtractor() {}

    /**
     * Lower-cased significant tokens of the text in order of appearance,
     * without duplicates: at least three characters, not a stop word, not a number.
     */
    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (String raw : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.length() < 3 || STOP_WORDS.contains(raw) || raw.chars().allMatch(Character::isDigit)) {
                continue;
            }
            out.add(raw);
        }
        return List.copyOf(out);
    }

    /**
     * The {@code limit} most frequent tokens across all texts, skipping any in
     * {@code exclude}. A token counts once per text it appears in.
     */
    public static List<String> topTerms(Collection<String> texts, Set<String> exclude, int limit) {
        Map<String, Integer> counts = new HashMap<>();
        for (String text : texts) {
            for (String token : tokens(text)) {
                if (!exclude.contains(token)) {
                    counts.merge(token, 1, Integer::sum);
                }
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /** True when the text contains at least one of the given tokens. */
    public static boolean mentionsAny(String text, Collection<String> terms) {
        List<String> tokens = tokens(text);
        return terms.stream().anyMatch(tokens::contains);
    }
}
