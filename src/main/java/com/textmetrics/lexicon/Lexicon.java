package com.textmetrics.lexicon;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 不可变的小写词集合，附带来源描述。
 */
public record Lexicon(
    String source,
    Set<String> words
) {
    public Lexicon {
        source = source == null ? "inline" : source;
        words = normalize(words);
    }

    public static Lexicon of(String source, Collection<String> words) {
        return new Lexicon(source, words == null ? Set.of() : new HashSet<>(words));
    }

    public static Lexicon empty(String source) {
        return new Lexicon(source, Set.of());
    }

    public boolean contains(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return words.contains(term.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }

    private static Set<String> normalize(Set<String> rawWords) {
        if (rawWords == null || rawWords.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new HashSet<>();
        for (String rawWord : rawWords) {
            if (rawWord == null) {
                continue;
            }
            String trimmed = rawWord.trim().toLowerCase(Locale.ROOT);
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed);
            }
        }
        return Set.copyOf(normalized);
    }
}
