package com.ai.studyengine.service.hierarchy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Folds topic titles to a comparable token key: lower case, punctuation
 * removed, stopwords dropped, tokens sorted. Two titles with the same key
 * are near-duplicates.
 */
public final class TitleNormalizer {

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "and", "the", "of", "in", "on", "for", "to", "with", "by", "at", "from",
            "into", "its", "is", "are", "or", "vs", "versus", "about", "as", "their", "your",
            "introduction", "intro", "overview", "basics", "fundamentals");

    private TitleNormalizer() {
    }

    public static String key(String title) {
        if (title == null)
            return "";
        String folded = title.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
        if (folded.isEmpty())
            return "";
        TreeSet<String> tokens = Arrays.stream(folded.split(" "))
                .filter(t -> !t.isEmpty() && !STOPWORDS.contains(t))
                .collect(Collectors.toCollection(TreeSet::new));
        // A title made only of stopwords is compared on its raw tokens.
        return tokens.isEmpty() ? folded : String.join(" ", tokens);
    }
}
