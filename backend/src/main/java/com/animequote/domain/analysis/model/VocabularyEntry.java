package com.animequote.domain.analysis.model;

/**
 * Vocabulary item surfaced for a sentence.
 *
 * @param word     surface form as found in the sentence
 * @param baseForm dictionary form
 * @param reading  kana reading, or {@link #NEEDS_LOOKUP}
 * @param meaning  gloss, or {@link #NEEDS_LOOKUP}
 * @param level    JLPT level
 * @param source   whether the entry came from the vocabulary table or was synthesized
 */
public record VocabularyEntry(
        String word,
        String baseForm,
        String reading,
        String meaning,
        JlptLevel level,
        Source source
) {
    public static final String NEEDS_LOOKUP = "(needs lookup)";

    public enum Source {
        DICTIONARY,
        PLACEHOLDER
    }

    public boolean isPlaceholder() {
        return source == Source.PLACEHOLDER;
    }
}
