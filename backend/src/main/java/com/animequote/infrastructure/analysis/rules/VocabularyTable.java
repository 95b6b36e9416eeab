package com.animequote.infrastructure.analysis.rules;

import com.animequote.domain.analysis.model.JlptLevel;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable word → level/reading/meaning table. Lookups are exact string matches.
 */
public class VocabularyTable {

    public record Entry(String word, String reading, String meaning, JlptLevel level) {}

    private final Map<String, Entry> entries;

    public VocabularyTable(Map<String, Entry> entries) {
        this.entries = Map.copyOf(entries);
    }

    public Optional<Entry> find(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(word));
    }

    /**
     * Surface form first, then base form.
     */
    public Optional<Entry> lookup(String surface, String baseForm) {
        Optional<Entry> bySurface = find(surface);
        return bySurface.isPresent() ? bySurface : find(baseForm);
    }
}
