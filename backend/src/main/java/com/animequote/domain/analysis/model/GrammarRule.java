package com.animequote.domain.analysis.model;

import java.util.List;
import java.util.Optional;

/**
 * Static grammar pattern definition.
 *
 * @param pattern         display label, e.g. "～ています"
 * @param signatures      alternative signatures; the rule matches when any of them is found
 * @param description     learner-facing explanation
 * @param level           JLPT level of the pattern
 * @param example         generic example sentence
 * @param pedagogicalNote usage advice (nullable)
 */
public record GrammarRule(
        String pattern,
        List<GrammarSignature> signatures,
        String description,
        JlptLevel level,
        String example,
        String pedagogicalNote
) {
    public GrammarRule {
        signatures = List.copyOf(signatures);
    }

    /**
     * First signature occurrence in the text, in signature order.
     */
    public Optional<String> findIn(String text) {
        for (GrammarSignature signature : signatures) {
            Optional<String> found = signature.findIn(text);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
