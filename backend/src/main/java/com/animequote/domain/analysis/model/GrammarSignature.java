package com.animequote.domain.analysis.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How a grammar rule recognizes itself in a sentence.
 * All variants are evaluated the same way: {@link #findIn} returns the text actually found.
 */
public interface GrammarSignature {

    Optional<String> findIn(String text);

    record Literal(String value) implements GrammarSignature {
        @Override
        public Optional<String> findIn(String text) {
            if (text == null || value.isEmpty() || !text.contains(value)) {
                return Optional.empty();
            }
            return Optional.of(value);
        }
    }

    record RegexPattern(Pattern pattern) implements GrammarSignature {
        @Override
        public Optional<String> findIn(String text) {
            if (text == null) {
                return Optional.empty();
            }
            Matcher matcher = pattern.matcher(text);
            return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
        }
    }
}
