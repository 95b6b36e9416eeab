package com.animequote.infrastructure.analysis.tokenizer;

import com.animequote.domain.analysis.model.Token;

import java.util.List;

/**
 * Splits a Japanese sentence into morphological units.
 * Implementations must not throw for any non-null input.
 */
public interface MorphologicalTokenizer {

    List<Token> tokenize(String text);

    String name();
}
