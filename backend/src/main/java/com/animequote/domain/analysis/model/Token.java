package com.animequote.domain.analysis.model;

/**
 * Morphological unit produced by a tokenizer.
 *
 * @param surface      the text as it appears in the sentence
 * @param reading      hiragana reading, or the surface when the tokenizer has none
 * @param partOfSpeech top-level part-of-speech tag, e.g. "名詞" or "助詞"
 * @param baseForm     dictionary form
 */
public record Token(
        String surface,
        String reading,
        String partOfSpeech,
        String baseForm
) {}
