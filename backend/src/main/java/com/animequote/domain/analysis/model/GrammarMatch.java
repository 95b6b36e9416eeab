package com.animequote.domain.analysis.model;

/**
 * A grammar rule found in a sentence.
 *
 * @param rule              the matched rule
 * @param exampleInSentence literal text found in the sentence (nullable)
 * @param pedagogicalNote   usage advice (nullable)
 */
public record GrammarMatch(
        GrammarRule rule,
        String exampleInSentence,
        String pedagogicalNote
) {}
