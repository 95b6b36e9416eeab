package com.animequote.domain.analysis.model;

import java.util.List;

/**
 * Complete linguistic breakdown of one sentence.
 */
public record SentenceAnalysis(
        String originalText,
        List<Token> tokens,
        JlptLevel level,
        List<GrammarMatch> grammarMatches,
        List<VocabularyEntry> vocabulary
) {
    public SentenceAnalysis {
        tokens = List.copyOf(tokens);
        grammarMatches = List.copyOf(grammarMatches);
        vocabulary = List.copyOf(vocabulary);
    }
}
