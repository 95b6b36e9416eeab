package com.animequote.interfaces.api.dto;

import com.animequote.domain.analysis.model.GrammarMatch;
import com.animequote.domain.analysis.model.JlptLevel;
import com.animequote.domain.analysis.model.SentenceAnalysis;
import com.animequote.domain.analysis.model.Token;
import com.animequote.domain.analysis.model.VocabularyEntry;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Wire shape of a sentence analysis, as consumed by the web UI and the flashcard exporter.
 */
public record SentenceAnalysisResponse(
        String originalText,
        List<Token> tokens,
        JlptLevel jlptLevel,
        List<GrammarPattern> grammarPatterns,
        List<Vocabulary> vocabulary
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GrammarPattern(
            String pattern,
            String description,
            JlptLevel jlptLevel,
            String example,
            String exampleInSentence,
            String pedagogicalNote
    ) {}

    public record Vocabulary(
            String word,
            String baseForm,
            String reading,
            String meaning,
            JlptLevel jlptLevel
    ) {}

    public static SentenceAnalysisResponse from(SentenceAnalysis analysis) {
        return new SentenceAnalysisResponse(
                analysis.originalText(),
                analysis.tokens(),
                analysis.level(),
                analysis.grammarMatches().stream().map(SentenceAnalysisResponse::toPattern).toList(),
                analysis.vocabulary().stream().map(SentenceAnalysisResponse::toVocabulary).toList()
        );
    }

    private static GrammarPattern toPattern(GrammarMatch match) {
        return new GrammarPattern(
                match.rule().pattern(),
                match.rule().description(),
                match.rule().level(),
                match.rule().example(),
                match.exampleInSentence(),
                match.pedagogicalNote());
    }

    private static Vocabulary toVocabulary(VocabularyEntry entry) {
        return new Vocabulary(entry.word(), entry.baseForm(), entry.reading(), entry.meaning(), entry.level());
    }
}
