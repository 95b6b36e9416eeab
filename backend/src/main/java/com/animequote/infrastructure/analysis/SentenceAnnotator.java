package com.animequote.infrastructure.analysis;

import com.animequote.domain.analysis.model.GrammarMatch;
import com.animequote.domain.analysis.model.JlptLevel;
import com.animequote.domain.analysis.model.SentenceAnalysis;
import com.animequote.domain.analysis.model.Token;
import com.animequote.domain.analysis.model.VocabularyEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the linguistic breakdown of one sentence from its text and tokens:
 *   1. Vocabulary candidates (token tags, or regex runs when there are none)
 *   2. Sentence level from the recognized candidates, or the length heuristic
 *   3. Grammar patterns in rule order
 *   4. Vocabulary entries, placeholders taking the sentence level
 *
 * Missing tokens, unknown words and sentences without any known pattern all degrade to
 * defaults; nothing here throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentenceAnnotator {

    private final VocabularyExtractor vocabularyExtractor;
    private final JlptLevelClassifier levelClassifier;
    private final GrammarPatternDetector grammarDetector;

    public SentenceAnalysis annotate(String text, List<Token> tokens) {
        String originalText = text == null ? "" : text;
        List<Token> safeTokens = tokens == null
                ? List.of()
                : tokens.stream().filter(token -> token != null).toList();

        List<VocabularyExtractor.Candidate> candidates = vocabularyExtractor.selectCandidates(originalText, safeTokens);

        List<JlptLevel> recognizedLevels = candidates.stream()
                .filter(VocabularyExtractor.Candidate::isRecognized)
                .map(candidate -> candidate.dictionaryEntry().level())
                .toList();
        JlptLevel level = levelClassifier.classify(originalText, recognizedLevels);

        List<GrammarMatch> grammarMatches = grammarDetector.detect(originalText);
        List<VocabularyEntry> vocabulary = vocabularyExtractor.toEntries(candidates, level);

        log.debug("[Annotator] level={}, tokens={}, patterns={}, vocab={} ({} recognized)",
                level, safeTokens.size(), grammarMatches.size(), vocabulary.size(), recognizedLevels.size());

        return new SentenceAnalysis(originalText, safeTokens, level, grammarMatches, vocabulary);
    }
}
