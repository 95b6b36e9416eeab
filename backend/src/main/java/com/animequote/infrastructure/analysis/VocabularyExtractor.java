package com.animequote.infrastructure.analysis;

import com.animequote.domain.analysis.model.JlptLevel;
import com.animequote.domain.analysis.model.Token;
import com.animequote.domain.analysis.model.VocabularyEntry;
import com.animequote.infrastructure.analysis.rules.ParticleTable;
import com.animequote.infrastructure.analysis.rules.VocabularyTable;
import com.animequote.infrastructure.analysis.tokenizer.KanaConverter;
import com.animequote.infrastructure.analysis.tokenizer.PartOfSpeech;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the vocabulary worth showing for a sentence, in first-occurrence order, capped at
 * {@code analyzer.vocabulary.max-entries}.
 *
 * With part-of-speech tags: nouns, verbs and adjectives, deduplicated by surface form.
 * Without: regex runs over the raw text (kanji with okurigana, 2+ hiragana, 2+ katakana).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VocabularyExtractor {

    public static final int DEFAULT_MAX_ENTRIES = 10;

    /**
     * A word selected from the sentence, with its table entry when it has one.
     */
    public record Candidate(String word, String baseForm, VocabularyTable.Entry dictionaryEntry) {
        public boolean isRecognized() {
            return dictionaryEntry != null;
        }
    }

    private static final Pattern KANJI_WITH_OKURIGANA = Pattern.compile("[\\u4E00-\\u9FAF]+[\\u3040-\\u309F]*");
    private static final Pattern HIRAGANA_RUN = Pattern.compile("[\\u3040-\\u309F]{2,}");
    private static final Pattern KATAKANA_RUN = Pattern.compile("[\\u30A0-\\u30FF]{2,}");

    private final VocabularyTable vocabularyTable;
    private final ParticleTable particleTable;

    @Value("${analyzer.vocabulary.max-entries:" + DEFAULT_MAX_ENTRIES + "}")
    private int maxEntries = DEFAULT_MAX_ENTRIES;

    public List<Candidate> selectCandidates(String text, List<Token> tokens) {
        List<Candidate> candidates = hasPartOfSpeechTags(tokens)
                ? fromTokens(tokens)
                : fromText(text);
        log.debug("[Vocabulary] {} candidates ({} recognized)",
                candidates.size(), candidates.stream().filter(Candidate::isRecognized).count());
        return candidates;
    }

    /**
     * Turn candidates into entries. Words missing from the table become placeholders at the
     * sentence's own level.
     */
    public List<VocabularyEntry> toEntries(List<Candidate> candidates, JlptLevel sentenceLevel) {
        List<VocabularyEntry> entries = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            VocabularyTable.Entry hit = candidate.dictionaryEntry();
            if (hit != null) {
                entries.add(new VocabularyEntry(candidate.word(), candidate.baseForm(), hit.reading(),
                        hit.meaning(), hit.level(), VocabularyEntry.Source.DICTIONARY));
            } else {
                String reading = KanaConverter.isKana(candidate.word())
                        ? candidate.word()
                        : VocabularyEntry.NEEDS_LOOKUP;
                entries.add(new VocabularyEntry(candidate.word(), candidate.baseForm(), reading,
                        VocabularyEntry.NEEDS_LOOKUP, sentenceLevel, VocabularyEntry.Source.PLACEHOLDER));
            }
        }
        return entries;
    }

    private boolean hasPartOfSpeechTags(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return false;
        }
        return tokens.stream().anyMatch(token -> token != null && PartOfSpeech.isRecognized(token.partOfSpeech()));
    }

    private List<Candidate> fromTokens(List<Token> tokens) {
        Map<String, Candidate> bySurface = new LinkedHashMap<>();

        for (Token token : tokens) {
            if (bySurface.size() >= maxEntries) {
                break;
            }
            if (token == null || token.surface() == null || token.surface().isBlank()) {
                continue;
            }
            if (!PartOfSpeech.isContentWord(token.partOfSpeech()) || bySurface.containsKey(token.surface())) {
                continue;
            }
            String baseForm = token.baseForm() == null || token.baseForm().isBlank()
                    ? token.surface()
                    : token.baseForm();
            VocabularyTable.Entry hit = vocabularyTable.lookup(token.surface(), baseForm).orElse(null);
            bySurface.put(token.surface(), new Candidate(token.surface(), baseForm, hit));
        }

        return new ArrayList<>(bySurface.values());
    }

    private List<Candidate> fromText(String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }

        Set<String> words = new LinkedHashSet<>();
        collect(KANJI_WITH_OKURIGANA, text, words);
        collect(HIRAGANA_RUN, text, words);
        collect(KATAKANA_RUN, text, words);

        List<Candidate> candidates = new ArrayList<>();
        for (String word : words) {
            if (candidates.size() >= maxEntries) {
                break;
            }
            if (particleTable.isParticle(word)) {
                continue;
            }
            candidates.add(new Candidate(word, word, vocabularyTable.find(word).orElse(null)));
        }
        return candidates;
    }

    private void collect(Pattern pattern, String text, Set<String> into) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group());
        }
    }
}
