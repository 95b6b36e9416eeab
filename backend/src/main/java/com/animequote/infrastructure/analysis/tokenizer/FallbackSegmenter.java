package com.animequote.infrastructure.analysis.tokenizer;

import com.animequote.domain.analysis.model.Token;
import com.animequote.infrastructure.analysis.rules.ParticleTable;
import com.animequote.infrastructure.analysis.rules.VocabularyTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Script-based segmenter used when no morphological analyzer is available. No dictionary
 * lattice, only character classes:
 *
 *   1. Kanji run + okurigana → 動詞 (conjugated stem), bare kanji run → 名詞
 *   2. Katakana run → 名詞
 *   3. Particles (rule table) split off the edges of runs → 助詞
 *   4. Remaining hiragana runs → Unknown
 *   5. Punctuation and other symbols → 記号, whitespace dropped
 *
 * Readings come from the vocabulary table when the surface is listed there.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackSegmenter implements MorphologicalTokenizer {

    private static final Pattern SEGMENT = Pattern.compile(
            "(?<kanji>[\\u4E00-\\u9FAF\\u3005]+)(?<okurigana>[\\u3040-\\u309F]*)"
                    + "|(?<katakana>[\\u30A0-\\u30FF]+)"
                    + "|(?<hiragana>[\\u3040-\\u309F]+)"
                    + "|(?<latin>[A-Za-z0-9\\uFF10-\\uFF19\\uFF21-\\uFF3A\\uFF41-\\uFF5A]+)"
                    + "|(?<space>\\s+)"
                    + "|(?<symbol>.)",
            Pattern.UNICODE_CHARACTER_CLASS
    );

    // Case markers that practically never start okurigana or a hiragana word
    private static final Set<Character> LEADING_MARKERS = Set.of('は', 'が', 'を');

    private static final int MIN_TRAILING_SPLIT_LENGTH = 3;

    private final ParticleTable particleTable;
    private final VocabularyTable vocabularyTable;

    @Override
    public String name() {
        return "fallback";
    }

    @Override
    public List<Token> tokenize(String text) {
        return segment(text);
    }

    public List<Token> segment(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }

        Matcher matcher = SEGMENT.matcher(text);
        while (matcher.find()) {
            char next = matcher.end() < text.length() ? text.charAt(matcher.end()) : 0;
            if (matcher.group("kanji") != null) {
                addKanjiRun(tokens, matcher.group("kanji"), matcher.group("okurigana"), next);
            } else if (matcher.group("katakana") != null) {
                tokens.add(kana(matcher.group("katakana"), PartOfSpeech.NOUN));
            } else if (matcher.group("hiragana") != null) {
                addHiraganaRun(tokens, matcher.group("hiragana"), next);
            } else if (matcher.group("latin") != null) {
                tokens.add(plain(matcher.group("latin"), PartOfSpeech.UNKNOWN));
            } else if (matcher.group("symbol") != null) {
                tokens.add(plain(matcher.group("symbol"), PartOfSpeech.SYMBOL));
            }
        }

        log.debug("[FallbackSegmenter] {} tokens from {} chars", tokens.size(), text.length());
        return tokens;
    }

    private void addKanjiRun(List<Token> tokens, String kanji, String okurigana, char next) {
        if (okurigana.isEmpty()) {
            tokens.add(content(kanji, PartOfSpeech.NOUN));
            return;
        }
        if (particleTable.isParticle(okurigana)) {
            tokens.add(content(kanji, PartOfSpeech.NOUN));
            tokens.add(particle(okurigana));
            return;
        }
        if (startsWithMarker(okurigana)) {
            tokens.add(content(kanji, PartOfSpeech.NOUN));
            tokens.add(particle(okurigana.substring(0, 1)));
            addHiraganaRun(tokens, okurigana.substring(1), next);
            return;
        }
        tokens.add(content(kanji + okurigana, PartOfSpeech.VERB));
    }

    private void addHiraganaRun(List<Token> tokens, String run, char next) {
        String rest = run;

        if (particleTable.isParticle(rest)) {
            tokens.add(particle(rest));
            return;
        }

        if (followsNoun(tokens) && startsWithMarker(rest)) {
            tokens.add(particle(rest.substring(0, 1)));
            rest = rest.substring(1);
        }

        // りんごを食べる → りんご + を
        String trailingParticle = null;
        if (rest.length() >= MIN_TRAILING_SPLIT_LENGTH
                && particleTable.isParticle(rest.charAt(rest.length() - 1))
                && (KanaConverter.isKanji(next) || KanaConverter.isKatakana(next))) {
            trailingParticle = rest.substring(rest.length() - 1);
            rest = rest.substring(0, rest.length() - 1);
        }

        if (!rest.isEmpty()) {
            tokens.add(kana(rest, particleTable.isParticle(rest) ? PartOfSpeech.PARTICLE : PartOfSpeech.UNKNOWN));
        }
        if (trailingParticle != null) {
            tokens.add(particle(trailingParticle));
        }
    }

    private boolean startsWithMarker(String run) {
        return !run.isEmpty() && LEADING_MARKERS.contains(run.charAt(0)) && particleTable.isParticle(run.charAt(0));
    }

    private boolean followsNoun(List<Token> tokens) {
        return !tokens.isEmpty() && PartOfSpeech.NOUN.equals(tokens.get(tokens.size() - 1).partOfSpeech());
    }

    private Token content(String surface, String partOfSpeech) {
        String reading = vocabularyTable.find(surface)
                .map(VocabularyTable.Entry::reading)
                .orElse(surface);
        return new Token(surface, reading, partOfSpeech, surface);
    }

    private Token kana(String surface, String partOfSpeech) {
        return new Token(surface, KanaConverter.toHiragana(surface), partOfSpeech, surface);
    }

    private Token particle(String surface) {
        return new Token(surface, surface, PartOfSpeech.PARTICLE, surface);
    }

    private Token plain(String surface, String partOfSpeech) {
        return new Token(surface, surface, partOfSpeech, surface);
    }
}
