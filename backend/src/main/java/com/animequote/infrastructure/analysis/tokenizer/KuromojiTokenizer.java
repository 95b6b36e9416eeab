package com.animequote.infrastructure.analysis.tokenizer;

import com.animequote.domain.analysis.model.Token;
import com.atilika.kuromoji.ipadic.Tokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Kuromoji (IPADIC) adapter. Readings are converted to hiragana; IPADIC's "*" placeholder for
 * missing readings or base forms falls back to the surface. If Kuromoji fails on an input the
 * sentence is segmented by the {@link FallbackSegmenter} instead.
 */
@Slf4j
public class KuromojiTokenizer implements MorphologicalTokenizer {

    private static final String MISSING = "*";

    private final Tokenizer tokenizer;
    private final FallbackSegmenter fallbackSegmenter;

    public KuromojiTokenizer(FallbackSegmenter fallbackSegmenter) {
        this(new Tokenizer(), fallbackSegmenter);
    }

    KuromojiTokenizer(Tokenizer tokenizer, FallbackSegmenter fallbackSegmenter) {
        this.tokenizer = tokenizer;
        this.fallbackSegmenter = fallbackSegmenter;
    }

    @Override
    public String name() {
        return "kuromoji";
    }

    @Override
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }

        try {
            for (com.atilika.kuromoji.ipadic.Token morpheme : tokenizer.tokenize(text)) {
                String surface = morpheme.getSurface();
                if (surface == null || surface.isBlank()) {
                    continue;
                }
                tokens.add(new Token(
                        surface,
                        readingOf(morpheme, surface),
                        orUnknown(morpheme.getPartOfSpeechLevel1()),
                        orSurface(morpheme.getBaseForm(), surface)));
            }
        } catch (RuntimeException e) {
            log.warn("[Kuromoji] Tokenization failed, using fallback segmenter: {}", e.getMessage());
            return fallbackSegmenter.segment(text);
        }

        log.debug("[Kuromoji] Tokenized into {} tokens", tokens.size());
        return tokens;
    }

    private String readingOf(com.atilika.kuromoji.ipadic.Token morpheme, String surface) {
        String reading = morpheme.getReading();
        if (reading == null || reading.isEmpty() || MISSING.equals(reading)) {
            return surface;
        }
        return KanaConverter.toHiragana(reading);
    }

    private String orSurface(String value, String surface) {
        return value == null || value.isEmpty() || MISSING.equals(value) ? surface : value;
    }

    private String orUnknown(String partOfSpeech) {
        return partOfSpeech == null || partOfSpeech.isEmpty() || MISSING.equals(partOfSpeech)
                ? PartOfSpeech.UNKNOWN
                : partOfSpeech;
    }
}
