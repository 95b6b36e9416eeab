package com.animequote.infrastructure.analysis.tokenizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Selects the morphological tokenizer: "kuromoji" (default) or "fallback".
 * A Kuromoji dictionary that cannot be loaded degrades to the fallback segmenter.
 */
@Slf4j
@Configuration
public class TokenizerConfig {

    static final String KUROMOJI = "kuromoji";
    static final String FALLBACK = "fallback";

    @Value("${analyzer.tokenizer:" + KUROMOJI + "}")
    private String tokenizer;

    @Bean
    @Primary
    public MorphologicalTokenizer morphologicalTokenizer(FallbackSegmenter fallbackSegmenter) {
        if (FALLBACK.equalsIgnoreCase(tokenizer)) {
            log.info("[Tokenizer] Using fallback segmenter (configured)");
            return fallbackSegmenter;
        }
        if (!KUROMOJI.equalsIgnoreCase(tokenizer)) {
            log.warn("[Tokenizer] Unknown tokenizer '{}', using {}", tokenizer, KUROMOJI);
        }

        try {
            KuromojiTokenizer kuromoji = new KuromojiTokenizer(fallbackSegmenter);
            log.info("[Tokenizer] Kuromoji IPADIC tokenizer initialized");
            return kuromoji;
        } catch (RuntimeException | LinkageError e) {
            log.error("[Tokenizer] Failed to initialize Kuromoji, using fallback segmenter", e);
            return fallbackSegmenter;
        }
    }
}
