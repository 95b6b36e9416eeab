package com.animequote.infrastructure.analysis.tokenizer;

import java.util.Locale;
import java.util.Set;

/**
 * Top-level part-of-speech tags as emitted by IPADIC/UniDic tokenizers, plus the English
 * aliases some tokenizers use. Tags such as "名詞-一般" are classified by their first segment.
 */
public final class PartOfSpeech {

    public static final String NOUN = "名詞";
    public static final String VERB = "動詞";
    public static final String ADJECTIVE = "形容詞";
    public static final String ADJECTIVAL_NOUN = "形状詞";
    public static final String PARTICLE = "助詞";
    public static final String AUXILIARY = "助動詞";
    public static final String SYMBOL = "記号";
    public static final String UNKNOWN = "Unknown";

    private static final Set<String> CONTENT = Set.of(
            NOUN, VERB, ADJECTIVE, ADJECTIVAL_NOUN,
            "noun", "verb", "adjective"
    );

    private static final Set<String> FUNCTION = Set.of(
            PARTICLE, AUXILIARY,
            "particle", "auxiliary"
    );

    private static final Set<String> UNRECOGNIZED = Set.of("", "*", "unknown");

    private PartOfSpeech() {
    }

    public static String topLevel(String tag) {
        if (tag == null) {
            return "";
        }
        String trimmed = tag.strip();
        int cut = indexOfSeparator(trimmed);
        String head = cut < 0 ? trimmed : trimmed.substring(0, cut);
        return head.toLowerCase(Locale.ROOT);
    }

    /**
     * Noun, verb or adjective. Particles and auxiliaries never qualify.
     */
    public static boolean isContentWord(String tag) {
        String head = topLevel(tag);
        return CONTENT.contains(head) && !FUNCTION.contains(head);
    }

    /**
     * True when the tag carries usable information (not blank, "*" or "Unknown").
     */
    public static boolean isRecognized(String tag) {
        return !UNRECOGNIZED.contains(topLevel(tag));
    }

    private static int indexOfSeparator(String tag) {
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            if (c == '-' || c == ',' || c == '・') {
                return i;
            }
        }
        return -1;
    }
}
