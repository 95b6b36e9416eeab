package com.animequote.infrastructure.analysis.tokenizer;

/**
 * Kana helpers. Katakana U+30A1..U+30F6 map onto hiragana by a fixed offset of 0x60.
 */
public final class KanaConverter {

    private static final int KATAKANA_TO_HIRAGANA = 0x60;

    private KanaConverter() {
    }

    public static String toHiragana(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '\u30A1' && c <= '\u30F6') {
                sb.append((char) (c - KATAKANA_TO_HIRAGANA));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static boolean isHiragana(char c) {
        return c >= '\u3040' && c <= '\u309F';
    }

    public static boolean isKatakana(char c) {
        return c >= '\u30A0' && c <= '\u30FF';
    }

    public static boolean isKanji(char c) {
        return (c >= '\u4E00' && c <= '\u9FAF') || c == '\u3005';
    }

    /**
     * True when every character is hiragana or katakana (prolonged sound mark included).
     */
    public static boolean isKana(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isHiragana(c) && !isKatakana(c)) {
                return false;
            }
        }
        return true;
    }
}
