package com.animequote.infrastructure.subtitle;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cleans raw subtitle dialogue before analysis:
 * - Leading speaker label removal: （教師）, (話し声)
 * - Free-standing music note removal (♪ ♫ ♬)
 * - ASS line breaks, override blocks and HTML-like tags
 * - Whitespace normalization (collapse runs, trim)
 *
 * The steps run in order and are repeated until the text stops changing, so cleaning
 * an already cleaned string is a no-op.
 */
@Component
public class SubtitleTextCleaner {

    // （教師）よ〜し → よ〜し; one label per pass, only at the very start
    private static final Pattern SPEAKER_LABEL = Pattern.compile(
            "^[(（][^)）]+[)）]\\s*", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern MUSIC_AT_START = Pattern.compile(
            "^\\s*[♪♫♬]+\\s*", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern MUSIC_AT_END = Pattern.compile(
            "\\s*[♪♫♬]+\\s*$", Pattern.UNICODE_CHARACTER_CLASS);
    // Only runs with whitespace on both sides; a glyph inside a word stays
    private static final Pattern MUSIC_IN_MIDDLE = Pattern.compile(
            "\\s+[♪♫♬]+(?=\\s)", Pattern.UNICODE_CHARACTER_CLASS);

    private static final String ASS_LINE_BREAK = "\\N";
    private static final Pattern OVERRIDE_BLOCK = Pattern.compile("\\{[^}]*}");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // Characters that do not count as dialogue on their own
    private static final Pattern SYMBOLS_ONLY_NOISE = Pattern.compile(
            "[♪♫♬〜～~\\s.,!?。、]", Pattern.UNICODE_CHARACTER_CLASS);

    // Hiragana (3040-309F), Katakana (30A0-30FF), CJK ideographs (4E00-9FAF)
    private static final Pattern JAPANESE_CHAR = Pattern.compile("[\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FAF]");

    /**
     * Clean raw subtitle text.
     *
     * @param rawText dialogue text as found in the subtitle file
     * @return cleaned text, never null
     */
    public String clean(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        // A pass that changes the text either shortens it or turns a tab/newline into a plain
        // space, so this terminates.
        String current = rawText;
        String next = cleanOnce(current);
        while (!next.equals(current)) {
            current = next;
            next = cleanOnce(current);
        }
        return next;
    }

    private String cleanOnce(String text) {
        // 1. Speaker label at the start
        String result = SPEAKER_LABEL.matcher(text).replaceFirst("");

        // 2. Decorative music notes (start, end, between spaces)
        result = MUSIC_AT_START.matcher(result).replaceFirst("");
        result = MUSIC_AT_END.matcher(result).replaceFirst("");
        result = MUSIC_IN_MIDDLE.matcher(result).replaceAll("");

        // 3. Formatting artifacts
        result = result.replace(ASS_LINE_BREAK, " ");
        result = OVERRIDE_BLOCK.matcher(result).replaceAll("");
        result = HTML_TAG.matcher(result).replaceAll("");

        // 4. Whitespace runs, tabs and full-width spaces included
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        // 5. Trim
        return result.strip();
    }

    /**
     * Clean a dialogue payload and apply the retention policy shared by every format.
     *
     * @return the cleaned text, or empty when the entry carries no Japanese dialogue
     */
    public Optional<String> cleanDialogue(String rawText) {
        String cleaned = clean(rawText);
        if (cleaned.isEmpty() || isOnlySymbols(cleaned) || !hasJapaneseContent(cleaned)) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    /**
     * True when nothing but music notes, tildes, whitespace and basic punctuation remains.
     */
    public boolean isOnlySymbols(String text) {
        if (text == null) {
            return true;
        }
        return SYMBOLS_ONLY_NOISE.matcher(text).replaceAll("").isEmpty();
    }

    public boolean hasJapaneseContent(String text) {
        return text != null && JAPANESE_CHAR.matcher(text).find();
    }
}
