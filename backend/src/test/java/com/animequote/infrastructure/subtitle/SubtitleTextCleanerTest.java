package com.animequote.infrastructure.subtitle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SubtitleTextCleanerTest {

    private SubtitleTextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new SubtitleTextCleaner();
    }

    // ── clean ──

    @Nested
    @DisplayName("clean")
    class Clean {

        @Test
        @DisplayName("null and empty → empty string")
        void null_and_empty() {
            assertThat(cleaner.clean(null)).isEmpty();
            assertThat(cleaner.clean("")).isEmpty();
        }

        @Test
        @DisplayName("Full-width speaker label at the start is removed")
        void fullwidth_speaker_label() {
            assertThat(cleaner.clean("（教師）よ〜し")).isEqualTo("よ〜し");
        }

        @Test
        @DisplayName("Half-width speaker label and following space are removed")
        void halfwidth_speaker_label() {
            assertThat(cleaner.clean("(話し声) こんにちは")).isEqualTo("こんにちは");
        }

        @Test
        @DisplayName("Parentheses in the middle of a line are kept")
        void parentheses_in_middle() {
            assertThat(cleaner.clean("それは（たぶん）本当だ")).isEqualTo("それは（たぶん）本当だ");
        }

        @Test
        @DisplayName("Stacked speaker labels are all removed")
        void stacked_labels() {
            assertThat(cleaner.clean("（教師）（小声）よし")).isEqualTo("よし");
        }

        @Test
        @DisplayName("Any number of stacked labels is removed in one call")
        void many_stacked_labels() {
            assertThat(cleaner.clean("(a)".repeat(17) + "よし")).isEqualTo("よし");
            assertThat(cleaner.clean("（声）".repeat(40) + " 行くぞ")).isEqualTo("行くぞ");
        }

        @Test
        @DisplayName("Music notes at start and end are removed")
        void music_notes_edges() {
            assertThat(cleaner.clean("♪ 夢を見た ♪")).isEqualTo("夢を見た");
            assertThat(cleaner.clean("♫♬ 歌です")).isEqualTo("歌です");
        }

        @Test
        @DisplayName("Free-standing music note between words is removed")
        void music_note_middle() {
            assertThat(cleaner.clean("夢を ♪ 見た")).isEqualTo("夢を 見た");
        }

        @Test
        @DisplayName("ASS line break becomes a space")
        void ass_line_break() {
            assertThat(cleaner.clean("一行目\\N二行目")).isEqualTo("一行目 二行目");
        }

        @Test
        @DisplayName("Override blocks and HTML-like tags are stripped")
        void tags_stripped() {
            assertThat(cleaner.clean("{\\i1}こんにちは{\\i0}")).isEqualTo("こんにちは");
            assertThat(cleaner.clean("<i>こんにちは</i>")).isEqualTo("こんにちは");
        }

        @Test
        @DisplayName("Tabs, newlines and full-width spaces collapse to one space")
        void whitespace_collapse() {
            assertThat(cleaner.clean("  おはよう　\t ございます\n ")).isEqualTo("おはよう ございます");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "（教師）よ〜し",
                "(A) (B) ♪ テスト ♪",
                "♪ ♪ ♪",
                "{\\pos(10,10)}<b>（先生）</b> 一行目\\N二行目",
                "  おはよう　　ございます  ",
                "夢を ♪ ♫ 見た",
                "(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)(a)よし"
        })
        @DisplayName("Cleaning is idempotent")
        void idempotent(String raw) {
            String once = cleaner.clean(raw);
            assertThat(cleaner.clean(once)).isEqualTo(once);
        }
    }

    // ── Retention policy ──

    @Nested
    @DisplayName("cleanDialogue")
    class CleanDialogue {

        @Test
        @DisplayName("Japanese dialogue is kept, cleaned")
        void japanese_kept() {
            assertThat(cleaner.cleanDialogue("（教師）よ〜し")).contains("よ〜し");
        }

        @Test
        @DisplayName("Symbols only → dropped")
        void symbols_only_dropped() {
            assertThat(cleaner.cleanDialogue("♪♪♪")).isEmpty();
            assertThat(cleaner.cleanDialogue("〜〜！？")).isEmpty();
        }

        @Test
        @DisplayName("No Japanese characters → dropped")
        void english_dropped() {
            assertThat(cleaner.cleanDialogue("Hello there")).isEmpty();
        }

        @Test
        @DisplayName("Nothing left after label removal → dropped")
        void label_only_dropped() {
            assertThat(cleaner.cleanDialogue("(Music)")).isEmpty();
        }
    }

    // ── Predicates ──

    @Test
    @DisplayName("isOnlySymbols")
    void is_only_symbols() {
        assertThat(cleaner.isOnlySymbols("♪〜♪")).isTrue();
        assertThat(cleaner.isOnlySymbols("...!?")).isTrue();
        assertThat(cleaner.isOnlySymbols("")).isTrue();
        assertThat(cleaner.isOnlySymbols("よし")).isFalse();
        assertThat(cleaner.isOnlySymbols("OK")).isFalse();
    }

    @Test
    @DisplayName("hasJapaneseContent")
    void has_japanese_content() {
        assertThat(cleaner.hasJapaneseContent("ひらがな")).isTrue();
        assertThat(cleaner.hasJapaneseContent("カタカナ")).isTrue();
        assertThat(cleaner.hasJapaneseContent("漢字")).isTrue();
        assertThat(cleaner.hasJapaneseContent("Hello 123")).isFalse();
        assertThat(cleaner.hasJapaneseContent(null)).isFalse();
    }
}
