package com.animequote.infrastructure.analysis;

import com.animequote.domain.analysis.model.JlptLevel;
import com.animequote.domain.analysis.model.SentenceAnalysis;
import com.animequote.domain.analysis.model.Token;
import com.animequote.domain.analysis.model.VocabularyEntry;
import com.animequote.infrastructure.analysis.rules.RuleTablesFixture;
import com.animequote.infrastructure.analysis.tokenizer.FallbackSegmenter;
import com.animequote.infrastructure.analysis.tokenizer.PartOfSpeech;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentenceAnnotatorTest {

    private SentenceAnnotator annotator;
    private FallbackSegmenter segmenter;

    @BeforeEach
    void setUp() {
        annotator = new SentenceAnnotator(
                new VocabularyExtractor(RuleTablesFixture.vocabulary(), RuleTablesFixture.particles()),
                new JlptLevelClassifier(),
                new GrammarPatternDetector(RuleTablesFixture.grammar()));
        segmenter = new FallbackSegmenter(RuleTablesFixture.particles(), RuleTablesFixture.vocabulary());
    }

    private static Token noun(String surface) {
        return new Token(surface, surface, PartOfSpeech.NOUN, surface);
    }

    // ── Leveling ──

    @Nested
    @DisplayName("Sentence level")
    class Leveling {

        @Test
        @DisplayName("Hardest recognized word decides the level")
        void hardest_word() {
            SentenceAnalysis analysis = annotator.annotate("私の刹那", List.of(
                    noun("私"),
                    new Token("の", "の", PartOfSpeech.PARTICLE, "の"),
                    noun("刹那")));

            assertThat(analysis.level()).isEqualTo(JlptLevel.N1);
            assertThat(analysis.vocabulary()).extracting(VocabularyEntry::level)
                    .containsExactly(JlptLevel.N5, JlptLevel.N1);
        }

        @Test
        @DisplayName("Long unrecognized sentence with kanji, no tokens → N2")
        void length_fallback() {
            String text = "鬱" + "ぬ".repeat(29);

            SentenceAnalysis analysis = annotator.annotate(text, List.of());

            assertThat(text.codePointCount(0, text.length())).isEqualTo(30);
            assertThat(analysis.level()).isEqualTo(JlptLevel.N2);
            assertThat(analysis.tokens()).isEmpty();
            assertThat(analysis.vocabulary()).allSatisfy(entry -> {
                assertThat(entry.isPlaceholder()).isTrue();
                assertThat(entry.level()).isEqualTo(JlptLevel.N2);
            });
        }
    }

    // ── Grammar ──

    @Test
    @DisplayName("Progressive form lists both the specific and the general pattern")
    void grammar_overlap() {
        SentenceAnalysis analysis = annotator.annotate("勉強しています", segmenter.segment("勉強しています"));

        assertThat(analysis.grammarMatches()).extracting(match -> match.rule().pattern())
                .contains("～ています", "～ます");
        assertThat(analysis.grammarMatches())
                .filteredOn(match -> match.rule().pattern().equals("～ています"))
                .singleElement()
                .extracting(match -> match.rule().level())
                .isEqualTo(JlptLevel.N5);
    }

    // ── Degradation ──

    @Nested
    @DisplayName("Degraded input")
    class Degraded {

        @Test
        @DisplayName("null text and null tokens → empty N5 analysis with default grammar")
        void nulls() {
            SentenceAnalysis analysis = annotator.annotate(null, null);

            assertThat(analysis.originalText()).isEmpty();
            assertThat(analysis.tokens()).isEmpty();
            assertThat(analysis.level()).isEqualTo(JlptLevel.N5);
            assertThat(analysis.grammarMatches()).singleElement()
                    .extracting(match -> match.rule().pattern()).isEqualTo("Simple sentence");
            assertThat(analysis.vocabulary()).isEmpty();
        }

        @Test
        @DisplayName("null tokens inside the list are ignored")
        void null_tokens() {
            List<Token> tokens = new ArrayList<>(Arrays.asList(noun("猫"), null));

            SentenceAnalysis analysis = annotator.annotate("猫", tokens);

            assertThat(analysis.tokens()).containsExactly(noun("猫"));
        }
    }

    // ── Output invariants ──

    @ParameterizedTest
    @ValueSource(strings = {
            "私は日本語を勉強しています",
            "よ〜し",
            "絶対に仲間を守るって約束したんだ！",
            "怨念と憂鬱と黄昏の刹那、森羅万象が崩壊する運命だった",
            "コーヒーとケーキとパンとミルクとジュースとテストとレベルとスタイルとブラックとチャリとやつ"
    })
    @DisplayName("Grammar is never empty and vocabulary never exceeds the cap")
    void invariants(String text) {
        SentenceAnalysis analysis = annotator.annotate(text, segmenter.segment(text));

        assertThat(analysis.originalText()).isEqualTo(text);
        assertThat(analysis.grammarMatches()).isNotEmpty();
        assertThat(analysis.vocabulary()).hasSizeLessThanOrEqualTo(VocabularyExtractor.DEFAULT_MAX_ENTRIES);
        assertThat(analysis.vocabulary()).extracting(VocabularyEntry::word).doesNotHaveDuplicates();
    }
}
