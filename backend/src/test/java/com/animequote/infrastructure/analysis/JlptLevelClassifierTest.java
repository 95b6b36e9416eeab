package com.animequote.infrastructure.analysis;

import com.animequote.domain.analysis.model.JlptLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JlptLevelClassifierTest {

    private JlptLevelClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new JlptLevelClassifier();
    }

    @Nested
    @DisplayName("Recognized vocabulary")
    class Recognized {

        @Test
        @DisplayName("Hardest recognized level wins")
        void hardest_wins() {
            assertThat(classifier.classify("短い", List.of(JlptLevel.N5, JlptLevel.N3, JlptLevel.N4)))
                    .isEqualTo(JlptLevel.N3);
        }

        @Test
        @DisplayName("Recognized levels override the length heuristic")
        void overrides_length() {
            String longText = "漢" + "あ".repeat(40);

            assertThat(classifier.classify(longText, List.of(JlptLevel.N5))).isEqualTo(JlptLevel.N5);
        }
    }

    @Nested
    @DisplayName("Length heuristic")
    class Length {

        @Test
        @DisplayName("Thresholds")
        void thresholds() {
            assertThat(classifier.classify("あ".repeat(12), List.of())).isEqualTo(JlptLevel.N5);
            assertThat(classifier.classify("あ".repeat(13), List.of())).isEqualTo(JlptLevel.N4);
            assertThat(classifier.classify("あ".repeat(20), List.of())).isEqualTo(JlptLevel.N4);
            assertThat(classifier.classify("あ".repeat(21), List.of())).isEqualTo(JlptLevel.N3);
        }

        @Test
        @DisplayName("Long text reaches N2 only with kanji")
        void n2_needs_kanji() {
            assertThat(classifier.classify("あ".repeat(30), null)).isEqualTo(JlptLevel.N3);
            assertThat(classifier.classify("漢" + "あ".repeat(25), null)).isEqualTo(JlptLevel.N2);
        }

        @Test
        @DisplayName("Length counts code points, not UTF-16 units")
        void code_points() {
            String emoji = "😀".repeat(12);

            assertThat(classifier.classify(emoji, List.of())).isEqualTo(JlptLevel.N5);
        }

        @Test
        @DisplayName("null and empty → N5")
        void degenerate() {
            assertThat(classifier.classify(null, null)).isEqualTo(JlptLevel.N5);
            assertThat(classifier.classify("", List.of())).isEqualTo(JlptLevel.N5);
        }
    }
}
