package com.animequote.infrastructure.analysis;

import com.animequote.domain.analysis.model.JlptLevel;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Sentence level = hardest recognized vocabulary level. Without any recognized word,
 * a coarse length heuristic decides:
 *   > 25 code points with kanji → N2, > 20 → N3, > 12 → N4, otherwise N5.
 */
@Component
public class JlptLevelClassifier {

    private static final int N2_MIN_LENGTH = 26;
    private static final int N3_MIN_LENGTH = 21;
    private static final int N4_MIN_LENGTH = 13;

    private static final Pattern KANJI = Pattern.compile("[\\u4E00-\\u9FAF]");

    public JlptLevel classify(String text, Collection<JlptLevel> recognizedLevels) {
        if (recognizedLevels != null && !recognizedLevels.isEmpty()) {
            JlptLevel level = JlptLevel.N5;
            for (JlptLevel recognized : recognizedLevels) {
                if (recognized != null) {
                    level = JlptLevel.hardest(level, recognized);
                }
            }
            return level;
        }
        return classifyByLength(text);
    }

    JlptLevel classifyByLength(String text) {
        if (text == null || text.isEmpty()) {
            return JlptLevel.N5;
        }
        int length = text.codePointCount(0, text.length());
        if (length >= N2_MIN_LENGTH && KANJI.matcher(text).find()) {
            return JlptLevel.N2;
        }
        if (length >= N3_MIN_LENGTH) {
            return JlptLevel.N3;
        }
        if (length >= N4_MIN_LENGTH) {
            return JlptLevel.N4;
        }
        return JlptLevel.N5;
    }
}
