package com.animequote.infrastructure.analysis;

import com.animequote.domain.analysis.model.GrammarMatch;
import com.animequote.domain.analysis.model.GrammarRule;
import com.animequote.domain.analysis.model.JlptLevel;
import com.animequote.infrastructure.analysis.rules.GrammarRuleTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates every grammar rule against the sentence, in table order. Rules do not suppress
 * each other: a sentence with ています also matches ます.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GrammarPatternDetector {

    static final GrammarRule SIMPLE_SENTENCE = new GrammarRule(
            "Simple sentence",
            List.of(),
            "Simple declarative sentence structure.",
            JlptLevel.N5,
            "これは本です (This is a book)",
            null
    );

    private final GrammarRuleTable grammarRuleTable;

    /**
     * @return matches in rule order, never empty
     */
    public List<GrammarMatch> detect(String text) {
        List<GrammarMatch> matches = new ArrayList<>();

        for (GrammarRule rule : grammarRuleTable.rules()) {
            Optional<String> found = rule.findIn(text);
            found.ifPresent(example -> matches.add(new GrammarMatch(rule, example, rule.pedagogicalNote())));
        }

        if (matches.isEmpty()) {
            matches.add(new GrammarMatch(SIMPLE_SENTENCE, null, null));
        }

        log.debug("[GrammarDetector] {} patterns in '{}'", matches.size(), text);
        return matches;
    }
}
