package com.animequote.infrastructure.analysis.rules;

import com.animequote.domain.analysis.model.GrammarRule;

import java.util.List;

/**
 * Ordered grammar rules. Order decides the order of matches in an analysis.
 */
public class GrammarRuleTable {

    private final List<GrammarRule> rules;

    public GrammarRuleTable(List<GrammarRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<GrammarRule> rules() {
        return rules;
    }
}
