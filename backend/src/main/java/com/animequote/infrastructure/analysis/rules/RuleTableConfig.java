package com.animequote.infrastructure.analysis.rules;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the rule tables once at startup. Nothing mutates them afterwards.
 */
@Configuration
public class RuleTableConfig {

    @Value("${rules.vocabulary-location:" + RuleTableLoader.DEFAULT_VOCABULARY_LOCATION + "}")
    private String vocabularyLocation;

    @Value("${rules.grammar-location:" + RuleTableLoader.DEFAULT_GRAMMAR_LOCATION + "}")
    private String grammarLocation;

    @Value("${rules.particles-location:" + RuleTableLoader.DEFAULT_PARTICLES_LOCATION + "}")
    private String particlesLocation;

    @Bean
    public VocabularyTable vocabularyTable(RuleTableLoader loader) {
        return new VocabularyTable(loader.loadVocabulary(vocabularyLocation));
    }

    @Bean
    public GrammarRuleTable grammarRuleTable(RuleTableLoader loader) {
        return new GrammarRuleTable(loader.loadGrammarRules(grammarLocation));
    }

    @Bean
    public ParticleTable particleTable(RuleTableLoader loader) {
        return new ParticleTable(loader.loadParticles(particlesLocation));
    }
}
