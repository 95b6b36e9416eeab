package com.animequote.infrastructure.analysis.rules;

import com.animequote.domain.analysis.model.GrammarRule;
import com.animequote.domain.analysis.model.GrammarSignature;
import com.animequote.domain.analysis.model.JlptLevel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the static rule data bundled on the classpath:
 * - rules/jlpt-vocabulary.json: [{word, reading, meaning, level}]
 * - rules/grammar-patterns.json: [{pattern, literals, regex?, description, level, example, pedagogicalNote?}]
 * - rules/particles.json: ["は", ...]
 *
 * Broken or missing data is a packaging error and fails fast with {@link RuleTableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleTableLoader {

    public static final String DEFAULT_VOCABULARY_LOCATION = "rules/jlpt-vocabulary.json";
    public static final String DEFAULT_GRAMMAR_LOCATION = "rules/grammar-patterns.json";
    public static final String DEFAULT_PARTICLES_LOCATION = "rules/particles.json";

    record VocabularyRow(String word, String reading, String meaning, JlptLevel level) {}

    record GrammarRow(String pattern,
                      List<String> literals,
                      String regex,
                      String description,
                      JlptLevel level,
                      String example,
                      String pedagogicalNote) {}

    private final ObjectMapper objectMapper;

    public Map<String, VocabularyTable.Entry> loadVocabulary() {
        return loadVocabulary(DEFAULT_VOCABULARY_LOCATION);
    }

    public Map<String, VocabularyTable.Entry> loadVocabulary(String location) {
        List<VocabularyRow> rows = read(location, new TypeReference<List<VocabularyRow>>() {});
        Map<String, VocabularyTable.Entry> entries = new LinkedHashMap<>();

        for (VocabularyRow row : rows) {
            if (row.word() == null || row.word().isBlank() || row.level() == null) {
                throw new RuleTableException("Vocabulary row without word or level in " + location + ": " + row);
            }
            VocabularyTable.Entry entry = new VocabularyTable.Entry(row.word(), row.reading(), row.meaning(), row.level());
            // A word listed at several levels keeps the easiest one
            entries.merge(row.word(), entry, (existing, incoming) -> {
                log.debug("[RuleTables] '{}' listed at {} and {}", row.word(), existing.level(), incoming.level());
                return incoming.level().isHarderThan(existing.level()) ? existing : incoming;
            });
        }

        log.info("[RuleTables] Loaded {} vocabulary entries from {}", entries.size(), location);
        return Map.copyOf(entries);
    }

    public List<GrammarRule> loadGrammarRules() {
        return loadGrammarRules(DEFAULT_GRAMMAR_LOCATION);
    }

    public List<GrammarRule> loadGrammarRules(String location) {
        List<GrammarRow> rows = read(location, new TypeReference<List<GrammarRow>>() {});
        List<GrammarRule> rules = new ArrayList<>(rows.size());

        for (GrammarRow row : rows) {
            rules.add(toRule(row, location));
        }

        log.info("[RuleTables] Loaded {} grammar patterns from {}", rules.size(), location);
        return List.copyOf(rules);
    }

    public Set<String> loadParticles() {
        return loadParticles(DEFAULT_PARTICLES_LOCATION);
    }

    public Set<String> loadParticles(String location) {
        List<String> particles = read(location, new TypeReference<List<String>>() {});
        log.info("[RuleTables] Loaded {} particles from {}", particles.size(), location);
        return Set.copyOf(new LinkedHashSet<>(particles));
    }

    private GrammarRule toRule(GrammarRow row, String location) {
        if (row.pattern() == null || row.level() == null) {
            throw new RuleTableException("Grammar row without pattern or level in " + location + ": " + row);
        }

        List<GrammarSignature> signatures = new ArrayList<>();
        if (row.literals() != null) {
            for (String literal : row.literals()) {
                if (literal != null && !literal.isEmpty()) {
                    signatures.add(new GrammarSignature.Literal(literal));
                }
            }
        }
        if (row.regex() != null && !row.regex().isEmpty()) {
            try {
                signatures.add(new GrammarSignature.RegexPattern(Pattern.compile(row.regex())));
            } catch (PatternSyntaxException e) {
                throw new RuleTableException("Invalid regex for grammar pattern " + row.pattern(), e);
            }
        }
        if (signatures.isEmpty()) {
            throw new RuleTableException("Grammar pattern " + row.pattern() + " has no signature in " + location);
        }

        return new GrammarRule(row.pattern(), signatures, row.description(), row.level(),
                row.example(), row.pedagogicalNote());
    }

    private <T> T read(String location, TypeReference<T> type) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new RuleTableException("Rule data not found on classpath: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new RuleTableException("Failed to read rule data " + location, e);
        }
    }
}
