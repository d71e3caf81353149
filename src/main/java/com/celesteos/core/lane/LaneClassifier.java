package com.celesteos.core.lane;

import com.celesteos.core.patterns.PatternRule;
import com.celesteos.core.patterns.PatternTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Assigns a lane to a guard-cleared query by walking {@link PatternTables#LANE_RULES}
 * in order: elliptical, implicit action, command, direct lookup, diagnostic.
 * <p>
 * Nothing matched means {@code UNKNOWN}. Not understanding a query is never treated as
 * permission to look it up.
 */
public class LaneClassifier {

    private static final Logger log = LoggerFactory.getLogger(LaneClassifier.class);

    private final List<PatternRule> rules;

    public LaneClassifier() {
        this(PatternTables.LANE_RULES);
    }

    public LaneClassifier(List<PatternRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public LaneDecision classify(String query) {
        String normalized = QueryNormalizer.normalize(query);
        return firstMatch(normalized)
                .map(rule -> new LaneDecision(rule.family().lane(), rule.reasonCode(),
                        Optional.of(rule.family()), rule.family().intentConfidence()))
                .orElseGet(LaneDecision::fallback);
    }

    /** First rule in cascade order that matches the already-normalised query. */
    public Optional<PatternRule> firstMatch(String normalizedQuery) {
        for (PatternRule rule : rules) {
            if (rule.matches(normalizedQuery)) {
                log.trace("Lane rule {} matched", rule.reasonCode());
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<PatternRule> rules() {
        return rules;
    }
}
