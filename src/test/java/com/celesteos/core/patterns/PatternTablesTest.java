package com.celesteos.core.patterns;

import com.celesteos.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PatternTablesTest {

    @Test
    @DisplayName("aliasKey lower-cases, collapses whitespace and folds typographic apostrophes")
    void aliasKeyNormalises() {
        assertEquals("main engine 1", PatternTables.aliasKey("  Main   ENGINE\t1 "));
        assertEquals("won't start", PatternTables.aliasKey("Won’t start"));
    }

    @Test
    @DisplayName("Every dictionary family is present and non-empty")
    void dictionariesPresent() {
        for (EntityType type : List.of(EntityType.EQUIPMENT, EntityType.SYSTEM, EntityType.PART, EntityType.MARITIME_TERM)) {
            assertFalse(PatternTables.DICTIONARIES.get(type).isEmpty(), type + " dictionary should not be empty");
            assertFalse(PatternTables.CANONICAL_FORMS.get(type).isEmpty(), type + " canonical forms should not be empty");
        }
        assertFalse(PatternTables.DICTIONARIES.containsKey(EntityType.FAULT_CODE));
        assertFalse(PatternTables.DICTIONARIES.containsKey(EntityType.MEASUREMENT));
    }

    @Test
    @DisplayName("A canonical value that is also an alias key maps to itself")
    void canonicalValuesAreFixedPoints() {
        for (Map.Entry<EntityType, Map<String, String>> family : PatternTables.CANONICAL_FORMS.entrySet()) {
            Map<String, String> forms = family.getValue();
            for (String canonical : forms.values()) {
                String asKey = PatternTables.aliasKey(canonical);
                if (forms.containsKey(asKey)) {
                    assertEquals(canonical, forms.get(asKey),
                            family.getKey() + " canonical " + canonical + " is an alias of something else");
                }
            }
        }
    }

    @Test
    @DisplayName("Alias confidences lie in (0, 1]")
    void aliasConfidencesInRange() {
        PatternTables.DICTIONARIES.values().stream().flatMap(List::stream).forEach(alias ->
                assertTrue(alias.confidence() > 0 && alias.confidence() <= 1.0, alias.phrase()));
    }

    @Test
    @DisplayName("Lane rules are ordered by family cascade")
    void laneRulesInCascadeOrder() {
        int previous = -1;
        for (PatternRule rule : PatternTables.LANE_RULES) {
            assertTrue(rule.family().ordinal() >= previous, rule.reasonCode() + " is out of cascade order");
            previous = rule.family().ordinal();
        }
    }

    @Test
    @DisplayName("Exclusion pattern vetoes an otherwise matching rule")
    void exclusionVetoesRule() {
        var rule = PatternRule.of(PatternFamily.DIRECT_LOOKUP, "show", "^show\\b")
                .excluding(PatternTables.MUTATION_VERBS);
        assertTrue(rule.matches("show the watermaker manual"));
        assertFalse(rule.matches("show and delete the watermaker manual"));
    }
}
