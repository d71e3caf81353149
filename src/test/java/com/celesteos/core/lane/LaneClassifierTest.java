package com.celesteos.core.lane;

import com.celesteos.core.model.Lane;
import com.celesteos.core.patterns.PatternFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LaneClassifierTest {

    private final LaneClassifier classifier = new LaneClassifier();

    @ParameterizedTest(name = "{0} -> {1} ({2})")
    @CsvSource({
            "me1,                                       RULES_ONLY, elliptical_equipment_abbrev",
            "open work orders,                          RULES_ONLY, elliptical_work_list",
            "handover,                                  RULES_ONLY, elliptical_view",
            "replaced the impeller on the sea water pump, RULES_ONLY, implicit_maintenance_done",
            "used 2 filters on gen 1,                   RULES_ONLY, implicit_part_usage",
            "the parts have arrived,                    RULES_ONLY, implicit_receiving",
            "create a work order for the watermaker,    RULES_ONLY, command_create",
            "log running hours for me1,                 RULES_ONLY, command_log",
            "mark wo 123 as done,                       RULES_ONLY, command_mark",
            "wo 1234,                                   NO_LLM,     lookup_work_order_number",
            "E047,                                      NO_LLM,     lookup_fault_code",
            "CAT 3512,                                  NO_LLM,     lookup_model_number",
            "show me1 manual,                           NO_LLM,     lookup_show_find",
            "watermaker manual,                         NO_LLM,     lookup_attribute",
            "how many impellers do we have,             NO_LLM,     lookup_stock_count",
            "why is the generator overheating,          GPT,        diagnostic_intent",
            "bilge pump keeps tripping,                 GPT,        problem_vocabulary"
    })
    @DisplayName("Each family routes to its lane")
    void familyRouting(String query, Lane lane, String reason) {
        LaneDecision decision = classifier.classify(query);
        assertEquals(lane, decision.lane());
        assertEquals(reason, decision.reasonCode());
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("Entity soup with no verb is UNKNOWN")
        void entitySoup() {
            LaneDecision decision = classifier.classify("main engine generator watermaker AC");
            assertEquals(Lane.UNKNOWN, decision.lane());
            assertEquals(LaneDecision.NO_PATTERN_MATCH, decision.reasonCode());
            assertEquals(Optional.empty(), decision.family());
            assertEquals(0.0, decision.intentConfidence());
        }

        @Test
        @DisplayName("A read verb combined with a mutation verb is not a lookup")
        void mutationVetoesLookup() {
            assertEquals(Lane.UNKNOWN, classifier.classify("show the wo to delete").lane());
        }

        @Test
        @DisplayName("Bare courtesy is UNKNOWN")
        void courtesyOnly() {
            assertEquals(Lane.UNKNOWN, classifier.classify("please").lane());
        }
    }

    @Nested
    @DisplayName("Cascade")
    class Cascade {

        @Test
        @DisplayName("Intent confidence comes from the winning family")
        void intentConfidence() {
            LaneDecision decision = classifier.classify("create work order for bilge pump");
            assertEquals(Optional.of(PatternFamily.COMMAND), decision.family());
            assertEquals(0.95, decision.intentConfidence());
        }

        @Test
        @DisplayName("Earlier family wins when several could match")
        void earlierFamilyWins() {
            // implicit action is checked before diagnostic vocabulary
            LaneDecision decision = classifier.classify("replaced the leaking impeller");
            assertEquals(PatternFamily.IMPLICIT_ACTION, decision.family().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Normalisation")
    class Normalisation {

        @Test
        @DisplayName("Polite wrappers are stripped from both ends")
        void politeWrappers() {
            assertEquals("show wo 5", QueryNormalizer.normalize("Can you, please, show WO 5?"));
            assertEquals("show me1 manual", QueryNormalizer.normalize("please show ME1 manual thanks"));
        }

        @Test
        @DisplayName("Politeness alone is kept")
        void politenessKept() {
            assertEquals("please", QueryNormalizer.normalize("Please"));
        }

        @Test
        @DisplayName("Polite prefix does not hide a command")
        void politeCommand() {
            assertEquals(Lane.RULES_ONLY, classifier.classify("hi, create a work order for the bow thruster").lane());
        }
    }
}
