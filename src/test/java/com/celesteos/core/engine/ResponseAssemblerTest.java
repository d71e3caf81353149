package com.celesteos.core.engine;

import com.celesteos.core.canonical.Canonicalizer;
import com.celesteos.core.model.CanonicalEntity;
import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.model.Lane;
import com.celesteos.core.model.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseAssemblerTest {

    private final ResponseAssembler assembler = new ResponseAssembler(new Canonicalizer());

    @Test
    @DisplayName("Terminal result carries no entities and zero entity confidence")
    void terminal() {
        var result = assembler.terminal(Lane.BLOCKED, "injection_token", 1.0, 3, List.of("input_check", "guard_stack"));
        assertEquals(Lane.BLOCKED, result.lane());
        assertTrue(result.entities().isEmpty());
        assertEquals(0.0, result.scores().entityConfidence());
        assertEquals(Map.of(), result.scores().entityWeights());
        assertEquals(3, result.metadata().latencyMs());
    }

    @Test
    @DisplayName("Entity confidence is the mean over canonical rows")
    void entityConfidenceMean() {
        var extracted = List.of(
                new ExtractedEntity(EntityType.EQUIPMENT, "ME1", 0.9, new Span(0, 3)),
                new ExtractedEntity(EntityType.FAULT_CODE, "E047", 0.5, new Span(4, 8)));
        var canonical = List.of(
                new CanonicalEntity(EntityType.EQUIPMENT, "ME1", "MAIN_ENGINE_1", 0.9, 0.95),
                new CanonicalEntity(EntityType.FAULT_CODE, "E047", "E047", 0.5, 1.0));
        var result = assembler.assemble(Lane.UNKNOWN, "no_pattern_match", 0.0, "ME1 E047",
                extracted, canonical, 1, List.of());
        assertEquals(0.7, result.scores().entityConfidence(), 1e-9);
        assertEquals(2, result.metadata().entityCount());
        assertEquals(1.0, result.metadata().coverage());
    }

    @Test
    @DisplayName("Coverage ignores stop words and rounds to three places")
    void coverage() {
        var entity = new ExtractedEntity(EntityType.EQUIPMENT, "watermaker", 0.95, new Span(9, 19));
        // "watermaker" covered; "flushing" and "schedule" not
        assertEquals(0.333, ResponseAssembler.coverage("show the watermaker flushing schedule", List.of(entity)));
    }

    @Test
    @DisplayName("Query of only stop words counts as fully covered")
    void onlyStopWords() {
        assertEquals(1.0, ResponseAssembler.coverage("show me all of it", List.of()));
    }

    @Test
    @DisplayName("Coverage offsets follow the raw query when lower-casing changes its length")
    void coverageOnRawOffsets() {
        // U+0130 lower-cases to two chars, which would shift every later token
        String query = "\u0130".repeat(20) + " WATERMAKER";
        var entity = new ExtractedEntity(EntityType.EQUIPMENT, "WATERMAKER", 0.95, new Span(21, 31));
        assertEquals(1.0, ResponseAssembler.coverage(query, List.of(entity)));
    }

    @Test
    @DisplayName("Upper-case stop words are still ignored")
    void upperCaseStopWords() {
        assertEquals(1.0, ResponseAssembler.coverage("SHOW ME ALL OF IT", List.of()));
    }
}
