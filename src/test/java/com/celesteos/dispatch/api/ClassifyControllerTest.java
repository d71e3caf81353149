package com.celesteos.dispatch.api;

import com.celesteos.core.engine.RoutingService;
import com.celesteos.core.model.CanonicalEntity;
import com.celesteos.core.model.ClassificationResult;
import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.model.Lane;
import com.celesteos.core.model.Span;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ClassifyController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ClassifyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private RoutingService routingService;

    private static ClassificationResult gptResult() {
        return new ClassificationResult(
                Lane.GPT,
                "diagnostic_intent",
                List.of(new ExtractedEntity(EntityType.FAULT_CODE, "E047", 0.95, new Span(9, 13)),
                        new ExtractedEntity(EntityType.EQUIPMENT, "ME1", 0.90, new Span(17, 20))),
                List.of(new CanonicalEntity(EntityType.FAULT_CODE, "E047", "E047", 0.95, 1.0),
                        new CanonicalEntity(EntityType.EQUIPMENT, "ME1", "MAIN_ENGINE_1", 0.90, 0.95)),
                new ClassificationResult.Scores(0.85, 0.925, Map.of("E047", 1.0, "MAIN_ENGINE_1", 0.95)),
                new ClassificationResult.Metadata(2, 2, 0.667,
                        List.of("input_check", "guard_stack", "lane_classifier", "entity_extractor", "canonicalizer")));
    }

    @Test
    @DisplayName("POST /classify returns the snake_case result")
    void classify() throws Exception {
        when(routingService.route(eq("diagnose E047 on ME1"), any())).thenReturn(gptResult());

        String body = objectMapper.writeValueAsString(
                new ClassifyRequest("diagnose E047 on ME1", Map.of("role", "engineer")));

        mockMvc.perform(post("/api/v1/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lane").value("GPT"))
                .andExpect(jsonPath("$.lane_reason").value("diagnostic_intent"))
                .andExpect(jsonPath("$.entities", hasSize(2)))
                .andExpect(jsonPath("$.entities[0].type").value("fault_code"))
                .andExpect(jsonPath("$.canonical_entities[1].canonical").value("MAIN_ENGINE_1"))
                .andExpect(jsonPath("$.canonical_entities[1].weight").value(0.95))
                .andExpect(jsonPath("$.scores.intent_confidence").value(0.85))
                .andExpect(jsonPath("$.scores.entity_weights.E047").value(1.0))
                .andExpect(jsonPath("$.metadata.latency_ms").value(2))
                .andExpect(jsonPath("$.metadata.modules_run", hasSize(5)));
    }

    @Test
    @DisplayName("POST /classify with an empty object still answers 200")
    void emptyBody() throws Exception {
        var unknown = new ClassificationResult(Lane.UNKNOWN, "empty_or_invalid", List.of(), List.of(),
                new ClassificationResult.Scores(1.0, 0.0, Map.of()),
                new ClassificationResult.Metadata(0, 0, 0.0, List.of("input_check")));
        when(routingService.route(isNull(), isNull())).thenReturn(unknown);

        mockMvc.perform(post("/api/v1/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lane").value("UNKNOWN"))
                .andExpect(jsonPath("$.lane_reason").value("empty_or_invalid"))
                .andExpect(jsonPath("$.canonical_entities", hasSize(0)));
    }
}
