package com.celesteos.dispatch.api;

import com.celesteos.core.model.CanonicalEntity;
import com.celesteos.core.model.ClassificationResult;
import com.celesteos.core.model.ExtractedEntity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON response for the classify endpoint and {@code celeste classify --json}.
 */
public record ClassifyResponse(
    String lane,
    @JsonProperty("lane_reason") String laneReason,
    List<EntityResponse> entities,
    @JsonProperty("canonical_entities") List<CanonicalEntityResponse> canonicalEntities,
    ScoresResponse scores,
    MetadataResponse metadata
) {

    public record EntityResponse(String type, String value, double confidence) {}

    public record CanonicalEntityResponse(
        String type,
        String value,
        String canonical,
        double confidence,
        double weight
    ) {}

    public record ScoresResponse(
        @JsonProperty("intent_confidence") double intentConfidence,
        @JsonProperty("entity_confidence") double entityConfidence,
        @JsonProperty("entity_weights") Map<String, Double> entityWeights
    ) {}

    public record MetadataResponse(
        @JsonProperty("latency_ms") long latencyMs,
        @JsonProperty("entity_count") int entityCount,
        double coverage,
        @JsonProperty("modules_run") List<String> modulesRun
    ) {}

    public static ClassifyResponse from(ClassificationResult result) {
        return new ClassifyResponse(
                result.lane().name(),
                result.laneReason(),
                result.entities().stream().map(ClassifyResponse::entity).toList(),
                result.canonicalEntities().stream().map(ClassifyResponse::canonical).toList(),
                new ScoresResponse(result.scores().intentConfidence(), result.scores().entityConfidence(),
                        result.scores().entityWeights()),
                new MetadataResponse(result.metadata().latencyMs(), result.metadata().entityCount(),
                        result.metadata().coverage(), result.metadata().modulesRun()));
    }

    private static EntityResponse entity(ExtractedEntity e) {
        return new EntityResponse(e.type().wireName(), e.value(), e.confidence());
    }

    private static CanonicalEntityResponse canonical(CanonicalEntity e) {
        return new CanonicalEntityResponse(e.type().wireName(), e.value(), e.canonical(), e.confidence(), e.weight());
    }
}
