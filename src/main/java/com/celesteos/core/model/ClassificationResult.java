package com.celesteos.core.model;

import java.util.List;
import java.util.Map;

/**
 * Sole externally visible artifact of a classification. Created, returned, discarded.
 */
public record ClassificationResult(
    Lane lane,
    String laneReason,
    List<ExtractedEntity> entities,
    List<CanonicalEntity> canonicalEntities,
    Scores scores,
    Metadata metadata
) {

    /**
     * @param intentConfidence confidence of the lane decision
     * @param entityConfidence mean confidence of the canonical entities, 0 when none
     * @param entityWeights    canonical value to weight
     */
    public record Scores(
        double intentConfidence,
        double entityConfidence,
        Map<String, Double> entityWeights
    ) {}

    /**
     * @param latencyMs   wall time spent inside the classifier
     * @param entityCount number of canonical entities
     * @param coverage    share of meaningful query tokens covered by entities
     * @param modulesRun  pipeline stages that ran, in order
     */
    public record Metadata(
        long latencyMs,
        int entityCount,
        double coverage,
        List<String> modulesRun
    ) {}
}
