package com.celesteos.core.model;

/**
 * Normalized, weighted form of an {@link ExtractedEntity}.
 *
 * @param type       entity family
 * @param value      original text as typed
 * @param canonical  stable identifier, e.g. {@code MAIN_ENGINE_1}
 * @param confidence detection confidence, raised to the maximum of its duplicate group
 * @param weight     fixed per-type importance from {@link EntityType#weight()}
 */
public record CanonicalEntity(
    EntityType type,
    String value,
    String canonical,
    double confidence,
    double weight
) {}
