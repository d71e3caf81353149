package com.celesteos.core.model;

/**
 * A single detection produced by the entity extractor.
 *
 * @param type       entity family
 * @param value      matched text exactly as typed
 * @param confidence detection confidence in [0, 1]
 * @param span       location of the match in the raw query
 */
public record ExtractedEntity(
    EntityType type,
    String value,
    double confidence,
    Span span
) {}
