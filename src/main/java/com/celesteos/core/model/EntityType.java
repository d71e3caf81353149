package com.celesteos.core.model;

/**
 * Maritime entity families recognised by the extractor.
 * <p>
 * {@code weight} is a fixed importance constant per type, independent of the query.
 * {@code specificity} breaks confidence ties during overlap resolution (higher wins).
 */
public enum EntityType {

    FAULT_CODE("fault_code", 1.00, 6),
    EQUIPMENT("equipment", 0.95, 5),
    SYSTEM("system", 0.90, 4),
    MEASUREMENT("measurement", 0.85, 3),
    PART("part", 0.80, 2),
    MARITIME_TERM("maritime_term", 0.75, 1);

    private final String wireName;
    private final double weight;
    private final int specificity;

    EntityType(String wireName, double weight, int specificity) {
        this.wireName = wireName;
        this.weight = weight;
        this.specificity = specificity;
    }

    public String wireName() {
        return wireName;
    }

    public double weight() {
        return weight;
    }

    public int specificity() {
        return specificity;
    }
}
