package com.celesteos.core.canonical;

import com.celesteos.core.extract.MeasurementUnits;
import com.celesteos.core.model.CanonicalEntity;
import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.patterns.PatternTables;
import com.celesteos.core.patterns.SafePattern;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps extracted surface forms to stable identifiers.
 * <p>
 * Output is 1:1 with input: one canonical row per extracted entity, in the same order.
 * Rows that share a type and canonical value are merged by raising every member's
 * confidence to the group maximum. Canonicalising a canonical value yields itself.
 */
public class Canonicalizer {

    private static final SafePattern NON_ALPHANUMERIC = SafePattern.exact("non_alphanumeric", "[^A-Z0-9]+");
    private static final SafePattern EDGE_UNDERSCORES = SafePattern.exact("edge_underscores", "^_+|_+$");

    private final Map<EntityType, Map<String, String>> forms;

    public Canonicalizer() {
        this(PatternTables.CANONICAL_FORMS);
    }

    public Canonicalizer(Map<EntityType, Map<String, String>> forms) {
        this.forms = Map.copyOf(forms);
    }

    public List<CanonicalEntity> canonicalize(List<ExtractedEntity> entities) {
        var rows = new ArrayList<CanonicalEntity>(entities.size());
        for (ExtractedEntity e : entities) {
            rows.add(new CanonicalEntity(e.type(), e.value(), canonicalForm(e.type(), e.value()),
                    e.confidence(), e.type().weight()));
        }
        return mergeDuplicates(rows);
    }

    /** Runs canonicalisation over already canonical rows; the result equals the input. */
    public List<CanonicalEntity> recanonicalize(List<CanonicalEntity> entities) {
        var rows = new ArrayList<CanonicalEntity>(entities.size());
        for (CanonicalEntity e : entities) {
            rows.add(new CanonicalEntity(e.type(), e.value(), canonicalForm(e.type(), e.canonical()),
                    e.confidence(), e.type().weight()));
        }
        return mergeDuplicates(rows);
    }

    /**
     * Dictionary lookup first, unit normalisation for measurements, upper snake case
     * for everything else.
     */
    public String canonicalForm(EntityType type, String value) {
        String known = forms.getOrDefault(type, Map.of()).get(PatternTables.aliasKey(value));
        if (known != null) {
            return known;
        }
        if (type == EntityType.MEASUREMENT) {
            var reading = MeasurementUnits.normalize(value);
            if (reading.isPresent()) {
                return reading.get();
            }
        }
        return upperSnake(value);
    }

    /** Canonical value to type weight, first occurrence order. */
    public Map<String, Double> summaryWeights(List<CanonicalEntity> entities) {
        var weights = new LinkedHashMap<String, Double>();
        for (CanonicalEntity e : entities) {
            weights.merge(e.canonical(), e.weight(), Math::max);
        }
        return weights;
    }

    static List<CanonicalEntity> mergeDuplicates(List<CanonicalEntity> rows) {
        var best = new HashMap<String, Double>();
        for (CanonicalEntity row : rows) {
            best.merge(groupKey(row), row.confidence(), Math::max);
        }
        var merged = new ArrayList<CanonicalEntity>(rows.size());
        for (CanonicalEntity row : rows) {
            merged.add(new CanonicalEntity(row.type(), row.value(), row.canonical(),
                    best.get(groupKey(row)), row.weight()));
        }
        return List.copyOf(merged);
    }

    private static String groupKey(CanonicalEntity row) {
        return row.type().name() + '|' + row.canonical();
    }

    static String upperSnake(String value) {
        String snake = NON_ALPHANUMERIC.replaceAll(value.toUpperCase(Locale.ROOT), "_");
        return EDGE_UNDERSCORES.replaceAll(snake, "");
    }
}
