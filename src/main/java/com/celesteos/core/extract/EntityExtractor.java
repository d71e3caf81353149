package com.celesteos.core.extract;

import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.patterns.PatternTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds maritime entities in a guard-cleared query.
 * <p>
 * Works on the raw query text only and knows nothing about lanes, so the same query
 * always yields the same entities whatever lane it ends up in.
 */
public class EntityExtractor {

    private final List<EntityMatcher> matchers;

    public EntityExtractor(List<EntityMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public static EntityExtractor standard() {
        return new EntityExtractor(List.of(
                new FaultCodeMatcher(),
                new MeasurementMatcher(),
                new DictionaryMatcher(EntityType.EQUIPMENT, PatternTables.EQUIPMENT),
                new DictionaryMatcher(EntityType.SYSTEM, PatternTables.SYSTEMS),
                new DictionaryMatcher(EntityType.PART, PatternTables.PARTS),
                new DictionaryMatcher(EntityType.MARITIME_TERM, PatternTables.MARITIME_TERMS)
        ));
    }

    public List<ExtractedEntity> extract(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        var candidates = new ArrayList<ExtractedEntity>();
        for (EntityMatcher matcher : matchers) {
            candidates.addAll(matcher.match(query));
        }
        return List.copyOf(OverlapResolver.resolve(candidates));
    }

    public List<EntityMatcher> matchers() {
        return matchers;
    }
}
