package com.celesteos.core.extract;

import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;

import java.util.List;

/**
 * Recognises one entity family in a raw query. Candidates may overlap each other;
 * {@link OverlapResolver} decides which survive.
 */
public interface EntityMatcher {

    EntityType type();

    List<ExtractedEntity> match(String query);
}
