package com.celesteos.core.extract;

import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.model.Span;
import com.google.re2j.Matcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits one candidate per match of each scored pattern. Used for the families that are
 * recognised by shape rather than by vocabulary.
 */
public abstract class PatternEntityMatcher implements EntityMatcher {

    private final List<ScoredPattern> patterns;

    protected PatternEntityMatcher(List<ScoredPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public List<ExtractedEntity> match(String query) {
        var found = new ArrayList<ExtractedEntity>();
        for (ScoredPattern scored : patterns) {
            Matcher m = scored.pattern().matcher(query);
            while (m.find()) {
                if (m.end() == m.start()) {
                    continue;
                }
                found.add(new ExtractedEntity(type(), m.group().trim(), scored.confidence(),
                        new Span(m.start(), m.end())));
            }
        }
        return found;
    }
}
