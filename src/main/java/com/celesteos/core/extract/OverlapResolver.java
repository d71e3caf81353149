package com.celesteos.core.extract;

import com.celesteos.core.model.ExtractedEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps at most one detection per stretch of text. Higher confidence wins; ties go to the
 * more specific type (fault code, then equipment, down to generic terms), then to the
 * longer span. Losers are dropped, never averaged.
 */
public final class OverlapResolver {

    static final Comparator<ExtractedEntity> PRIORITY =
            Comparator.comparingDouble(ExtractedEntity::confidence).reversed()
                    .thenComparing(Comparator.comparingInt((ExtractedEntity e) -> e.type().specificity()).reversed())
                    .thenComparing(Comparator.comparingInt((ExtractedEntity e) -> e.span().length()).reversed())
                    .thenComparingInt(e -> e.span().start());

    private OverlapResolver() {}

    /**
     * @return surviving detections ordered by position in the query
     */
    public static List<ExtractedEntity> resolve(List<ExtractedEntity> candidates) {
        var ranked = new ArrayList<>(candidates);
        ranked.sort(PRIORITY);

        var kept = new ArrayList<ExtractedEntity>();
        for (ExtractedEntity candidate : ranked) {
            boolean overlaps = kept.stream().anyMatch(k -> k.span().overlaps(candidate.span()));
            if (!overlaps) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingInt((ExtractedEntity e) -> e.span().start())
                .thenComparingInt(e -> e.span().end()));
        return kept;
    }
}
