package com.celesteos.core.engine;

import com.celesteos.core.canonical.Canonicalizer;
import com.celesteos.core.model.CanonicalEntity;
import com.celesteos.core.model.ClassificationResult;
import com.celesteos.core.model.ClassificationResult.Metadata;
import com.celesteos.core.model.ClassificationResult.Scores;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.model.Lane;
import com.celesteos.core.patterns.PatternTables;
import com.celesteos.core.patterns.SafePattern;
import com.google.re2j.Matcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link ClassificationResult} from what the pipeline produced. Pure formatting,
 * no decisions.
 */
public class ResponseAssembler {

    private static final SafePattern TOKEN = SafePattern.of("token", "[a-z0-9][-a-z0-9]*[a-z0-9]|[a-z0-9]");

    private final Canonicalizer canonicalizer;

    public ResponseAssembler(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /** Result for a query stopped before lane classification: no entities. */
    public ClassificationResult terminal(Lane lane, String reason, double intentConfidence,
                                         long latencyMs, List<String> modulesRun) {
        return new ClassificationResult(lane, reason, List.of(), List.of(),
                new Scores(intentConfidence, 0.0, Map.of()),
                new Metadata(latencyMs, 0, 0.0, List.copyOf(modulesRun)));
    }

    public ClassificationResult assemble(Lane lane, String reason, double intentConfidence, String query,
                                         List<ExtractedEntity> entities, List<CanonicalEntity> canonical,
                                         long latencyMs, List<String> modulesRun) {
        double entityConfidence = canonical.stream()
                .mapToDouble(CanonicalEntity::confidence)
                .average()
                .orElse(0.0);
        var scores = new Scores(intentConfidence, entityConfidence,
                Map.copyOf(canonicalizer.summaryWeights(canonical)));
        var metadata = new Metadata(latencyMs, canonical.size(), coverage(query, entities),
                List.copyOf(modulesRun));
        return new ClassificationResult(lane, reason, List.copyOf(entities), List.copyOf(canonical),
                scores, metadata);
    }

    /**
     * Share of meaningful tokens (stop words excluded) that sit inside an entity span,
     * rounded to three places. A query with no meaningful tokens is fully covered.
     */
    static double coverage(String query, List<ExtractedEntity> entities) {
        // offsets must stay in the raw query, where the entity spans were taken
        Matcher m = TOKEN.matcher(query);
        var meaningful = new ArrayList<int[]>();
        while (m.find()) {
            if (!PatternTables.STOP_WORDS.contains(m.group().toLowerCase(Locale.ROOT))) {
                meaningful.add(new int[]{m.start(), m.end()});
            }
        }
        if (meaningful.isEmpty()) {
            return 1.0;
        }
        long covered = meaningful.stream()
                .filter(t -> entities.stream().anyMatch(e -> e.span().start() < t[1] && t[0] < e.span().end()))
                .count();
        return Math.round(covered * 1000.0 / meaningful.size()) / 1000.0;
    }
}
