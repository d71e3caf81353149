package com.celesteos.core.engine;

import com.celesteos.core.canonical.Canonicalizer;
import com.celesteos.core.extract.EntityExtractor;
import com.celesteos.core.guard.ContentGuard;
import com.celesteos.core.guard.GuardStack;
import com.celesteos.core.guard.GuardVerdict;
import com.celesteos.core.lane.LaneClassifier;
import com.celesteos.core.lane.LaneDecision;
import com.celesteos.core.model.CanonicalEntity;
import com.celesteos.core.model.ClassificationResult;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.model.Lane;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the router: input check, guard stack, lane cascade, then entity
 * extraction and canonicalisation. The input check only rejects null, blank and oversized
 * text; content-based rejections are guards, so they run after the injection scan.
 * <p>
 * {@link #classify(String)} is total. Any internal fault is logged and the query is
 * routed to {@link Lane#BLOCKED}; a fault never widens what a query may do.
 */
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    public static final String EMPTY_OR_INVALID = ContentGuard.EMPTY_OR_INVALID;
    public static final String BARE_NUMBER = ContentGuard.BARE_NUMBER;

    public static final String INPUT_CHECK = "input_check";
    public static final String GUARD_STACK = "guard_stack";
    public static final String LANE_CLASSIFIER = "lane_classifier";
    public static final String ENTITY_EXTRACTOR = "entity_extractor";
    public static final String CANONICALIZER = "canonicalizer";

    static final double VERDICT_CONFIDENCE = 1.0;

    private final GuardStack guards;
    private final LaneClassifier lanes;
    private final EntityExtractor extractor;
    private final Canonicalizer canonicalizer;
    private final ResponseAssembler assembler;
    private final int maxQueryLength;

    public QueryClassifier(GuardStack guards, LaneClassifier lanes, EntityExtractor extractor,
                           Canonicalizer canonicalizer, ResponseAssembler assembler, int maxQueryLength) {
        this.guards = guards;
        this.lanes = lanes;
        this.extractor = extractor;
        this.canonicalizer = canonicalizer;
        this.assembler = assembler;
        this.maxQueryLength = maxQueryLength;
    }

    public static QueryClassifier withDefaults() {
        var canonicalizer = new Canonicalizer();
        return new QueryClassifier(GuardStack.standard(100, 0.5), new LaneClassifier(),
                EntityExtractor.standard(), canonicalizer, new ResponseAssembler(canonicalizer), 2000);
    }

    public ClassificationResult classify(String query) {
        return classify(query, Map.of());
    }

    /**
     * @param context opaque caller context (user, yacht, role); accepted but not read by routing
     */
    public ClassificationResult classify(String query, Map<String, String> context) {
        long start = System.nanoTime();
        var modules = new ArrayList<String>();
        try {
            return run(query, start, modules);
        } catch (RuntimeException e) {
            log.error("Classification failed in {}; routing to BLOCKED", modules, e);
            return assembler.terminal(Lane.BLOCKED, GuardStack.INTERNAL_FAULT, VERDICT_CONFIDENCE,
                    elapsedMs(start), modules);
        }
    }

    private ClassificationResult run(String query, long start, List<String> modules) {
        modules.add(INPUT_CHECK);
        if (!acceptable(query)) {
            log.debug("Rejected empty or oversized query");
            return assembler.terminal(Lane.UNKNOWN, EMPTY_OR_INVALID, VERDICT_CONFIDENCE, elapsedMs(start), modules);
        }

        modules.add(GUARD_STACK);
        Optional<GuardVerdict> verdict = guards.evaluate(query);
        if (verdict.isPresent()) {
            GuardVerdict v = verdict.get();
            log.info("Guard '{}' stopped query: lane={} reason={}", v.guard(), v.lane(), v.reasonCode());
            return assembler.terminal(v.lane(), v.reasonCode(), VERDICT_CONFIDENCE, elapsedMs(start), modules);
        }

        modules.add(LANE_CLASSIFIER);
        LaneDecision decision = lanes.classify(query);

        modules.add(ENTITY_EXTRACTOR);
        List<ExtractedEntity> entities = extractor.extract(query);

        modules.add(CANONICALIZER);
        List<CanonicalEntity> canonical = canonicalizer.canonicalize(entities);

        log.debug("Routed to {} ({}), {} entities", decision.lane(), decision.reasonCode(), canonical.size());
        return assembler.assemble(decision.lane(), decision.reasonCode(), decision.intentConfidence(), query,
                entities, canonical, elapsedMs(start), modules);
    }

    boolean acceptable(String query) {
        return query != null && !query.isBlank() && query.length() <= maxQueryLength;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
