package com.celesteos.core.lane;

import com.celesteos.core.model.Lane;
import com.celesteos.core.patterns.PatternFamily;

import java.util.Optional;

/**
 * Outcome of the pattern cascade.
 *
 * @param lane             assigned lane
 * @param reasonCode       diagnostic reason of the rule that fired, or the fallback reason
 * @param family           family of the rule that fired; empty for the fallback
 * @param intentConfidence confidence reported for the decision
 */
public record LaneDecision(
    Lane lane,
    String reasonCode,
    Optional<PatternFamily> family,
    double intentConfidence
) {

    public static final String NO_PATTERN_MATCH = "no_pattern_match";

    public static LaneDecision fallback() {
        return new LaneDecision(Lane.UNKNOWN, NO_PATTERN_MATCH, Optional.empty(), 0.0);
    }
}
