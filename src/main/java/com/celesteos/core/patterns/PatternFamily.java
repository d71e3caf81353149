package com.celesteos.core.patterns;

import com.celesteos.core.model.Lane;

/**
 * Lane pattern families in cascade order. The first family with a matching rule wins.
 * {@code intentConfidence} is reported as the intent score when the family decides the lane.
 */
public enum PatternFamily {

    ELLIPTICAL(Lane.RULES_ONLY, 0.80),
    IMPLICIT_ACTION(Lane.RULES_ONLY, 0.85),
    COMMAND(Lane.RULES_ONLY, 0.95),
    DIRECT_LOOKUP(Lane.NO_LLM, 0.90),
    DIAGNOSTIC(Lane.GPT, 0.85);

    private final Lane lane;
    private final double intentConfidence;

    PatternFamily(Lane lane, double intentConfidence) {
        this.lane = lane;
        this.intentConfidence = intentConfidence;
    }

    public Lane lane() {
        return lane;
    }

    public double intentConfidence() {
        return intentConfidence;
    }
}
