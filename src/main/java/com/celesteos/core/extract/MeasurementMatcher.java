package com.celesteos.core.extract;

import com.celesteos.core.model.EntityType;

import java.util.List;

/**
 * Physical readings: temperature, voltage, pressure, RPM, current, frequency, power,
 * percentages and running hours. Units are normalised later by {@link MeasurementUnits}.
 */
public class MeasurementMatcher extends PatternEntityMatcher {

    private static final String NUMBER = "\\d+([.,]\\d+)?";

    private static final List<ScoredPattern> PATTERNS = List.of(
            ScoredPattern.of("temperature", "\\b\\d{1,3}([.,]\\d+)?(\\s*\u00b0\\s*|\\s*deg(rees?)?\\s*)?[cf]\\b", 0.90),
            ScoredPattern.of("voltage", "\\b" + NUMBER + "\\s*(vdc|vac|volts?|v)\\b", 0.90),
            ScoredPattern.of("pressure", "\\b" + NUMBER + "\\s*(mbar|bar|psi|kpa|mpa)\\b", 0.90),
            ScoredPattern.of("rpm", "\\b(\\d{1,3}(,\\d{3})+|\\d{1,5})\\s*(rpm|rev/min)\\b", 0.90),
            ScoredPattern.of("current_word", "\\b" + NUMBER + "\\s*(amps?|amperes?)\\b", 0.90),
            ScoredPattern.exact("current_symbol", "\\b\\d+(\\.\\d+)?\\s?A\\b", 0.85),
            ScoredPattern.of("frequency", "\\b" + NUMBER + "\\s*(khz|hz)\\b", 0.90),
            ScoredPattern.of("power", "\\b" + NUMBER + "\\s*(kw|bhp|hp)\\b", 0.90),
            ScoredPattern.of("percentage", "\\b\\d{1,3}([.,]\\d+)?\\s*(%|percent\\b)", 0.85),
            ScoredPattern.of("running_hours", "\\b\\d{1,6}\\s*(hrs|hr|hours|hour|h)\\b", 0.80)
    );

    public MeasurementMatcher() {
        super(PATTERNS);
    }

    @Override
    public EntityType type() {
        return EntityType.MEASUREMENT;
    }
}
