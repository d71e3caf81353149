package com.celesteos.core.extract;

import com.celesteos.core.patterns.SafePattern;
import com.google.re2j.Matcher;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Unit normalisation for measurements: {@code "1,800 rpm" -> "1800RPM"},
 * {@code "85 \u00b0C" -> "85C"}, {@code "27.6 VDC" -> "27.6VDC"}.
 * Normalising an already normalised value returns it unchanged.
 */
public final class MeasurementUnits {

    private static final SafePattern READING =
            SafePattern.of("reading", "^[<>~]?\\s*(\\d+([.,]\\d+)*)\\s*(.*)$");
    private static final SafePattern THOUSANDS = SafePattern.of("thousands", "^\\d{1,3}(,\\d{3})+$");
    private static final SafePattern UNIT_NOISE = SafePattern.of("unit_noise", "[\\s\u00b0]+");
    private static final SafePattern DEGREE_WORD = SafePattern.of("degree_word", "^(degrees|degree|deg)");

    private static final Map<String, String> UNITS = Map.ofEntries(
            entry("c", "C"), entry("f", "F"),
            entry("v", "V"), entry("volt", "V"), entry("volts", "V"),
            entry("vdc", "VDC"), entry("vac", "VAC"),
            entry("bar", "BAR"), entry("mbar", "MBAR"), entry("psi", "PSI"), entry("kpa", "KPA"), entry("mpa", "MPA"),
            entry("rpm", "RPM"), entry("rev/min", "RPM"),
            entry("a", "A"), entry("amp", "A"), entry("amps", "A"), entry("ampere", "A"), entry("amperes", "A"),
            entry("hz", "HZ"), entry("khz", "KHZ"),
            entry("kw", "KW"), entry("hp", "HP"), entry("bhp", "BHP"),
            entry("%", "PCT"), entry("percent", "PCT"), entry("pct", "PCT"),
            entry("h", "H"), entry("hr", "H"), entry("hrs", "H"), entry("hour", "H"), entry("hours", "H")
    );

    private MeasurementUnits() {}

    /**
     * @return normalised reading, or empty if {@code value} is not number-then-unit
     */
    public static Optional<String> normalize(String value) {
        Matcher m = READING.matcher(value.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        String number = m.group(1);
        number = THOUSANDS.find(number) ? number.replace(",", "") : number.replace(',', '.');

        String unit = UNIT_NOISE.replaceAll(m.group(3).toLowerCase(Locale.ROOT), "");
        unit = DEGREE_WORD.replaceAll(unit, "");
        String canonicalUnit = UNITS.get(unit);
        if (canonicalUnit == null) {
            return Optional.empty();
        }
        return Optional.of(number + canonicalUnit);
    }
}
