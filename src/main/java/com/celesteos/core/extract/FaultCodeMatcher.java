package com.celesteos.core.extract;

import com.celesteos.core.model.EntityType;

import java.util.List;

/**
 * Fault and alarm codes across the numbering conventions seen on board: J1939 SPN/FMI,
 * MID/PID diagnostics, OEM E-codes, OBD-II, DTC labels, panel alarm numbers and raw hex.
 */
public class FaultCodeMatcher extends PatternEntityMatcher {

    private static final List<ScoredPattern> PATTERNS = List.of(
            ScoredPattern.of("j1939_spn_fmi", "\\bspn[-_/: ]?\\d{1,5}[-_/: ]?fmi[-_/: ]?\\d{1,2}\\b", 0.98),
            ScoredPattern.of("mid_pid_fmi",
                    "\\b(mid\\s*\\d+\\s*)?(psid|ppid|pid|sid|cid)\\s*[-/:]?\\s*\\d{1,4}\\s*fmi\\s*[-:]?\\s*\\d{1,2}\\b", 0.95),
            ScoredPattern.of("oem_e_code", "\\be\\d{3,4}([-_]\\d)?\\b", 0.95),
            ScoredPattern.exact("obd_ii", "\\b[PBCU][0-3]\\d{3}\\b", 0.90),
            ScoredPattern.of("dtc_label", "\\bdtc[-_:]?[a-z0-9]{3,8}\\b", 0.90),
            ScoredPattern.of("j1939_component", "\\b(spn|fmi|mid|pid|sid|cid)\\s*[-/:]?\\s*\\d{1,5}\\b", 0.88),
            ScoredPattern.of("panel_alarm", "\\b(al|alm|alarm|flt|fault|trip|shdn|warn)[-_ #]?\\d{1,4}\\b", 0.85),
            ScoredPattern.exact("hex_code", "\\b0x[0-9A-Fa-f]{3,8}\\b", 0.75)
    );

    public FaultCodeMatcher() {
        super(PATTERNS);
    }

    @Override
    public EntityType type() {
        return EntityType.FAULT_CODE;
    }
}
