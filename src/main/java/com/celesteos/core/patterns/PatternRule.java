package com.celesteos.core.patterns;

import java.util.Optional;

/**
 * One lane pattern: fires when {@code matcher} finds a match and {@code exclusion}
 * (if present) does not. The reason code is diagnostic only; nothing downstream
 * branches on it.
 */
public record PatternRule(
    PatternFamily family,
    String reasonCode,
    SafePattern matcher,
    Optional<SafePattern> exclusion
) {

    public static PatternRule of(PatternFamily family, String reasonCode, String regex) {
        return new PatternRule(family, reasonCode, SafePattern.of(reasonCode, regex), Optional.empty());
    }

    /** Same rule, vetoed whenever {@code exclusion} also matches. */
    public PatternRule excluding(SafePattern exclusion) {
        return new PatternRule(family, reasonCode, matcher, Optional.of(exclusion));
    }

    public boolean matches(String normalizedQuery) {
        if (!matcher.find(normalizedQuery)) {
            return false;
        }
        return exclusion.map(ex -> !ex.find(normalizedQuery)).orElse(true);
    }
}
