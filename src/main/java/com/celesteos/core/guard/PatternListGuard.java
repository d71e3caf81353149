package com.celesteos.core.guard;

import com.celesteos.core.model.Lane;
import com.celesteos.core.patterns.SafePattern;

import java.util.List;
import java.util.Optional;

/**
 * Fires when any pattern in a fixed list matches. Base for the vocabulary guards.
 */
public abstract class PatternListGuard implements GuardRule {

    private final List<SafePattern> patterns;
    private final Lane lane;
    private final String reasonCode;

    protected PatternListGuard(List<SafePattern> patterns, Lane lane, String reasonCode) {
        this.patterns = List.copyOf(patterns);
        this.lane = lane;
        this.reasonCode = reasonCode;
    }

    @Override
    public Optional<GuardVerdict> check(String query) {
        for (SafePattern pattern : patterns) {
            if (pattern.find(query)) {
                return Optional.of(new GuardVerdict(lane, reasonCode, name()));
            }
        }
        return Optional.empty();
    }

    /** Name of the first matching pattern, for logs and tests. Empty when nothing matches. */
    public Optional<String> firstMatch(String query) {
        return patterns.stream()
                .filter(p -> p.find(query))
                .map(SafePattern::name)
                .findFirst();
    }

    public int size() {
        return patterns.size();
    }
}
