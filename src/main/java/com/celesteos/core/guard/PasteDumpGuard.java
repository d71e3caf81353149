package com.celesteos.core.guard;

import java.util.Optional;

/**
 * Flags long input that is mostly non-alphabetic: pasted logs, hex dumps, symbol soup.
 */
public class PasteDumpGuard implements GuardRule {

    public static final String NAME = "paste_dump";

    private final int minLength;
    private final double minAlphaRatio;

    public PasteDumpGuard(int minLength, double minAlphaRatio) {
        this.minLength = minLength;
        this.minAlphaRatio = minAlphaRatio;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GuardVerdict> check(String query) {
        if (query.length() <= minLength) {
            return Optional.empty();
        }
        long letters = query.chars().filter(Character::isLetter).count();
        double ratio = (double) letters / query.length();
        if (ratio < minAlphaRatio) {
            return Optional.of(GuardVerdict.unknown("paste_dump", NAME));
        }
        return Optional.empty();
    }
}
