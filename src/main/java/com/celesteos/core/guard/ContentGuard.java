package com.celesteos.core.guard;

import java.util.Optional;

/**
 * Stops queries with nothing to route: no letters or digits at all, or a short run of
 * digits that is too small to be an identifier.
 */
public class ContentGuard implements GuardRule {

    public static final String NAME = "content_check";

    public static final String EMPTY_OR_INVALID = "empty_or_invalid";
    public static final String BARE_NUMBER = "bare_number";

    static final int MIN_IDENTIFIER_DIGITS = 6;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GuardVerdict> check(String query) {
        int letters = 0;
        int digits = 0;
        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
            } else if (Character.isDigit(c)) {
                digits++;
            }
        }
        if (letters == 0 && digits == 0) {
            return Optional.of(GuardVerdict.unknown(EMPTY_OR_INVALID, NAME));
        }
        if (letters == 0 && digits < MIN_IDENTIFIER_DIGITS) {
            return Optional.of(GuardVerdict.unknown(BARE_NUMBER, NAME));
        }
        return Optional.empty();
    }
}
