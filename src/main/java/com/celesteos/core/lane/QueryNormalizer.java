package com.celesteos.core.lane;

import com.celesteos.core.patterns.PatternTables;
import com.google.re2j.Matcher;

import java.util.Locale;

/**
 * Single normalisation pass applied before lane matching: lower case, whitespace
 * collapsed, typographic apostrophes folded, politeness stripped from both ends.
 * <p>
 * Politeness is only removed while something remains, so a query that is nothing but
 * "please" keeps its text and falls through to the fallback lane.
 */
public final class QueryNormalizer {

    private static final int MAX_POLITE_LAYERS = 4;

    private QueryNormalizer() {}

    public static String normalize(String query) {
        String text = PatternTables.aliasKey(query);
        for (int i = 0; i < MAX_POLITE_LAYERS; i++) {
            String stripped = stripOnce(text);
            if (stripped.equals(text)) {
                break;
            }
            text = stripped;
        }
        return text;
    }

    private static String stripOnce(String text) {
        String result = text;
        Matcher prefix = PatternTables.POLITE_PREFIX.matcher(result);
        if (prefix.lookingAt() && prefix.end() < result.length()) {
            result = result.substring(prefix.end());
        }
        Matcher suffix = PatternTables.POLITE_SUFFIX.matcher(result);
        if (suffix.find() && suffix.start() > 0) {
            result = result.substring(0, suffix.start());
        }
        Matcher punctuation = PatternTables.TRAILING_PUNCTUATION.matcher(result);
        if (punctuation.find() && punctuation.start() > 0) {
            result = result.substring(0, punctuation.start());
        }
        return result.trim().toLowerCase(Locale.ROOT);
    }
}
