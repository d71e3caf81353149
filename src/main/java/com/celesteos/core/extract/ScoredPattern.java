package com.celesteos.core.extract;

import com.celesteos.core.patterns.SafePattern;

/**
 * A pattern together with the confidence assigned to each of its matches.
 */
public record ScoredPattern(SafePattern pattern, double confidence) {

    public static ScoredPattern of(String name, String regex, double confidence) {
        return new ScoredPattern(SafePattern.of(name, regex), confidence);
    }

    public static ScoredPattern exact(String name, String regex, double confidence) {
        return new ScoredPattern(SafePattern.exact(name, regex), confidence);
    }
}
