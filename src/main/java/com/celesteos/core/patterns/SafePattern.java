package com.celesteos.core.patterns;

import com.google.re2j.Matcher;
import com.google.re2j.Pattern;

/**
 * A named, pre-compiled RE2/J expression.
 * <p>
 * RE2/J compiles to an automaton and matches in time linear in the input length,
 * with no backtracking. Every guard, lane pattern and entity matcher goes through
 * this type, so adversarial input can never trigger catastrophic backtracking.
 * Lookarounds and back-references are not available in RE2 syntax; rules that need
 * an exclusion use a second pattern (see {@link PatternRule#excluding}).
 */
public final class SafePattern {

    private final String name;
    private final Pattern pattern;

    private SafePattern(String name, Pattern pattern) {
        this.name = name;
        this.pattern = pattern;
    }

    /** Case-insensitive pattern, the default for natural-language vocabulary. */
    public static SafePattern of(String name, String regex) {
        return new SafePattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    /** Case-sensitive pattern, for codes whose letter case carries meaning. */
    public static SafePattern exact(String name, String regex) {
        return new SafePattern(name, Pattern.compile(regex));
    }

    public String name() {
        return name;
    }

    public boolean find(CharSequence input) {
        return pattern.matcher(input).find();
    }

    public Matcher matcher(CharSequence input) {
        return pattern.matcher(input);
    }

    public String[] split(String input) {
        return pattern.split(input);
    }

    public String replaceAll(String input, String replacement) {
        return pattern.matcher(input).replaceAll(replacement);
    }

    public String pattern() {
        return pattern.pattern();
    }

    @Override
    public String toString() {
        return name + "=/" + pattern.pattern() + "/";
    }
}
