package com.celesteos.core.guard;

import com.celesteos.core.model.Lane;
import com.celesteos.core.patterns.PatternTables;
import com.celesteos.core.patterns.SafePattern;

import java.util.List;

/**
 * Blocks structural injection markers anywhere in the string: instruction delimiters,
 * role tags, template syntax, comment terminators, CDATA and quote-based boolean idioms.
 */
public class InjectionTokenGuard extends PatternListGuard {

    public static final String NAME = "injection_token";

    public InjectionTokenGuard() {
        this(PatternTables.INJECTION_TOKENS);
    }

    public InjectionTokenGuard(List<SafePattern> patterns) {
        super(patterns, Lane.BLOCKED, "injection_token");
    }

    @Override
    public String name() {
        return NAME;
    }
}
