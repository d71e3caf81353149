package com.celesteos.core.guard;

import com.celesteos.core.model.Lane;
import com.celesteos.core.patterns.PatternTables;
import com.celesteos.core.patterns.SafePattern;

import java.util.List;

/**
 * Blocks off-topic requests (weather, finance, trivia, chit-chat).
 */
public class NonDomainGuard extends PatternListGuard {

    public static final String NAME = "non_domain";

    public NonDomainGuard() {
        this(PatternTables.NON_DOMAIN);
    }

    public NonDomainGuard(List<SafePattern> patterns) {
        super(patterns, Lane.BLOCKED, "non_domain");
    }

    @Override
    public String name() {
        return NAME;
    }
}
