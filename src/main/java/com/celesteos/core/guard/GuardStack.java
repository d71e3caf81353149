package com.celesteos.core.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of guards. The first verdict wins; a guard that throws fails closed.
 */
public class GuardStack {

    private static final Logger log = LoggerFactory.getLogger(GuardStack.class);

    public static final String INTERNAL_FAULT = "internal_fault";

    private final List<GuardRule> guards;

    public GuardStack(List<GuardRule> guards) {
        this.guards = List.copyOf(guards);
    }

    /**
     * Injection-token, content, paste-dump, non-domain, then clause-level domain guard.
     * Injection markers are checked first so that no UNKNOWN verdict can mask them.
     */
    public static GuardStack standard(int pasteDumpMinLength, double pasteDumpMinAlphaRatio) {
        var injection = new InjectionTokenGuard();
        var nonDomain = new NonDomainGuard();
        return new GuardStack(List.of(
                injection,
                new ContentGuard(),
                new PasteDumpGuard(pasteDumpMinLength, pasteDumpMinAlphaRatio),
                nonDomain,
                new ClauseDomainGuard(List.of(nonDomain, injection))
        ));
    }

    public Optional<GuardVerdict> evaluate(String query) {
        for (GuardRule guard : guards) {
            try {
                Optional<GuardVerdict> verdict = guard.check(query);
                if (verdict.isPresent()) {
                    return verdict;
                }
            } catch (RuntimeException e) {
                log.error("Guard '{}' raised {}; failing closed", guard.name(), e.toString(), e);
                return Optional.of(GuardVerdict.blocked(INTERNAL_FAULT, guard.name()));
            }
        }
        return Optional.empty();
    }

    public List<GuardRule> guards() {
        return guards;
    }
}
