package com.celesteos.core.guard;

import java.util.List;
import java.util.Optional;

/**
 * Re-applies the vocabulary guards to every clause on its own. A legitimate first clause
 * does not vouch for the rest: "check the engine also how are you" is blocked.
 */
public class ClauseDomainGuard implements GuardRule {

    public static final String NAME = "clause_domain";

    private final List<GuardRule> clauseGuards;

    public ClauseDomainGuard(List<GuardRule> clauseGuards) {
        this.clauseGuards = List.copyOf(clauseGuards);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<GuardVerdict> check(String query) {
        List<String> clauses = ClauseSplitter.split(query);
        if (clauses.size() < 2) {
            return Optional.empty();
        }
        for (String clause : clauses) {
            for (GuardRule guard : clauseGuards) {
                Optional<GuardVerdict> verdict = guard.check(clause);
                if (verdict.isPresent()) {
                    return Optional.of(GuardVerdict.blocked("clause_" + verdict.get().reasonCode(), NAME));
                }
            }
        }
        return Optional.empty();
    }
}
