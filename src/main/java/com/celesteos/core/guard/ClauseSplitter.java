package com.celesteos.core.guard;

import com.celesteos.core.patterns.PatternTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a query on coordinating conjunctions ({@code and, also, then, plus, btw}),
 * together with any punctuation around them.
 */
public final class ClauseSplitter {

    private ClauseSplitter() {}

    /**
     * @return non-blank clauses in query order, stripped of edge punctuation; a single
     *         element when no conjunction is present
     */
    public static List<String> split(String query) {
        var clauses = new ArrayList<String>();
        for (String part : PatternTables.CLAUSE_SEPARATOR.split(query)) {
            String clause = PatternTables.CLAUSE_EDGE_PUNCTUATION.replaceAll(part, "");
            if (!clause.isEmpty()) {
                clauses.add(clause);
            }
        }
        return clauses;
    }
}
