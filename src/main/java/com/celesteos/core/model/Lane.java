package com.celesteos.core.model;

/**
 * The five-way routing outcome of a query. Exactly one lane is assigned per query.
 */
public enum Lane {
    /** Adversarial or off-topic input. Callers execute nothing and show a neutral refusal. */
    BLOCKED,
    /** Malformed or unclassifiable input. Callers ask the user to rephrase. */
    UNKNOWN,
    /** Direct database lookup, no language model involved. */
    NO_LLM,
    /** Actionable command, dispatched to a permission-checked handler. */
    RULES_ONLY,
    /** Diagnostic question that needs a language model. */
    GPT
}
