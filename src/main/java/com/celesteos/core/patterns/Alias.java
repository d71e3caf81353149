package com.celesteos.core.patterns;

/**
 * Dictionary entry mapping a surface phrase to its canonical identifier.
 *
 * @param phrase     lower-case surface form; internal spaces match any whitespace run
 * @param canonical  stable identifier such as {@code BILGE_PUMP}
 * @param confidence detection confidence when this phrase is matched
 */
public record Alias(String phrase, String canonical, double confidence) {}
