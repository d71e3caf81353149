package com.celesteos.core.extract;

import com.celesteos.core.model.EntityType;
import com.celesteos.core.model.ExtractedEntity;
import com.celesteos.core.model.Span;
import com.celesteos.core.patterns.Alias;
import com.celesteos.core.patterns.PatternTables;
import com.celesteos.core.patterns.SafePattern;
import com.google.re2j.Matcher;
import com.google.re2j.Pattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Matches a family of dictionary phrases with a single alternation.
 * <p>
 * Alternatives are ordered longest first; RE2 picks the first alternative that matches at
 * the leftmost position, so "main engine 1" wins over "main engine".
 */
public class DictionaryMatcher implements EntityMatcher {

    private final EntityType type;
    private final Map<String, Alias> byKey;
    private final SafePattern pattern;

    public DictionaryMatcher(EntityType type, List<Alias> aliases) {
        if (aliases.isEmpty()) {
            throw new IllegalArgumentException("Dictionary for " + type + " is empty");
        }
        this.type = type;
        this.byKey = new HashMap<>();
        for (Alias alias : aliases) {
            byKey.putIfAbsent(PatternTables.aliasKey(alias.phrase()), alias);
        }
        String alternation = aliases.stream()
                .map(Alias::phrase)
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(DictionaryMatcher::phraseRegex)
                .collect(Collectors.joining("|"));
        this.pattern = SafePattern.of(type.wireName() + "_dictionary", "\\b(" + alternation + ")\\b");
    }

    @Override
    public EntityType type() {
        return type;
    }

    @Override
    public List<ExtractedEntity> match(String query) {
        var found = new ArrayList<ExtractedEntity>();
        Matcher m = pattern.matcher(query);
        while (m.find()) {
            String text = m.group();
            Alias alias = byKey.get(PatternTables.aliasKey(text));
            if (alias == null) {
                continue;
            }
            found.add(new ExtractedEntity(type, text, alias.confidence(), new Span(m.start(), m.end())));
        }
        return found;
    }

    /** Letters and digits literal, spaces as any whitespace run, apostrophes in either form. */
    static String phraseRegex(String phrase) {
        var sb = new StringBuilder();
        boolean inSpace = false;
        for (char c : phrase.toCharArray()) {
            if (Character.isWhitespace(c)) {
                if (!inSpace) {
                    sb.append("\\s+");
                    inSpace = true;
                }
                continue;
            }
            inSpace = false;
            if (c == '\'' || c == '\u2019') {
                sb.append("['\u2019]");
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }
}
