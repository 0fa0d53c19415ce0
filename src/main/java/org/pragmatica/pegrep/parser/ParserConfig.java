package org.pragmatica.pegrep.parser;

import java.util.Set;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoize rule results per input position
 * @param listRules      rules whose node is kept even when it holds a single child
 */
public record ParserConfig(boolean packratEnabled, Set<String> listRules) {
    public static final ParserConfig DEFAULT = new ParserConfig(true, Set.of());

    public ParserConfig {
        listRules = Set.copyOf(listRules);
    }

    public ParserConfig withListRules(Set<String> rules) {
        return new ParserConfig(packratEnabled, rules);
    }
}
