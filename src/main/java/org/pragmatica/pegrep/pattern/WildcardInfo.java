package org.pragmatica.pegrep.pattern;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * What a wildcard stands for.
 *
 * @param name            bound name, {@code _} for wildcards that bind nothing
 * @param matchesAnyCount matches a run of zero or more siblings instead of one node
 * @param nameConstraint  regex an identifier must match in full
 */
public record WildcardInfo(String name, boolean matchesAnyCount, Optional<Pattern> nameConstraint) {
    public static final String ANONYMOUS = "_";

    public static WildcardInfo single(String name) {
        return new WildcardInfo(name, false, Optional.empty());
    }

    public static WildcardInfo anyCount(String name) {
        return new WildcardInfo(name, true, Optional.empty());
    }

    public static WildcardInfo constrained(String name, Pattern regex) {
        return new WildcardInfo(name, false, Optional.of(regex));
    }

    public boolean isAnonymous() {
        return ANONYMOUS.equals(name);
    }

    /**
     * Two occurrences with equal keys are the same wildcard.
     */
    String key() {
        var prefix = matchesAnyCount ? "*" : "";
        return prefix + name + nameConstraint.map(regex -> "/" + regex.pattern()).orElse("");
    }

    /**
     * Source form, used in messages.
     */
    public String describe() {
        if (nameConstraint.isPresent()) {
            return "$(" + name + ", /" + nameConstraint.get().pattern() + "/)";
        }
        return (matchesAnyCount
                ? "$*"
                : "$") + name;
    }
}
