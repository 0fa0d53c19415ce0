package org.pragmatica.pegrep.lang;

import org.pragmatica.pegrep.tree.SequenceKind;

import java.util.Optional;

/**
 * One syntactic category a pattern may belong to.
 *
 * @param startRule grammar rule the pattern is parsed from
 * @param listKind  present when the rule parses a list whose elements form a sequence pattern
 */
public record Hypothesis(String startRule, Optional<SequenceKind> listKind) {

    public static Hypothesis single(String startRule) {
        return new Hypothesis(startRule, Optional.empty());
    }

    public static Hypothesis list(String startRule, SequenceKind kind) {
        return new Hypothesis(startRule, Optional.of(kind));
    }
}
