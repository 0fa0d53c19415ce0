package org.pragmatica.pegrep.grammar;

import org.pragmatica.pegrep.tree.SourceSpan;

import java.util.List;

/**
 * PEG expression types - the building blocks of grammar rules.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    // === Terminals ===

    /**
     * Literal string match: 'text' or "text"
     */
    record Literal(SourceSpan span, String text) implements Expression {}

    /**
     * Character class: [a-z], [^a-z]
     */
    record CharClass(SourceSpan span, String pattern, boolean negated) implements Expression {}

    /**
     * Any character: .
     */
    record Any(SourceSpan span) implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record Reference(SourceSpan span, String ruleName) implements Expression {}

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {}

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {}

    /**
     * One or more: e+
     */
    record OneOrMore(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Optional: e?
     */
    record Optional(SourceSpan span, Expression expression) implements Expression {}

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Negative lookahead: !e
     */
    record Not(SourceSpan span, Expression expression) implements Expression {}

    // === Special ===

    /**
     * Token boundary: < e > - captures matched text as one token
     */
    record TokenBoundary(SourceSpan span, Expression expression) implements Expression {}

    /**
     * Cut operator: ^ - accepted for grammar compatibility, matches without consuming
     */
    record Cut(SourceSpan span) implements Expression {}

    /**
     * Grouping: ( e )
     */
    record Group(SourceSpan span, Expression expression) implements Expression {}
}
