package org.pragmatica.pegrep.tree;

/**
 * Category of a {@link SyntaxNode.Sequence}. Only sequences of the same kind unify.
 */
public enum SequenceKind {
    EXPRESSIONS,
    STATEMENTS,
    DECLARATIONS,
    PARAMETERS,
    /**
     * Run of siblings captured by an any-count wildcard.
     */
    NODES
}
