package org.pragmatica.pegrep.pattern;

/**
 * Lexical categories the pattern tokenizer distinguishes.
 */
public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHAR,
    COMMENT,
    OPERATOR,
    WILDCARD,
    /**
     * The leading {@code #} that switches on aggressive matching.
     */
    AGGRESSIVE
}
