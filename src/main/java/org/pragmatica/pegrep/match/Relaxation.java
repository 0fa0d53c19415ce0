package org.pragmatica.pegrep.match;

/**
 * Structural differences tolerated in aggressive mode.
 */
public enum Relaxation {
    /**
     * {@code (e)} in the corpus matches a pattern written for {@code e}.
     */
    PARENTHESES,
    /**
     * A block holding a single statement and that statement are interchangeable.
     */
    SINGLE_STATEMENT_BLOCKS
}
