package org.pragmatica.pegrep.error;

import org.pragmatica.pegrep.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "unexpected '" + found + "', expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "unexpected end of input, expected " + expected;
        }
    }

    /**
     * Error detected outside the PEG match itself, e.g. an undefined rule reference.
     */
    record SemanticError(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason;
        }
    }
}
