package org.pragmatica.pegrep.parser;

import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.tree.SyntaxNode;

/**
 * Parser interface - parses input text according to a grammar.
 * Implementations keep no per-parse state and may be shared between threads.
 */
public interface Parser {

    /**
     * Parse the whole input starting from the first rule of the grammar.
     */
    SyntaxNode parse(String input) throws ParseException;

    /**
     * Parse the whole input starting from a specific rule.
     */
    SyntaxNode parse(String input, String startRule) throws ParseException;
}
