package org.pragmatica.pegrep.parser;

import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.grammar.Grammar;
import org.pragmatica.pegrep.grammar.GrammarParser;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PegParser.fromGrammar("""
 *     Number <- < [0-9]+ >
 *     %whitespace <- [ \\t]*
 *     """);
 *
 * var tree = parser.parse("123");
 * }</pre>
 */
public final class PegParser {
    private PegParser() {}

    /**
     * Create a parser from grammar text.
     */
    public static Parser fromGrammar(String grammarText) throws ParseException {
        return fromGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static Parser fromGrammar(String grammarText, ParserConfig config) throws ParseException {
        return fromGrammar(GrammarParser.parse(grammarText), config);
    }

    /**
     * Create a parser from a pre-parsed grammar with custom configuration.
     */
    public static Parser fromGrammar(Grammar grammar, ParserConfig config) throws ParseException {
        return PegEngine.create(grammar.validate(), config);
    }
}
