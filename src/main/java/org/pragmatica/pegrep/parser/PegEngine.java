package org.pragmatica.pegrep.parser;

import org.pragmatica.pegrep.error.ParseError;
import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.grammar.Expression;
import org.pragmatica.pegrep.grammar.Grammar;
import org.pragmatica.pegrep.grammar.Rule;
import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PEG parsing engine - interprets grammar rules to parse input.
 *
 * <p>Every successful rule yields one node. Nodes produced by the anonymous
 * combinators inside a rule (sequence, repetition, option) are spliced into the
 * rule's child list, so a rule node holds the terminals, tokens and sub-rule
 * nodes it matched in source order. A rule holding exactly one child is
 * represented by that child unless it is one of the configured list rules;
 * an anonymous terminal standing alone takes the rule's name.
 *
 * <p>All per-parse state lives in {@link ParsingContext}, so an engine can be
 * shared between threads.
 */
public final class PegEngine implements Parser {
    private static final String WHITESPACE_RULE = "%whitespace";

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;
    private final Optional<Expression> whitespaceElement;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
        this.whitespaceElement = grammar.whitespace().map(this::extractInnerExpression);
    }

    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(grammar, config);
    }

    @Override
    public SyntaxNode parse(String input) throws ParseException {
        if (grammar.rules()
                   .isEmpty()) {
            throw new ParseException(new ParseError.SemanticError(SourceLocation.START,
                                                                  "no start rule defined in grammar"));
        }
        return parse(input,
                     grammar.rules()
                            .get(0)
                            .name());
    }

    @Override
    public SyntaxNode parse(String input, String startRule) throws ParseException {
        var rule = rules.get(startRule);
        if (rule == null) {
            throw new ParseException(new ParseError.SemanticError(SourceLocation.START, "unknown rule: " + startRule));
        }
        var ctx = ParsingContext.create(input, config);
        var result = parseRule(ctx, rule);
        if (!(result instanceof ParseResult.Success success)) {
            throw new ParseException(errorAtFurthest(ctx, rule.name()));
        }
        skipWhitespace(ctx);
        if (!ctx.isAtEnd()) {
            ctx.updateFurthest("end of input");
            throw new ParseException(errorAtFurthest(ctx, "end of input"));
        }
        return success.node();
    }

    private ParseError errorAtFurthest(ParsingContext ctx, String fallback) {
        var location = ctx.furthestLocation();
        var expected = ctx.furthestExpected()
                          .isEmpty()
                       ? fallback
                       : ctx.furthestExpected();
        var found = ctx.charAtOrEnd(location.offset());
        return found.isEmpty()
               ? new ParseError.UnexpectedEof(location, expected)
               : new ParseError.UnexpectedInput(location, found, expected);
    }

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        var startPos = ctx.pos();
        var startLoc = ctx.location();

        // Check packrat cache at START position
        var cached = ctx.getCachedAt(rule.name(), startPos);
        if (cached.isPresent()) {
            var result = cached.get();
            if (result instanceof ParseResult.Success success) {
                ctx.restoreLocation(success.endLocation());
            }
            return result;
        }

        skipWhitespace(ctx);
        var nodeStart = ctx.location();
        var result = parseExpression(ctx, rule.expression(), rule.name(), ParseMode.standard());

        ParseResult outcome;
        if (result.isSuccess()) {
            outcome = ParseResult.Success.of(ruleNode(result, rule.name(), nodeStart), ctx.location());
        } else {
            ctx.restoreLocation(startLoc);
            outcome = result;
        }
        ctx.cacheAt(rule.name(), startPos, outcome);
        return outcome;
    }

    private SyntaxNode ruleNode(ParseResult result, String ruleName, SourceLocation nodeStart) {
        var children = new ArrayList<SyntaxNode>();
        if (result instanceof ParseResult.Success success) {
            splice(success.node(), children);
        }
        if (children.size() == 1 && !config.listRules().contains(ruleName)) {
            return adoptName(children.get(0), ruleName);
        }
        var span = children.isEmpty()
                   ? SourceSpan.at(nodeStart)
                   : children.get(0).span().merge(children.get(children.size() - 1).span());
        return new SyntaxNode.NonTerminal(span, ruleName, List.copyOf(children));
    }

    private void splice(SyntaxNode node, List<SyntaxNode> out) {
        if (node instanceof SyntaxNode.NonTerminal nt && nt.rule().isEmpty()) {
            for (var child : nt.children()) {
                splice(child, out);
            }
        } else {
            out.add(node);
        }
    }

    private SyntaxNode adoptName(SyntaxNode node, String ruleName) {
        if (node instanceof SyntaxNode.Terminal terminal && terminal.isPunctuation()) {
            return new SyntaxNode.Terminal(terminal.span(), ruleName, terminal.text());
        }
        return node;
    }

    private ParseResult parseExpression(ParsingContext ctx, Expression expr, String ruleName, ParseMode mode) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseReference(ctx, ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq, ruleName, mode);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice, ruleName, mode);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), ruleName, mode, false);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), ruleName, mode, true);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseOptional(ctx, opt, ruleName, mode);
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and, ruleName, mode);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not, ruleName, mode);
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return parseTokenBoundary(ctx, tb, ruleName, mode);
        }
        if (expr instanceof Expression.Cut) {
            // Cut commits to current choice - for now just succeed
            return new ParseResult.PredicateSuccess(ctx.location());
        }
        if (expr instanceof Expression.Group grp) {
            return parseExpression(ctx, grp.expression(), ruleName, mode);
        }
        throw new IllegalStateException("Unsupported expression: " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        if (ctx.remaining() < text.length()) {
            ctx.updateFurthest("'" + text + "'");
            return ParseResult.Failure.at(ctx.location(), "'" + text + "'");
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != ctx.peek(i)) {
                ctx.updateFurthest("'" + text + "'");
                return ParseResult.Failure.at(ctx.location(), "'" + text + "'");
            }
        }
        var startLoc = ctx.location();
        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }
        var node = new SyntaxNode.Terminal(ctx.spanFrom(startLoc), "", text);
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var description = "[" + (cc.negated()
                                 ? "^"
                                 : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(description);
            return ParseResult.Failure.at(ctx.location(), description);
        }
        char c = ctx.peek();
        boolean matches = matchesCharClass(c, cc.pattern());
        if (cc.negated()) {
            matches = !matches;
        }
        if (!matches) {
            ctx.updateFurthest(description);
            return ParseResult.Failure.at(ctx.location(), description);
        }
        var startLoc = ctx.location();
        ctx.advance();
        var node = new SyntaxNode.Terminal(ctx.spanFrom(startLoc), "", String.valueOf(c));
        return ParseResult.Success.of(node, ctx.location());
    }

    private boolean matchesCharClass(char c, String pattern) {
        int i = 0;
        while (i < pattern.length()) {
            char start = pattern.charAt(i);
            int consumed = 1;
            if (start == '\\' && i + 1 < pattern.length()) {
                char escaped = pattern.charAt(i + 1);
                consumed = 2;
                start = switch (escaped) {
                    case 'n' -> '\n';
                    case 'r' -> '\r';
                    case 't' -> '\t';
                    case 'u' -> {
                        if (i + 6 <= pattern.length()) {
                            try {
                                var value = (char) Integer.parseInt(pattern.substring(i + 2, i + 6), 16);
                                consumed = 6;
                                yield value;
                            } catch (NumberFormatException e) {
                                yield 'u';
                            }
                        }
                        yield 'u';
                    }
                    default -> escaped;
                };
            }
            i += consumed;
            // Check for range
            if (i + 1 < pattern.length() && pattern.charAt(i) == '-') {
                char end = pattern.charAt(i + 1);
                if (c >= start && c <= end) {
                    return true;
                }
                i += 2;
            } else if (c == start) {
                return true;
            }
        }
        return false;
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }
        var startLoc = ctx.location();
        char c = ctx.advance();
        var node = new SyntaxNode.Terminal(ctx.spanFrom(startLoc), "", String.valueOf(c));
        return ParseResult.Success.of(node, ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParsingContext ctx, Expression.Reference ref) {
        var rule = rules.get(ref.ruleName());
        if (rule == null) {
            return ParseResult.Failure.at(ctx.location(), "rule '" + ref.ruleName() + "'");
        }
        return parseRule(ctx, rule);
    }

    private boolean isPredicate(Expression expr) {
        if (expr instanceof Expression.Group grp) {
            return isPredicate(grp.expression());
        }
        return expr instanceof Expression.And || expr instanceof Expression.Not;
    }

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq, String ruleName, ParseMode mode) {
        var startLoc = ctx.location();
        var children = new ArrayList<SyntaxNode>();
        for (var element : seq.elements()) {
            // Skip whitespace between elements, but NOT before predicates
            if (mode.shouldSkipWhitespace() && !isPredicate(element)) {
                skipWhitespace(ctx);
            }
            var result = parseExpression(ctx, element, ruleName, mode);
            if (result.isFailure()) {
                ctx.restoreLocation(startLoc);
                return result;
            }
            if (result instanceof ParseResult.Success success) {
                children.add(success.node());
            }
        }
        return ParseResult.Success.of(anonymous(ctx, startLoc, children), ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice, String ruleName, ParseMode mode) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;
        for (var alt : choice.alternatives()) {
            var result = parseExpression(ctx, alt, ruleName, mode);
            if (result.isSuccess()) {
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }
        return lastFailure != null
               ? lastFailure
               : ParseResult.Failure.at(ctx.location(), "one of alternatives");
    }

    private ParseResult parseRepeated(ParsingContext ctx,
                                      Expression element,
                                      String ruleName,
                                      ParseMode mode,
                                      boolean atLeastOnce) {
        var startLoc = ctx.location();
        var children = new ArrayList<SyntaxNode>();
        if (atLeastOnce) {
            var first = parseExpression(ctx, element, ruleName, mode);
            if (first.isFailure()) {
                return first;
            }
            if (first instanceof ParseResult.Success success) {
                children.add(success.node());
            }
        }
        while (true) {
            var beforeLoc = ctx.location();
            if (mode.shouldSkipWhitespace()) {
                skipWhitespace(ctx);
            }
            var result = parseExpression(ctx, element, ruleName, mode);
            if (result.isFailure()) {
                ctx.restoreLocation(beforeLoc);
                break;
            }
            if (result instanceof ParseResult.Success success) {
                children.add(success.node());
            }
            if (ctx.pos() == beforeLoc.offset()) {
                break;
            }
        }
        return ParseResult.Success.of(anonymous(ctx, startLoc, children), ctx.location());
    }

    private ParseResult parseOptional(ParsingContext ctx, Expression.Optional opt, String ruleName, ParseMode mode) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, opt.expression(), ruleName, mode);
        if (result.isSuccess()) {
            return result;
        }
        // Optional always succeeds - return empty node on no match
        ctx.restoreLocation(startLoc);
        return ParseResult.Success.of(anonymous(ctx, startLoc, List.of()), ctx.location());
    }

    private SyntaxNode anonymous(ParsingContext ctx, SourceLocation start, List<SyntaxNode> children) {
        return new SyntaxNode.NonTerminal(ctx.spanFrom(start), "", List.copyOf(children));
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and, String ruleName, ParseMode mode) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, and.expression(), ruleName, mode);
        // Always restore - predicates don't consume
        ctx.restoreLocation(startLoc);
        if (result.isSuccess()) {
            return new ParseResult.PredicateSuccess(startLoc);
        }
        return result;
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not, String ruleName, ParseMode mode) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, not.expression(), ruleName, mode);
        // Always restore - predicates don't consume
        ctx.restoreLocation(startLoc);
        if (result.isSuccess()) {
            return ParseResult.Failure.at(startLoc, "not " + describeExpression(not.expression()));
        }
        return new ParseResult.PredicateSuccess(startLoc);
    }

    // === Special Parsers ===

    private ParseResult parseTokenBoundary(ParsingContext ctx,
                                           Expression.TokenBoundary tb,
                                           String ruleName,
                                           ParseMode mode) {
        var startLoc = ctx.location();
        var startPos = ctx.pos();
        // Disable whitespace skipping inside token boundary
        ctx.enterTokenBoundary();
        try {
            var result = parseExpression(ctx, tb.expression(), ruleName, mode);
            if (result.isFailure()) {
                return result;
            }
            var text = ctx.substring(startPos, ctx.pos());
            var node = new SyntaxNode.Token(ctx.spanFrom(startLoc), ruleName, text);
            return ParseResult.Success.of(node, ctx.location());
        } finally {
            ctx.exitTokenBoundary();
        }
    }

    // === Helpers ===

    private void skipWhitespace(ParsingContext ctx) {
        // Don't skip whitespace inside token boundaries or during whitespace parsing
        if (whitespaceElement.isEmpty() || ctx.isSkippingWhitespace() || ctx.inTokenBoundary()) {
            return;
        }
        ctx.enterWhitespaceSkip();
        try {
            var element = whitespaceElement.get();
            while (!ctx.isAtEnd()) {
                var startPos = ctx.pos();
                var result = parseExpression(ctx, element, WHITESPACE_RULE, ParseMode.noWhitespace());
                if (result.isFailure() || ctx.pos() == startPos) {
                    break;
                }
            }
        } finally {
            ctx.exitWhitespaceSkip();
        }
    }

    /**
     * Extract inner expression from repetition operators so whitespace is matched one element at a time.
     */
    private Expression extractInnerExpression(Expression expr) {
        if (expr instanceof Expression.ZeroOrMore zom) {
            return zom.expression();
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return oom.expression();
        }
        if (expr instanceof Expression.Optional opt) {
            return opt.expression();
        }
        return expr;
    }

    private String describeExpression(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + cc.pattern() + "]";
        }
        if (expr instanceof Expression.Any) {
            return ".";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        return "expression";
    }
}
