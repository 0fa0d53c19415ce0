package org.pragmatica.pegrep.pattern;

import org.pragmatica.pegrep.error.CompileException;
import org.pragmatica.pegrep.error.ParseError;
import org.pragmatica.pegrep.error.ParseException;
import org.pragmatica.pegrep.error.TokenizeException;
import org.pragmatica.pegrep.lang.HostLanguage;
import org.pragmatica.pegrep.lang.Hypothesis;
import org.pragmatica.pegrep.match.Relaxation;
import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns pattern text into a {@link CompiledPattern}.
 *
 * <p>The rewritten pattern is parsed under each hypothesis of the host language in turn,
 * narrowest first, and the first complete parse wins. When none succeeds, the failure that
 * got furthest into the pattern is reported, the earliest hypothesis winning ties.
 */
public final class PatternCompiler {
    private static final Logger logger = LogManager.getLogger(PatternCompiler.class);

    private final HostLanguage language;

    public PatternCompiler(HostLanguage language) {
        this.language = language;
    }

    public CompiledPattern compile(String pattern) throws TokenizeException, CompileException {
        var tokenized = WildcardTokenizer.tokenize(pattern);
        var tracker = tokenized.encode();
        var encoded = tracker.text();
        if (encoded.isBlank()) {
            throw new CompileException(SourceLocation.START,
                                       new ParseError.SemanticError(SourceLocation.START, "empty pattern"));
        }
        var relaxations = tokenized.aggressive()
                          ? EnumSet.allOf(Relaxation.class)
                          : EnumSet.noneOf(Relaxation.class);

        ParseError furthest = null;
        for (var hypothesis : language.hypotheses()) {
            try {
                var tree = language.parser().parse(encoded, hypothesis.startRule());
                logger.debug("Pattern '{}' parsed as {}", pattern, hypothesis.startRule());
                return build(pattern, decode(tree, true), tokenized, hypothesis, relaxations);
            } catch (ParseException e) {
                var error = e.error();
                if (furthest == null || error.location().isAfter(furthest.location())) {
                    furthest = error;
                }
            }
        }
        throw new CompileException(tracker.correct(furthest.location()), furthest);
    }

    /**
     * A lone wildcard statement such as {@code $x;} becomes a wildcard restricted to statements.
     */
    private static CompiledPattern build(String pattern,
                                         SyntaxNode root,
                                         TokenizedPattern tokenized,
                                         Hypothesis hypothesis,
                                         Set<Relaxation> relaxations) {
        var statementOnly = isTerminatedWildcard(root.children());
        var shaped = statementOnly
                     ? root.children().get(0)
                     : shape(root, hypothesis);
        return new CompiledPattern(pattern, shaped, tokenized.wildcards(), hypothesis, relaxations, statementOnly);
    }

    /**
     * Replace {@code $$<id>} identifiers with wildcard nodes. Below the root, a statement or
     * member made of a wildcard and {@code ;} stands for the wildcard alone.
     */
    private static SyntaxNode decode(SyntaxNode node, boolean root) {
        if (node instanceof SyntaxNode.Token token && token.text().startsWith(TokenizedPattern.WILDCARD_PREFIX)) {
            var id = Integer.parseInt(token.text().substring(TokenizedPattern.WILDCARD_PREFIX.length()));
            return new SyntaxNode.Wildcard(token.span(), id);
        }
        if (!(node instanceof SyntaxNode.NonTerminal nt)) {
            return node;
        }
        var children = new ArrayList<SyntaxNode>(nt.children().size());
        for (var child : nt.children()) {
            children.add(decode(child, false));
        }
        if (!root && isTerminatedWildcard(children)) {
            return children.get(0);
        }
        return new SyntaxNode.NonTerminal(nt.span(), nt.rule(), List.copyOf(children));
    }

    private static boolean isTerminatedWildcard(List<SyntaxNode> children) {
        return children.size() == 2
            && children.get(0) instanceof SyntaxNode.Wildcard
            && children.get(1) instanceof SyntaxNode.Terminal terminal
            && terminal.isPunctuation()
            && ";".equals(terminal.text());
    }

    /**
     * List hypotheses produce a sequence of the list's elements.
     */
    private static SyntaxNode shape(SyntaxNode root, Hypothesis hypothesis) {
        if (hypothesis.listKind().isEmpty()
            || !(root instanceof SyntaxNode.NonTerminal nt)
            || !nt.rule().equals(hypothesis.startRule())) {
            return root;
        }
        var elements = nt.children()
                         .stream()
                         .filter(child -> !child.isPunctuation())
                         .toList();
        return SyntaxNode.Sequence.of(hypothesis.listKind().get(), elements, nt.span().start());
    }
}
