package org.pragmatica.pegrep.match;

import org.pragmatica.pegrep.lang.HostLanguage;
import org.pragmatica.pegrep.pattern.CompiledPattern;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds every match of a compiled pattern in a syntax tree.
 *
 * <p>Nodes are visited in pre-order and each gets its own attempt. When the pattern is a
 * sequence, the elements of every list node of the same kind are also tried as a whole.
 * Nested and overlapping matches are all reported, in visiting order.
 */
public final class SearchEngine {
    private static final Logger logger = LogManager.getLogger(SearchEngine.class);

    private final HostLanguage language;

    public SearchEngine(HostLanguage language) {
        this.language = language;
    }

    public List<Match> search(CompiledPattern pattern, SyntaxNode tree) {
        var unifier = new Unifier(pattern, language);
        var matches = new ArrayList<Match>();
        visit(tree, pattern, unifier, matches);
        logger.debug("Pattern '{}' matched {} times", pattern.source(), matches.size());
        return List.copyOf(matches);
    }

    private void visit(SyntaxNode node, CompiledPattern pattern, Unifier unifier, List<Match> matches) {
        if (isCandidate(pattern, node)) {
            attempt(pattern.root(), node, unifier, matches);
        }
        if (pattern.root() instanceof SyntaxNode.Sequence sequence && node instanceof SyntaxNode.NonTerminal nt) {
            var kind = language.sequenceKind(nt.rule());
            var elements = Unifier.elements(nt);
            if (kind.isPresent() && kind.get() == sequence.kind() && !elements.isEmpty()) {
                var candidate = SyntaxNode.Sequence.of(kind.get(), elements, nt.span().start());
                attempt(sequence, candidate, unifier, matches);
            }
        }
        for (var child : node.children()) {
            visit(child, pattern, unifier, matches);
        }
    }

    private boolean isCandidate(CompiledPattern pattern, SyntaxNode node) {
        if (language.isSyntaxOnly(node)) {
            return false;
        }
        return !pattern.statementOnly() || language.isStatement(node);
    }

    private static void attempt(SyntaxNode root, SyntaxNode candidate, Unifier unifier, List<Match> matches) {
        var state = new MatchState();
        if (unifier.unify(root, candidate, state)) {
            matches.add(new Match(candidate, candidate.span(), state.bindings()));
        }
    }
}
