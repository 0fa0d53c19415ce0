package org.pragmatica.pegrep.match;

import org.pragmatica.pegrep.lang.HostLanguage;
import org.pragmatica.pegrep.pattern.CompiledPattern;
import org.pragmatica.pegrep.pattern.WildcardInfo;
import org.pragmatica.pegrep.tree.SequenceKind;
import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Wildcard-aware structural comparison of a pattern tree against corpus nodes.
 *
 * <p>A {@code false} result may leave partial bindings in the state it was given; callers
 * that go on after a failure work on a fork.
 */
final class Unifier {
    private final CompiledPattern pattern;
    private final HostLanguage language;

    Unifier(CompiledPattern pattern, HostLanguage language) {
        this.pattern = pattern;
        this.language = language;
    }

    boolean unify(SyntaxNode pat, SyntaxNode candidate, MatchState state) {
        if (pat instanceof SyntaxNode.Wildcard wildcard) {
            return unifyWildcard(wildcard, candidate, state);
        }
        if (!pattern.isAggressive()) {
            return unifyStructure(pat, candidate, state);
        }
        var attempt = state.fork();
        if (unifyStructure(pat, candidate, attempt)) {
            state.adopt(attempt);
            return true;
        }
        return unifyRelaxed(pat, candidate, state);
    }

    private boolean unifyRelaxed(SyntaxNode pat, SyntaxNode candidate, MatchState state) {
        if (pattern.allows(Relaxation.PARENTHESES) && language.unwrapParentheses(pat).isEmpty()) {
            var inner = language.unwrapParentheses(candidate);
            if (inner.isPresent() && unifyOnFork(pat, inner.get(), state)) {
                return true;
            }
        }
        if (pattern.allows(Relaxation.SINGLE_STATEMENT_BLOCKS)) {
            var patternStatement = language.unwrapSingleStatementBlock(pat);
            var candidateStatement = language.unwrapSingleStatementBlock(candidate);
            if (patternStatement.isPresent() && candidateStatement.isEmpty()) {
                return unifyOnFork(patternStatement.get(), candidate, state);
            }
            if (candidateStatement.isPresent() && patternStatement.isEmpty()) {
                return unifyOnFork(pat, candidateStatement.get(), state);
            }
        }
        return false;
    }

    private boolean unifyOnFork(SyntaxNode pat, SyntaxNode candidate, MatchState state) {
        var attempt = state.fork();
        if (unify(pat, candidate, attempt)) {
            state.adopt(attempt);
            return true;
        }
        return false;
    }

    private boolean unifyWildcard(SyntaxNode.Wildcard wildcard, SyntaxNode candidate, MatchState state) {
        var info = pattern.wildcards().get(wildcard.id());
        if (!satisfiesConstraint(info, candidate)) {
            return false;
        }
        if (info.isAnonymous()) {
            return true;
        }
        var value = info.matchesAnyCount()
                    ? SyntaxNode.Sequence.of(SequenceKind.NODES, List.of(candidate), candidate.span().start())
                    : candidate;
        return bindConsistently(info, value, state);
    }

    private boolean satisfiesConstraint(WildcardInfo info, SyntaxNode candidate) {
        if (info.nameConstraint().isEmpty()) {
            return true;
        }
        return candidate instanceof SyntaxNode.Token token
            && token.rule().equals(language.identifierRule())
            && info.nameConstraint().get().matcher(token.text()).matches();
    }

    private static boolean bindConsistently(WildcardInfo info, SyntaxNode value, MatchState state) {
        var bound = state.binding(info.name());
        if (bound.isPresent()) {
            return SyntaxNode.sameStructure(bound.get(), value);
        }
        state.bind(info.name(), value);
        return true;
    }

    private boolean unifyStructure(SyntaxNode pat, SyntaxNode candidate, MatchState state) {
        if (pat instanceof SyntaxNode.Terminal terminal) {
            return candidate instanceof SyntaxNode.Terminal other
                && terminal.rule().equals(other.rule())
                && terminal.text().equals(other.text());
        }
        if (pat instanceof SyntaxNode.Token token) {
            return candidate instanceof SyntaxNode.Token other
                && token.rule().equals(other.rule())
                && token.text().equals(other.text());
        }
        if (pat instanceof SyntaxNode.NonTerminal nt) {
            if (!(candidate instanceof SyntaxNode.NonTerminal other) || !nt.rule().equals(other.rule())) {
                return false;
            }
            if (language.isListRule(nt.rule())) {
                return align(elements(nt), elements(other), state);
            }
            return align(nt.children(), other.children(), state);
        }
        if (pat instanceof SyntaxNode.Sequence sequence) {
            return candidate instanceof SyntaxNode.Sequence other
                && sequence.kind() == other.kind()
                && align(sequence.elements(), other.elements(), state);
        }
        return false;
    }

    /**
     * Children of a list node without the separators and brackets.
     */
    static List<SyntaxNode> elements(SyntaxNode node) {
        return node.children()
                   .stream()
                   .filter(child -> !child.isPunctuation())
                   .toList();
    }

    // === Sequence alignment ===

    private boolean align(List<SyntaxNode> patterns, List<SyntaxNode> candidates, MatchState state) {
        return align(patterns, 0, candidates, 0, state);
    }

    /**
     * Fixed elements match one candidate each, in order. An any-count wildcard takes the
     * shortest run that lets the rest of the sequence match, growing one element at a time
     * on backtracking.
     */
    private boolean align(List<SyntaxNode> patterns,
                          int patternIndex,
                          List<SyntaxNode> candidates,
                          int candidateIndex,
                          MatchState state) {
        if (patternIndex == patterns.size()) {
            return candidateIndex == candidates.size();
        }
        var current = patterns.get(patternIndex);
        var anyCount = anyCountWildcard(current);
        if (anyCount.isEmpty()) {
            return candidateIndex < candidates.size() && unify(current, candidates.get(candidateIndex), state)
                   && align(patterns, patternIndex + 1, candidates, candidateIndex + 1, state);
        }
        var fixedAfter = fixedCount(patterns, patternIndex + 1);
        for (int end = candidateIndex; end + fixedAfter <= candidates.size(); end++ ) {
            var attempt = state.fork();
            var run = candidates.subList(candidateIndex, end);
            if (bindRun(anyCount.get(), run, runStart(candidates, candidateIndex), attempt)
                && align(patterns, patternIndex + 1, candidates, end, attempt)) {
                state.adopt(attempt);
                return true;
            }
        }
        return false;
    }

    private Optional<WildcardInfo> anyCountWildcard(SyntaxNode node) {
        if (node instanceof SyntaxNode.Wildcard wildcard) {
            var info = pattern.wildcards().get(wildcard.id());
            if (info.matchesAnyCount()) {
                return Optional.of(info);
            }
        }
        return Optional.empty();
    }

    private int fixedCount(List<SyntaxNode> patterns, int from) {
        int count = 0;
        for (int i = from; i < patterns.size(); i++ ) {
            if (anyCountWildcard(patterns.get(i)).isEmpty()) {
                count++ ;
            }
        }
        return count;
    }

    private static boolean bindRun(WildcardInfo info, List<SyntaxNode> run, SourceLocation start, MatchState state) {
        if (info.isAnonymous()) {
            return true;
        }
        return bindConsistently(info, SyntaxNode.Sequence.of(SequenceKind.NODES, run, start), state);
    }

    private static SourceLocation runStart(List<SyntaxNode> candidates, int index) {
        if (index < candidates.size()) {
            return candidates.get(index).span().start();
        }
        if (index > 0) {
            return candidates.get(index - 1).span().end();
        }
        return SourceLocation.START;
    }
}
