package org.pragmatica.pegrep.tree;

import java.util.List;

/**
 * Syntax tree node shared by corpus files and compiled patterns.
 *
 * <p>The PEG engine produces one node per grammar rule that matched. Anonymous
 * sub-expressions of a rule are spliced into that rule's child list, and a rule
 * matching exactly one child is represented by that child, so the tree holds no
 * chains of single-child wrappers.
 */
public sealed interface SyntaxNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The rule name that produced this node, empty for anonymous literals.
     */
    String rule();

    default List<SyntaxNode> children() {
        return List.of();
    }

    /**
     * Punctuation or operator literal not attributed to any rule.
     */
    default boolean isPunctuation() {
        return false;
    }

    /**
     * Leaf that matched literal text, such as {@code '('} or an operator.
     */
    record Terminal(SourceSpan span, String rule, String text) implements SyntaxNode {
        @Override
        public boolean isPunctuation() {
            return rule.isEmpty();
        }
    }

    /**
     * Result of the token boundary operator {@code < >}: identifiers, literals, keywords.
     */
    record Token(SourceSpan span, String rule, String text) implements SyntaxNode {}

    /**
     * Interior node with children.
     */
    record NonTerminal(SourceSpan span, String rule, List<SyntaxNode> children) implements SyntaxNode {}

    /**
     * Synthetic node holding sibling elements of a list, built during search and never
     * stored in a parsed tree.
     */
    record Sequence(SourceSpan span, SequenceKind kind, List<SyntaxNode> elements) implements SyntaxNode {
        public static Sequence of(SequenceKind kind, List<SyntaxNode> elements, SourceLocation fallback) {
            if (elements.isEmpty()) {
                return new Sequence(SourceSpan.at(fallback), kind, List.of());
            }
            var span = elements.get(0).span()
                .merge(elements.get(elements.size() - 1).span());
            return new Sequence(span, kind, List.copyOf(elements));
        }

        @Override
        public String rule() {
            return "";
        }

        @Override
        public List<SyntaxNode> children() {
            return elements;
        }
    }

    /**
     * Placeholder for a pattern wildcard; {@code id} indexes the pattern's wildcard table.
     */
    record Wildcard(SourceSpan span, int id) implements SyntaxNode {
        @Override
        public String rule() {
            return "";
        }
    }

    /**
     * Structural equality ignoring source positions.
     */
    static boolean sameStructure(SyntaxNode left, SyntaxNode right) {
        if (left instanceof Terminal l && right instanceof Terminal r) {
            return l.rule().equals(r.rule()) && l.text().equals(r.text());
        }
        if (left instanceof Token l && right instanceof Token r) {
            return l.rule().equals(r.rule()) && l.text().equals(r.text());
        }
        if (left instanceof Wildcard l && right instanceof Wildcard r) {
            return l.id() == r.id();
        }
        if (left instanceof NonTerminal l && right instanceof NonTerminal r) {
            return l.rule()
                    .equals(r.rule()) && sameStructure(l.children(), r.children());
        }
        if (left instanceof Sequence l && right instanceof Sequence r) {
            return l.kind() == r.kind() && sameStructure(l.elements(), r.elements());
        }
        return false;
    }

    static boolean sameStructure(List<SyntaxNode> left, List<SyntaxNode> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!sameStructure(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }
}
