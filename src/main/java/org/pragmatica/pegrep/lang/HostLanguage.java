package org.pragmatica.pegrep.lang;

import org.pragmatica.pegrep.parser.Parser;
import org.pragmatica.pegrep.tree.SequenceKind;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Language-specific knowledge needed to compile patterns and walk corpus trees.
 */
public interface HostLanguage {

    /**
     * Parser shared by corpus files and patterns.
     */
    Parser parser();

    /**
     * Pattern hypotheses, narrowest first.
     */
    List<Hypothesis> hypotheses();

    /**
     * Kind of sequence formed by the elements of a list rule, empty for other rules.
     */
    Optional<SequenceKind> sequenceKind(String rule);

    default boolean isListRule(String rule) {
        return sequenceKind(rule).isPresent();
    }

    /**
     * Rule of the token an identifier-constrained wildcard must match.
     */
    String identifierRule();

    /**
     * Nodes that carry no meaning on their own and are never reported as matches.
     */
    boolean isSyntaxOnly(SyntaxNode node);

    /**
     * Nodes that stand in statement position: what a pattern made of a lone wildcard
     * statement may match.
     */
    boolean isStatement(SyntaxNode node);

    /**
     * The expression inside a parenthesized expression node.
     */
    Optional<SyntaxNode> unwrapParentheses(SyntaxNode node);

    /**
     * The statement inside a block holding exactly one statement.
     */
    Optional<SyntaxNode> unwrapSingleStatementBlock(SyntaxNode node);

    /**
     * File name suffix of source files, including the dot.
     */
    String fileExtension();
}
