package org.pragmatica.pegrep.match;

import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.Map;

/**
 * A corpus node, or sequence of sibling nodes, matched by a pattern.
 *
 * @param node     matched node
 * @param span     source range of the match
 * @param bindings subtrees bound to the named wildcards
 */
public record Match(SyntaxNode node, SourceSpan span, Map<String, SyntaxNode> bindings) {

    public SourceLocation position() {
        return span.start();
    }
}
