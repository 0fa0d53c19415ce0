package org.pragmatica.pegrep.pattern;

import org.pragmatica.pegrep.lang.Hypothesis;
import org.pragmatica.pegrep.match.Relaxation;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.Set;

/**
 * A pattern ready for matching. Immutable, so one instance may serve concurrent searches.
 *
 * @param source        pattern as the user wrote it
 * @param root          pattern tree with wildcards replaced by {@link SyntaxNode.Wildcard} nodes
 * @param wildcards     wildcard side table
 * @param hypothesis    syntactic category the pattern was parsed as
 * @param relaxations   structural differences tolerated while matching
 * @param statementOnly the root wildcard only matches nodes in statement position
 */
public record CompiledPattern(String source,
                              SyntaxNode root,
                              WildcardTable wildcards,
                              Hypothesis hypothesis,
                              Set<Relaxation> relaxations,
                              boolean statementOnly) {
    public CompiledPattern {
        relaxations = Set.copyOf(relaxations);
    }

    public boolean isAggressive() {
        return !relaxations.isEmpty();
    }

    public boolean allows(Relaxation relaxation) {
        return relaxations.contains(relaxation);
    }
}
