package org.pragmatica.pegrep.match;

import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Wildcard bindings of one match attempt. Backtracking branches work on a {@link #fork()}
 * which is adopted when the branch succeeds and dropped otherwise.
 */
public final class MatchState {
    private final Map<String, SyntaxNode> bindings;

    public MatchState() {
        this(new LinkedHashMap<>());
    }

    private MatchState(Map<String, SyntaxNode> bindings) {
        this.bindings = bindings;
    }

    public Optional<SyntaxNode> binding(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Bind a name seen for the first time. Existing bindings are never replaced.
     */
    public void bind(String name, SyntaxNode node) {
        bindings.putIfAbsent(name, node);
    }

    public MatchState fork() {
        return new MatchState(new LinkedHashMap<>(bindings));
    }

    public void adopt(MatchState fork) {
        bindings.clear();
        bindings.putAll(fork.bindings);
    }

    public Map<String, SyntaxNode> bindings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }
}
