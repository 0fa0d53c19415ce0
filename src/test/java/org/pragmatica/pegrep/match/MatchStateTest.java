package org.pragmatica.pegrep.match;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;
import org.pragmatica.pegrep.tree.SyntaxNode;

import static org.junit.jupiter.api.Assertions.*;

class MatchStateTest {

    @Test
    void bind_keepsFirstBinding() {
        var state = new MatchState();

        state.bind("x", token("a"));
        state.bind("x", token("b"));

        assertEquals("a", ((SyntaxNode.Token) state.binding("x").orElseThrow()).text());
    }

    @Test
    void fork_isIsolatedUntilAdopted() {
        var state = new MatchState();
        state.bind("x", token("a"));

        var fork = state.fork();
        fork.bind("y", token("b"));

        assertTrue(state.binding("y").isEmpty());
        state.adopt(fork);
        assertTrue(state.binding("y").isPresent());
        assertEquals(2, state.bindings().size());
    }

    @Test
    void bindings_isReadOnlySnapshot() {
        var state = new MatchState();
        state.bind("x", token("a"));

        var snapshot = state.bindings();
        state.bind("y", token("b"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("z", token("c")));
    }

    private static SyntaxNode token(String text) {
        return new SyntaxNode.Token(SourceSpan.at(SourceLocation.START), "Identifier", text);
    }
}
