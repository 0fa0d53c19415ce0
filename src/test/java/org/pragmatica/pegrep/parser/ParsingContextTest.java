package org.pragmatica.pegrep.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;
import org.pragmatica.pegrep.tree.SyntaxNode;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParsingContext, focusing on packrat cache behavior
 * and state management.
 */
class ParsingContextTest {

    // === Packrat Cache Tests ===

    @Test
    void packratCache_whenEnabled_cachesResults() {
        var ctx = ParsingContext.create("a", ParserConfig.DEFAULT);
        var result = ParseResult.Success.of(terminal("a"), SourceLocation.at(1, 2, 1));

        assertTrue(ctx.getCachedAt("Root", 0).isEmpty());
        ctx.cacheAt("Root", 0, result);

        assertEquals(result, ctx.getCachedAt("Root", 0).orElseThrow());
    }

    @Test
    void packratCache_whenDisabled_returnsEmpty() {
        var ctx = ParsingContext.create("a", new ParserConfig(false, Set.of()));

        ctx.cacheAt("Root", 0, ParseResult.Success.of(terminal("a"), SourceLocation.at(1, 2, 1)));

        assertTrue(ctx.getCachedAt("Root", 0).isEmpty());
    }

    @Test
    void packratCache_keysOnRuleAndPosition() {
        var ctx = ParsingContext.create("aa", ParserConfig.DEFAULT);
        var first = ParseResult.Success.of(terminal("a"), SourceLocation.at(1, 2, 1));
        var second = ParseResult.Failure.at(SourceLocation.at(1, 2, 1), "'b'");

        ctx.cacheAt("A", 0, first);
        ctx.cacheAt("B", 0, second);

        assertEquals(first, ctx.getCachedAt("A", 0).orElseThrow());
        assertEquals(second, ctx.getCachedAt("B", 0).orElseThrow());
        assertTrue(ctx.getCachedAt("A", 1).isEmpty());
    }

    // === Position Management Tests ===

    @Test
    void position_startsAtZero() {
        var ctx = ParsingContext.create("test", ParserConfig.DEFAULT);

        assertEquals(0, ctx.pos());
        assertEquals(SourceLocation.START, ctx.location());
    }

    @Test
    void advance_updatesLineAndColumn() {
        var ctx = ParsingContext.create("a\nb", ParserConfig.DEFAULT);

        ctx.advance();
        assertEquals(2, ctx.location().column());

        ctx.advance();
        assertEquals(2, ctx.location().line());
        assertEquals(1, ctx.location().column());
    }

    @Test
    void restoreLocation_resetsPositionAndLineColumn() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);
        var saved = ctx.location();

        ctx.advance();
        ctx.advance();
        ctx.restoreLocation(saved);

        assertEquals(0, ctx.pos());
        assertEquals(saved, ctx.location());
    }

    // === Error Tracking Tests ===

    @Test
    void updateFurthest_combinesExpectationsAtSamePosition() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);
        ctx.advance();

        ctx.updateFurthest("'x'");
        ctx.updateFurthest("'y'");
        ctx.updateFurthest("'x'");

        assertEquals(1, ctx.furthestPos());
        assertEquals("'x' or 'y'", ctx.furthestExpected());
    }

    @Test
    void updateFurthest_ignoresWhitespaceSkipping() {
        var ctx = ParsingContext.create("abc", ParserConfig.DEFAULT);
        ctx.advance();

        ctx.enterWhitespaceSkip();
        ctx.updateFurthest("' '");
        ctx.exitWhitespaceSkip();

        assertEquals(0, ctx.furthestPos());
        assertEquals("", ctx.furthestExpected());
    }

    @Test
    void charAtOrEnd_isEmptyPastInput() {
        var ctx = ParsingContext.create("ab", ParserConfig.DEFAULT);

        assertEquals("b", ctx.charAtOrEnd(1));
        assertEquals("", ctx.charAtOrEnd(2));
    }

    // === Helper Methods ===

    private static SyntaxNode.Terminal terminal(String text) {
        var span = SourceSpan.of(SourceLocation.START, SourceLocation.at(1, text.length() + 1, text.length()));
        return new SyntaxNode.Terminal(span, "Test", text);
    }
}
