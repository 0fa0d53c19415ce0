package org.pragmatica.pegrep.parser;

import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable parsing context that tracks state during a single parse.
 */
public final class ParsingContext {

    private final String input;
    private final ParserConfig config;
    private final Map<Long, ParseResult> packratCache;
    private final Map<String, Integer> ruleIds;

    private int pos;
    private int line;
    private int column;
    private int furthestPos;
    private int furthestLine;
    private int furthestColumn;
    private String furthestExpected;
    private int tokenBoundaryDepth;

    // Whitespace skipping guard (prevents recursive whitespace parsing)
    private boolean skippingWhitespace;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.config = config;
        this.packratCache = config.packratEnabled()
                            ? new HashMap<>()
                            : null;
        this.ruleIds = config.packratEnabled()
                       ? new HashMap<>()
                       : null;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.furthestPos = 0;
        this.furthestLine = 1;
        this.furthestColumn = 1;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public int remaining() {
        return input.length() - pos;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    public char peek(int offset) {
        return input.charAt(pos + offset);
    }

    public char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // === Error Tracking ===

    /**
     * Record a failed terminal at the current position. Failures while skipping
     * whitespace are not errors and are ignored.
     */
    public void updateFurthest(String expected) {
        if (skippingWhitespace) {
            return;
        }
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLine = line;
            furthestColumn = column;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    public int furthestPos() {
        return furthestPos;
    }

    public SourceLocation furthestLocation() {
        return SourceLocation.at(furthestLine, furthestColumn, furthestPos);
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    public String charAtOrEnd(int offset) {
        return offset < input.length()
               ? String.valueOf(input.charAt(offset))
               : "";
    }

    // === Token Boundary Tracking ===

    public void enterTokenBoundary() {
        tokenBoundaryDepth++ ;
    }

    public void exitTokenBoundary() {
        tokenBoundaryDepth-- ;
    }

    public boolean inTokenBoundary() {
        return tokenBoundaryDepth > 0;
    }

    // === Whitespace Skipping Guard ===

    public boolean isSkippingWhitespace() {
        return skippingWhitespace;
    }

    public void enterWhitespaceSkip() {
        skippingWhitespace = true;
    }

    public void exitWhitespaceSkip() {
        skippingWhitespace = false;
    }

    // === Packrat Cache ===

    public Optional<ParseResult> getCachedAt(String ruleName, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(packratCache.get(packratKey(ruleName, position)));
    }

    public void cacheAt(String ruleName, int position, ParseResult result) {
        if (packratCache != null) {
            packratCache.put(packratKey(ruleName, position), result);
        }
    }

    private long packratKey(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    // === Accessors ===

    public String input() {
        return input;
    }

    public ParserConfig config() {
        return config;
    }

    // === Span Creation ===

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }
}
