package org.pragmatica.pegrep.pattern;

import org.pragmatica.pegrep.tree.SourceLocation;

/**
 * A lexeme of the pattern as the user wrote it.
 *
 * @param kind       token category
 * @param text       original text
 * @param start      location of the first character
 * @param end        offset just past the last character
 * @param wildcardId id in the wildcard table, {@code -1} for other tokens
 */
public record PatternToken(TokenKind kind, String text, SourceLocation start, int end, int wildcardId) {

    public static PatternToken of(TokenKind kind, String text, SourceLocation start) {
        return new PatternToken(kind, text, start, start.offset() + text.length(), -1);
    }

    public static PatternToken wildcard(String text, SourceLocation start, int wildcardId) {
        return new PatternToken(TokenKind.WILDCARD, text, start, start.offset() + text.length(), wildcardId);
    }

    public boolean isWildcard() {
        return kind == TokenKind.WILDCARD;
    }
}
