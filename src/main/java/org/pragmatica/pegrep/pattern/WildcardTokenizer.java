package org.pragmatica.pegrep.pattern;

import org.pragmatica.pegrep.error.TokenizeException;
import org.pragmatica.pegrep.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Splits a pattern into Java lexemes and wildcards.
 *
 * <p>Wildcard forms:
 * <ul>
 *   <li>{@code $name}, {@code $_} - one node</li>
 *   <li>{@code $*name}, {@code $*_} - any number of sibling nodes</li>
 *   <li>{@code $(name, /regex/)}, {@code $(_, /regex/)} - one identifier whose text matches the regex</li>
 * </ul>
 * A {@code #} before anything else in the pattern enables aggressive matching.
 *
 * <p>Only as much Java is lexed as needed to tell a wildcard {@code $} from one inside
 * a string, character literal or comment.
 */
public final class WildcardTokenizer {
    private final String input;
    private final List<PatternToken> tokens = new ArrayList<>();
    private final WildcardTable.Builder wildcards = new WildcardTable.Builder();
    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean aggressive;

    private WildcardTokenizer(String input) {
        this.input = input;
    }

    public static TokenizedPattern tokenize(String pattern) throws TokenizeException {
        return new WildcardTokenizer(pattern).run();
    }

    private TokenizedPattern run() throws TokenizeException {
        skipWhitespace();
        if (peek() == '#') {
            aggressive = true;
            var start = location();
            advance();
            tokens.add(PatternToken.of(TokenKind.AGGRESSIVE, "#", start));
        }
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            tokens.add(nextToken());
        }
        return new TokenizedPattern(input, tokens, wildcards.build(), aggressive);
    }

    private PatternToken nextToken() throws TokenizeException {
        var start = location();
        char c = peek();
        if (c == '$') {
            return wildcard();
        }
        if (c == '/' && peek(1) == '/') {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
            return token(TokenKind.COMMENT, start);
        }
        if (c == '/' && peek(1) == '*') {
            advance(2);
            while (!(peek() == '*' && peek(1) == '/')) {
                if (isAtEnd()) {
                    throw new TokenizeException(start, "unterminated comment");
                }
                advance();
            }
            advance(2);
            return token(TokenKind.COMMENT, start);
        }
        if (input.startsWith("\"\"\"", pos)) {
            advance(3);
            while (!input.startsWith("\"\"\"", pos)) {
                if (isAtEnd()) {
                    throw new TokenizeException(start, "unterminated text block");
                }
                if (peek() == '\\' && pos + 1 < input.length()) {
                    advance();
                }
                advance();
            }
            advance(3);
            return token(TokenKind.STRING, start);
        }
        if (c == '"' || c == '\'') {
            return quoted(c, start);
        }
        if (isNameStart(c)) {
            while (isNamePart(peek())) {
                advance();
            }
            rejectGluedDollar();
            return token(TokenKind.IDENTIFIER, start);
        }
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            return number(start);
        }
        advance();
        return token(TokenKind.OPERATOR, start);
    }

    private PatternToken quoted(char quote, SourceLocation start) throws TokenizeException {
        var kind = quote == '"'
                   ? TokenKind.STRING
                   : TokenKind.CHAR;
        var what = quote == '"'
                   ? "string literal"
                   : "character literal";
        advance();
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n') {
                throw new TokenizeException(start, "unterminated " + what);
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) {
                    throw new TokenizeException(start, "unterminated " + what);
                }
            }
            advance();
        }
        advance();
        return token(kind, start);
    }

    private PatternToken number(SourceLocation start) {
        boolean hex = peek() == '0' && (peek(1) == 'x' || peek(1) == 'X');
        while (true) {
            char c = peek();
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                advance();
            } else if ((c == '+' || c == '-') && !hex && isExponentMark(input.charAt(pos - 1))) {
                advance();
            } else {
                break;
            }
        }
        return token(TokenKind.NUMBER, start);
    }

    private static boolean isExponentMark(char c) {
        return c == 'e' || c == 'E';
    }

    // === Wildcards ===

    private PatternToken wildcard() throws TokenizeException {
        var start = location();
        advance();
        WildcardInfo info;
        if (peek() == '*') {
            advance();
            info = WildcardInfo.anyCount(name(start, "$*"));
        } else if (peek() == '(') {
            info = constrained(start);
            if (isNamePart(peek())) {
                throw new TokenizeException(location(), "a name must not directly follow a wildcard");
            }
        } else {
            info = WildcardInfo.single(name(start, "$"));
        }
        rejectGluedDollar();
        var conflict = wildcards.conflictFor(info);
        if (conflict.isPresent()) {
            throw new TokenizeException(start,
                                        "wildcard " + info.describe() + " conflicts with earlier "
                                        + conflict.get().describe());
        }
        var id = wildcards.register(info);
        return PatternToken.wildcard(input.substring(start.offset(), pos), start, id);
    }

    private String name(SourceLocation start, String prefix) throws TokenizeException {
        if (!isNameStart(peek())) {
            throw new TokenizeException(start, "expected a wildcard name after '" + prefix + "'");
        }
        var nameStart = pos;
        while (isNamePart(peek())) {
            advance();
        }
        return input.substring(nameStart, pos);
    }

    private WildcardInfo constrained(SourceLocation start) throws TokenizeException {
        advance();
        skipInlineSpaces();
        var name = name(start, "$(");
        skipInlineSpaces();
        if (peek() == ',') {
            advance();
            skipInlineSpaces();
        }
        if (isAtEnd()) {
            throw new TokenizeException(start, "unterminated wildcard, expected ')'");
        }
        if (peek() != '/') {
            throw new TokenizeException(location(), "expected '/' to start the name regex");
        }
        advance();
        var regexStart = location();
        var regex = new StringBuilder();
        while (peek() != '/') {
            if (isAtEnd()) {
                throw new TokenizeException(start, "unterminated regex");
            }
            if (peek() == '\\' && peek(1) == '/') {
                advance();
            } else if (peek() == '\\' && pos + 1 < input.length()) {
                regex.append(advance());
            }
            regex.append(advance());
        }
        advance();
        skipInlineSpaces();
        if (peek() != ')') {
            throw new TokenizeException(start, "unterminated wildcard, expected ')'");
        }
        advance();
        try {
            return WildcardInfo.constrained(name, Pattern.compile(regex.toString()));
        } catch (PatternSyntaxException e) {
            throw new TokenizeException(regexStart, "invalid regex: " + e.getDescription());
        }
    }

    /**
     * A {@code $} glued to a name would merge with it into one identifier.
     */
    private void rejectGluedDollar() throws TokenizeException {
        if (peek() == '$') {
            throw new TokenizeException(location(), "'$' must not directly follow an identifier or wildcard");
        }
    }

    // === Scanning ===

    private PatternToken token(TokenKind kind, SourceLocation start) {
        return PatternToken.of(kind, input.substring(start.offset(), pos), start);
    }

    private static boolean isNameStart(char c) {
        return c != '$' && c != 0 && Character.isJavaIdentifierStart(c);
    }

    private static boolean isNamePart(char c) {
        return c != '$' && c != 0 && Character.isJavaIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private void skipInlineSpaces() {
        while (peek() == ' ' || peek() == '\t') {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    /**
     * Character at the cursor, {@code 0} past the end.
     */
    private char peek() {
        return peek(0);
    }

    private char peek(int ahead) {
        return pos + ahead < input.length()
               ? input.charAt(pos + ahead)
               : 0;
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    private SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }
}
