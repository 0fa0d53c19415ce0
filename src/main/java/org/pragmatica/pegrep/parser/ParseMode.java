package org.pragmatica.pegrep.parser;

/**
 * Parameterizes whitespace handling of the combinator parsers.
 *
 * <ul>
 *   <li>{@link #standard()} - skip whitespace between elements</li>
 *   <li>{@link #noWhitespace()} - don't skip whitespace (for the %whitespace rule itself)</li>
 * </ul>
 */
public record ParseMode(boolean skipWhitespace) {
    private static final ParseMode STANDARD = new ParseMode(true);
    private static final ParseMode NO_WHITESPACE = new ParseMode(false);

    public static ParseMode standard() {
        return STANDARD;
    }

    public static ParseMode noWhitespace() {
        return NO_WHITESPACE;
    }

    public boolean shouldSkipWhitespace() {
        return skipWhitespace;
    }
}
