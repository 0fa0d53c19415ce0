package org.pragmatica.pegrep.error;

/**
 * Raised by the grammar parser and the PEG engine when input does not parse.
 */
public final class ParseException extends Exception {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.location() + ": " + error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
