package org.pragmatica.pegrep.error;

import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;

/**
 * No syntactic hypothesis accepted the pattern. The location has already been
 * mapped back to the original pattern text.
 */
public final class CompileException extends PegrepException {
    private final SourceLocation location;
    private final ParseError error;

    public CompileException(SourceLocation location, ParseError error) {
        super("cannot parse pattern: " + location + ": " + error.message());
        this.location = location;
        this.error = error;
    }

    public SourceLocation location() {
        return location;
    }

    public ParseError error() {
        return error;
    }

    public Diagnostic diagnostic() {
        var diagnostic = Diagnostic.error("cannot parse pattern", SourceSpan.at(location));
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return diagnostic.withLabel("found '" + unexpected.found() + "'")
                             .withHelp("expected " + unexpected.expected());
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return diagnostic.withLabel("pattern ends here")
                             .withHelp("expected " + eof.expected());
        }
        return diagnostic.withLabel(error.message());
    }
}
