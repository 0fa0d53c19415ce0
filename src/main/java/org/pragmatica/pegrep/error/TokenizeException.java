package org.pragmatica.pegrep.error;

import org.pragmatica.pegrep.tree.SourceLocation;
import org.pragmatica.pegrep.tree.SourceSpan;

/**
 * Malformed wildcard syntax or an invalid regex in a pattern.
 * The location always refers to the pattern text as the user wrote it.
 */
public final class TokenizeException extends PegrepException {
    private final SourceLocation location;
    private final String reason;

    public TokenizeException(SourceLocation location, String reason) {
        super("cannot tokenize pattern: " + location + ": " + reason);
        this.location = location;
        this.reason = reason;
    }

    public SourceLocation location() {
        return location;
    }

    public String reason() {
        return reason;
    }

    public Diagnostic diagnostic() {
        return Diagnostic.error("cannot tokenize pattern", SourceSpan.at(location))
                         .withLabel(reason);
    }
}
