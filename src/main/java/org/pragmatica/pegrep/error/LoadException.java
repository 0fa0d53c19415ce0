package org.pragmatica.pegrep.error;

import java.nio.file.Path;

/**
 * A corpus path could not be found, read or parsed. Aborts the whole run.
 */
public final class LoadException extends PegrepException {
    private final Path path;

    public LoadException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public LoadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public static LoadException missing(Path path) {
        return new LoadException(path, "cannot find path: " + path);
    }

    public static LoadException unparsable(Path path, ParseException cause) {
        var error = cause.error();
        return new LoadException(path, path + ":" + error.location() + ": " + error.message(), cause);
    }

    public Path path() {
        return path;
    }
}
