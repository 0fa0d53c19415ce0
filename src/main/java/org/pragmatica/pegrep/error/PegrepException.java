package org.pragmatica.pegrep.error;

/**
 * Base of the failures a search run can surface to its caller.
 */
public abstract class PegrepException extends Exception {

    protected PegrepException(String message) {
        super(message);
    }

    protected PegrepException(String message, Throwable cause) {
        super(message, cause);
    }
}
