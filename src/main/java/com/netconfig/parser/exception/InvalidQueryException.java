package com.netconfig.parser.exception;

/**
 * Raised when a caller passes arguments that a query cannot work with:
 * a negative cousin depth, an unsupported address query, a malformed
 * search spec and the like. It never indicates bad configuration data.
 */
public class InvalidQueryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
