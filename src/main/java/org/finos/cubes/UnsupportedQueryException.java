package org.finos.cubes;

/**
 * Exception thrown for query features that are recognized but not implemented,
 * such as set cuts and percent or value based limits.
 */
public class UnsupportedQueryException extends UnsupportedOperationException {

    public UnsupportedQueryException(String message) {
        super(message);
    }

    public UnsupportedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
