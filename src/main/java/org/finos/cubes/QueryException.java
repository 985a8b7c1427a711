package org.finos.cubes;

/**
 * Exception thrown when a query request cannot be compiled: a path deeper
 * than its hierarchy, an unknown order direction, an invalid limit or page.
 */
public class QueryException extends RuntimeException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
