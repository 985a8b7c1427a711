package org.finos.cubes;

/**
 * Exception thrown when a named lookup (cube, dimension, level, hierarchy)
 * has no match.
 */
public class NotFoundException extends ConfigurationException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
