package org.finos.cubes;

/**
 * Exception thrown when a model is configured inconsistently or a query
 * refers to model elements that do not exist.
 *
 * Raised at model build time or at compile time, never at execution time.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
