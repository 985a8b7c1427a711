package org.finos.cubes;

/**
 * Exception thrown when a model description is malformed.
 */
public class ModelException extends ConfigurationException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
