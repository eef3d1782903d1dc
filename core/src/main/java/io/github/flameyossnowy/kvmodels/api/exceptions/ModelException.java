package io.github.flameyossnowy.kvmodels.api.exceptions;

/**
 * Root of every failure raised by the model layer.
 */
public class ModelException extends RuntimeException {
    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
