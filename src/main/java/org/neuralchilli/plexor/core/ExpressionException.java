package org.neuralchilli.plexor.core;

import org.neuralchilli.plexor.exception.PlexorException;

/**
 * Thrown when a templated value cannot be compiled or evaluated.
 */
public class ExpressionException extends PlexorException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
