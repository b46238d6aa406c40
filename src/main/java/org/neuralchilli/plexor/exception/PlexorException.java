package org.neuralchilli.plexor.exception;

/**
 * Base class for unchecked scheduler errors.
 */
public class PlexorException extends RuntimeException {

    public PlexorException(String message) {
        super(message);
    }

    public PlexorException(String message, Throwable cause) {
        super(message, cause);
    }
}
