package org.neuralchilli.plexor.service;

import org.neuralchilli.plexor.exception.PlexorException;

/**
 * The request is valid but the run or task is in a state that forbids it,
 * such as cancelling a finished run or pausing a paused one.
 */
public class ConflictException extends PlexorException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
