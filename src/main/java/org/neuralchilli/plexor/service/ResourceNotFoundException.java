package org.neuralchilli.plexor.service;

import org.neuralchilli.plexor.exception.PlexorException;

/**
 * The workflow, run or task asked for does not exist.
 */
public class ResourceNotFoundException extends PlexorException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
