package org.neuralchilli.plexor.service;

/**
 * Thrown when the dependencies of a workflow form a cycle.
 * A validation error, raised while loading definitions.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }
}
