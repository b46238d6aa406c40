package org.neuralchilli.plexor.exception;

/**
 * Thrown when an optimistic update could not be applied after the
 * configured number of attempts because other writers kept winning.
 */
public class StaleStateException extends PlexorException {

    private final Object key;

    public StaleStateException(Object key, int attempts) {
        super("Failed to update " + key + " after " + attempts + " attempts");
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
