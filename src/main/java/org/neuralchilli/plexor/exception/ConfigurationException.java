package org.neuralchilli.plexor.exception;

/**
 * Thrown when the executor topology or routing table is invalid.
 * Raised while the application boots, so it is fatal.
 */
public class ConfigurationException extends PlexorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
