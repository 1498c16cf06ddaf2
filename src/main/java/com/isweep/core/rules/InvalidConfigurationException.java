package com.isweep.core.rules;

/**
 * Thrown when filter rules or a stored preference hold a value the engine
 * cannot interpret: an unknown category or sensitivity, a missing action
 * table entry, or an inconsistent threshold.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
