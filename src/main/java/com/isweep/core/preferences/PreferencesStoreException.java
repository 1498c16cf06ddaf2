package com.isweep.core.preferences;

/**
 * Thrown when the backing storage of a {@link PreferencesStore} fails.
 */
public class PreferencesStoreException extends RuntimeException {
    public PreferencesStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
