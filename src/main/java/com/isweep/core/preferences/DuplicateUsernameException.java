package com.isweep.core.preferences;

/**
 * Thrown when a user is created with a username that already exists.
 */
public class DuplicateUsernameException extends RuntimeException {
    public DuplicateUsernameException(String username) {
        super("Username already exists: " + username);
    }
}
