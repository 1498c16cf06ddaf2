package com.isweep.core.preferences;

import com.isweep.core.model.Preferences;
import com.isweep.core.model.PreferencesUpdate;
import com.isweep.core.model.UserAccount;

import java.util.Optional;

/**
 * Storage for users and their filtering preferences.
 * <p>
 * Implementations must allow concurrent reads and serialize writes per user.
 * The decision engine only ever calls {@link #getPreferences(long)}.
 */
public interface PreferencesStore {

    /**
     * Returns the user's current preferences, or empty if the user does not exist.
     */
    Optional<Preferences> getPreferences(long userId);

    Optional<UserAccount> findUser(long userId);

    /**
     * Creates a user holding {@link Preferences#defaults()}.
     *
     * @throws DuplicateUsernameException if the username is taken
     */
    UserAccount createUser(String username);

    /**
     * Applies a partial update; fields absent from the update keep their value.
     *
     * @return the resulting preferences, or empty if the user does not exist
     */
    Optional<Preferences> updatePreferences(long userId, PreferencesUpdate update);

    /** Whether the backing storage can currently serve requests. */
    default boolean isAvailable() {
        return true;
    }
}
