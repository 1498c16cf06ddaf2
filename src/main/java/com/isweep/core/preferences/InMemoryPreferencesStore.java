package com.isweep.core.preferences;

import com.isweep.core.model.Preferences;
import com.isweep.core.model.PreferencesUpdate;
import com.isweep.core.model.UserAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PreferencesStore} kept in process memory. Suitable for development,
 * tests and single-instance deployments; contents are lost on restart.
 * <p>
 * Updates go through {@link ConcurrentHashMap#computeIfPresent}, which
 * serializes writes per user while reads stay lock-free.
 */
public class InMemoryPreferencesStore implements PreferencesStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPreferencesStore.class);

    private final ConcurrentHashMap<Long, UserAccount> users = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> userIdsByName = new ConcurrentHashMap<>();
    private final AtomicLong nextUserId = new AtomicLong();
    private final Clock clock;

    public InMemoryPreferencesStore() {
        this(Clock.systemUTC());
    }

    public InMemoryPreferencesStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Preferences> getPreferences(long userId) {
        return findUser(userId).map(UserAccount::preferences);
    }

    @Override
    public Optional<UserAccount> findUser(long userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public UserAccount createUser(String username) {
        long userId = nextUserId.incrementAndGet();
        if (userIdsByName.putIfAbsent(username, userId) != null) {
            throw new DuplicateUsernameException(username);
        }
        var account = new UserAccount(userId, username, clock.instant(), Preferences.defaults());
        users.put(userId, account);
        log.debug("Created user {} ({})", userId, username);
        return account;
    }

    @Override
    public Optional<Preferences> updatePreferences(long userId, PreferencesUpdate update) {
        UserAccount updated = users.computeIfPresent(userId, (id, account) -> new UserAccount(
                account.userId(), account.username(), account.createdAt(),
                update.applyTo(account.preferences())));
        return Optional.ofNullable(updated).map(UserAccount::preferences);
    }
}
