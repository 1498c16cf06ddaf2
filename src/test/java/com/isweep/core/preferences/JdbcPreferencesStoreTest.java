package com.isweep.core.preferences;

import com.isweep.core.model.Preferences;
import com.isweep.core.model.PreferencesUpdate;
import com.isweep.core.model.Sensitivity;
import com.isweep.core.model.UserAccount;
import com.isweep.core.rules.InvalidConfigurationException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs {@link JdbcPreferencesStore} against an in-memory H2 database.
 */
class JdbcPreferencesStoreTest {

    private JdbcDataSource dataSource;
    private JdbcPreferencesStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:prefs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcPreferencesStore(dataSource);
        store.createTables();
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() {
        assertDoesNotThrow(() -> store.createTables());
    }

    @Test
    @DisplayName("createUser stores default preferences")
    void createUser() {
        UserAccount account = store.createUser("alice");

        assertTrue(account.userId() > 0);
        assertEquals(Preferences.defaults(), account.preferences());
        assertEquals(Preferences.defaults(), store.getPreferences(account.userId()).orElseThrow());

        UserAccount found = store.findUser(account.userId()).orElseThrow();
        assertEquals("alice", found.username());
        assertNotNull(found.createdAt());
    }

    @Test
    @DisplayName("duplicate usernames raise DuplicateUsernameException")
    void duplicateUsername() {
        store.createUser("alice");
        assertThrows(DuplicateUsernameException.class, () -> store.createUser("alice"));
        // the failed insert must not leave a half-created user behind
        assertNotNull(store.createUser("bob"));
    }

    @Test
    @DisplayName("unknown users are empty, not errors")
    void unknownUser() {
        assertTrue(store.getPreferences(999L).isEmpty());
        assertTrue(store.findUser(999L).isEmpty());
        assertTrue(store.updatePreferences(999L,
                new PreferencesUpdate(true, null, null, null, null, null)).isEmpty());
    }

    @Test
    @DisplayName("partial updates keep the other fields")
    void partialUpdate() {
        long id = store.createUser("alice").userId();

        Preferences updated = store.updatePreferences(id,
                new PreferencesUpdate(null, null, false, null, Sensitivity.HIGH, null)).orElseThrow();

        assertFalse(updated.violenceFilter());
        assertEquals(Sensitivity.HIGH, updated.sexualContentSensitivity());
        assertEquals(Sensitivity.MEDIUM, updated.languageSensitivity());
        assertEquals(updated, store.getPreferences(id).orElseThrow());
    }

    @Test
    @DisplayName("an unknown stored sensitivity is a configuration error")
    void corruptSensitivity() throws SQLException {
        long id = store.createUser("alice").userId();
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("UPDATE user_preferences SET violence_sensitivity = 'extreme' WHERE user_id = " + id);
        }

        assertThrows(InvalidConfigurationException.class, () -> store.getPreferences(id));
    }

    @Test
    @DisplayName("isAvailable reflects the connection")
    void availability() throws SQLException {
        assertTrue(store.isAvailable());

        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("connection refused"));
        var unavailable = new JdbcPreferencesStore(broken);
        assertFalse(unavailable.isAvailable());
        assertThrows(PreferencesStoreException.class, () -> unavailable.getPreferences(1L));
    }
}
