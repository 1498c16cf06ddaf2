package com.isweep.core.preferences;

import com.isweep.core.model.Preferences;
import com.isweep.core.model.PreferencesUpdate;
import com.isweep.core.model.Sensitivity;
import com.isweep.core.model.UserAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link PreferencesStore} using two tables:
 * {@code users} and {@code user_preferences} (one row per user).
 * <p>
 * Sensitivities are stored as text and parsed strictly on read; a row with an
 * unknown value surfaces as an
 * {@link com.isweep.core.rules.InvalidConfigurationException}. Updates lock
 * the preferences row ({@code SELECT ... FOR UPDATE}) so concurrent writes to
 * the same user are serialized.
 * <p>
 * The tables are created by {@link #createTables()}. The SQL sticks to syntax
 * shared by PostgreSQL and H2.
 */
public class JdbcPreferencesStore implements PreferencesStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPreferencesStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_USERS_SQL = """
            CREATE TABLE IF NOT EXISTS users (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                username   VARCHAR(255) NOT NULL UNIQUE,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String CREATE_PREFERENCES_SQL = """
            CREATE TABLE IF NOT EXISTS user_preferences (
                user_id                    BIGINT PRIMARY KEY REFERENCES users (id),
                language_filter            BOOLEAN NOT NULL DEFAULT TRUE,
                sexual_content_filter      BOOLEAN NOT NULL DEFAULT TRUE,
                violence_filter            BOOLEAN NOT NULL DEFAULT TRUE,
                language_sensitivity       VARCHAR(16) NOT NULL DEFAULT 'medium',
                sexual_content_sensitivity VARCHAR(16) NOT NULL DEFAULT 'medium',
                violence_sensitivity       VARCHAR(16) NOT NULL DEFAULT 'medium'
            )
            """;

    private static final String INSERT_USER_SQL = "INSERT INTO users (username, created_at) VALUES (?, ?)";

    private static final String INSERT_PREFERENCES_SQL = "INSERT INTO user_preferences (user_id) VALUES (?)";

    private static final String SELECT_PREFERENCES_SQL = """
            SELECT language_filter, sexual_content_filter, violence_filter,
                   language_sensitivity, sexual_content_sensitivity, violence_sensitivity
            FROM user_preferences
            WHERE user_id = ?
            """;

    private static final String SELECT_PREFERENCES_FOR_UPDATE_SQL = SELECT_PREFERENCES_SQL + " FOR UPDATE";

    private static final String SELECT_USER_SQL = """
            SELECT u.id, u.username, u.created_at,
                   p.language_filter, p.sexual_content_filter, p.violence_filter,
                   p.language_sensitivity, p.sexual_content_sensitivity, p.violence_sensitivity
            FROM users u
            JOIN user_preferences p ON p.user_id = u.id
            WHERE u.id = ?
            """;

    private static final String UPDATE_PREFERENCES_SQL = """
            UPDATE user_preferences
            SET language_filter = ?, sexual_content_filter = ?, violence_filter = ?,
                language_sensitivity = ?, sexual_content_sensitivity = ?, violence_sensitivity = ?
            WHERE user_id = ?
            """;

    private final DataSource dataSource;

    public JdbcPreferencesStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the user and preferences tables if they do not exist yet.
     * Called once during startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_USERS_SQL);
            stmt.execute(CREATE_PREFERENCES_SQL);
            log.info("Preference tables ensured");
        }
    }

    @Override
    public Optional<Preferences> getPreferences(long userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PREFERENCES_SQL)) {
            stmt.setLong(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readPreferences(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PreferencesStoreException("Failed to read preferences for user " + userId, e);
        }
    }

    @Override
    public Optional<UserAccount> findUser(long userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_USER_SQL)) {
            stmt.setLong(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp createdAt = rs.getTimestamp("created_at");
                return Optional.of(new UserAccount(
                        rs.getLong("id"),
                        rs.getString("username"),
                        createdAt != null ? createdAt.toInstant() : null,
                        readPreferences(rs)));
            }
        } catch (SQLException e) {
            throw new PreferencesStoreException("Failed to read user " + userId, e);
        }
    }

    @Override
    public UserAccount createUser(String username) {
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long userId;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_USER_SQL, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setString(1, username);
                    stmt.setTimestamp(2, Timestamp.from(now));
                    stmt.executeUpdate();
                    try (ResultSet keys = stmt.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No id generated for user " + username);
                        }
                        userId = keys.getLong(1);
                    }
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_PREFERENCES_SQL)) {
                    stmt.setLong(1, userId);
                    stmt.executeUpdate();
                }
                conn.commit();
                log.debug("Created user {} ({})", userId, username);
                return new UserAccount(userId, username, now, Preferences.defaults());
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new DuplicateUsernameException(username);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new PreferencesStoreException("Failed to create user " + username, e);
        }
    }

    @Override
    public Optional<Preferences> updatePreferences(long userId, PreferencesUpdate update) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Preferences current;
                try (PreparedStatement stmt = conn.prepareStatement(SELECT_PREFERENCES_FOR_UPDATE_SQL)) {
                    stmt.setLong(1, userId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return Optional.empty();
                        }
                        current = readPreferences(rs);
                    }
                }

                Preferences merged = update.applyTo(current);
                try (PreparedStatement stmt = conn.prepareStatement(UPDATE_PREFERENCES_SQL)) {
                    stmt.setBoolean(1, merged.languageFilter());
                    stmt.setBoolean(2, merged.sexualContentFilter());
                    stmt.setBoolean(3, merged.violenceFilter());
                    stmt.setString(4, merged.languageSensitivity().wireName());
                    stmt.setString(5, merged.sexualContentSensitivity().wireName());
                    stmt.setString(6, merged.violenceSensitivity().wireName());
                    stmt.setLong(7, userId);
                    stmt.executeUpdate();
                }
                conn.commit();
                return Optional.of(merged);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PreferencesStoreException("Failed to update preferences for user " + userId, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.warn("Preferences database unavailable: {}", e.getMessage());
            return false;
        }
    }

    private static Preferences readPreferences(ResultSet rs) throws SQLException {
        return new Preferences(
                rs.getBoolean("language_filter"),
                rs.getBoolean("sexual_content_filter"),
                rs.getBoolean("violence_filter"),
                Sensitivity.fromWire(rs.getString("language_sensitivity")),
                Sensitivity.fromWire(rs.getString("sexual_content_sensitivity")),
                Sensitivity.fromWire(rs.getString("violence_sensitivity")));
    }
}
