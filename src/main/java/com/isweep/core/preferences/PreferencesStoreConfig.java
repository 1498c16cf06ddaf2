package com.isweep.core.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.type.AnnotatedTypeMetadata;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that provides the {@link PreferencesStore}.
 * <p>
 * When {@code isweep.store.jdbc-url} is set to a non-blank value, a {@link DataSource} and a
 * {@link JdbcPreferencesStore} are created and the tables are ensured on
 * startup. Otherwise an {@link InMemoryPreferencesStore} is used; users and
 * preferences are then lost on restart.
 */
@Configuration
public class PreferencesStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(PreferencesStoreConfig.class);

    @Bean
    @Conditional(JdbcUrlConfigured.class)
    public DataSource preferencesDataSource(StoreProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.getJdbcUrl())
                .username(properties.getUsername())
                .password(properties.getPassword())
                .build();
    }

    @Bean
    @Primary
    @Conditional(JdbcUrlConfigured.class)
    public PreferencesStore jdbcPreferencesStore(DataSource preferencesDataSource) throws SQLException {
        log.info("Configuring JDBC preferences store");
        var store = new JdbcPreferencesStore(preferencesDataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(PreferencesStore.class)
    public PreferencesStore inMemoryPreferencesStore() {
        log.info("No JDBC URL configured; using in-memory preferences store (users will not persist across restarts)");
        return new InMemoryPreferencesStore();
    }

    /**
     * Matches when {@link StoreProperties#isJdbcEnabled()} holds for the bound
     * {@code isweep.store.*} properties. An empty {@code ISWEEP_STORE_JDBCURL} does not count.
     */
    static class JdbcUrlConfigured implements Condition {

        @Override
        public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
            return Binder.get(context.getEnvironment())
                    .bind(StoreProperties.PREFIX, StoreProperties.class)
                    .map(StoreProperties::isJdbcEnabled)
                    .orElse(false);
        }
    }
}
