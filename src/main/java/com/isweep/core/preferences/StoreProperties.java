package com.isweep.core.preferences;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the JDBC preferences store. When {@code jdbcUrl} is
 * unset the service keeps preferences in memory.
 */
@Component
@ConfigurationProperties(prefix = StoreProperties.PREFIX)
public class StoreProperties {

    public static final String PREFIX = "isweep.store";

    private String jdbcUrl;
    private String username;
    private String password;

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isJdbcEnabled() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }
}
