package com.sqlguard.service;

import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.util.DbTypeNormalizer;
import com.sqlguard.util.JdbcConnectionInfo;
import com.sqlguard.util.JdbcConnectionInfoResolver;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

/**
 * Builds the connection pool. Every connection it hands out defaults to read-only, autocommit
 * sessions, independently of what the executor later asks for.
 */
@Component
public class ReadOnlyDataSourceFactory {

    static final String POOL_NAME = "sqlguard-readonly";
    static final String APPLICATION_NAME = "sqlguard";
    static final String READ_ONLY_SESSION_SQL = "SET SESSION CHARACTERISTICS AS TRANSACTION READ ONLY";

    private final JdbcConnectionInfoResolver jdbcConnectionInfoResolver;

    public ReadOnlyDataSourceFactory(JdbcConnectionInfoResolver jdbcConnectionInfoResolver) {
        this.jdbcConnectionInfoResolver = jdbcConnectionInfoResolver;
    }

    /**
     * Create the pool. Hikari connects eagerly, so an unreachable backend fails here.
     *
     * @param settings database settings with a non-blank url
     * @return open pool
     */
    public HikariDataSource create(DatabaseSettings settings) {
        return new HikariDataSource(buildHikariConfig(settings));
    }

    HikariConfig buildHikariConfig(DatabaseSettings settings) {
        JdbcConnectionInfo info = jdbcConnectionInfoResolver.resolve(settings.url());

        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(ReadOnlySqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        if (info.getUsername() != null && !info.getUsername().isEmpty()) {
            config.setUsername(info.getUsername());
        }
        if (info.getPassword() != null && !info.getPassword().isEmpty()) {
            config.setPassword(info.getPassword());
        }
        info.getProperties().forEach(config::addDataSourceProperty);

        config.setReadOnly(true);
        config.setAutoCommit(true);

        if (DbTypeNormalizer.POSTGRES.equals(info.getDbType())) {
            config.setDriverClassName("org.postgresql.Driver");
            // pgjdbc ignores setReadOnly(true) under autocommit unless readOnlyMode=always.
            config.addDataSourceProperty("readOnlyMode", "always");
            config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
            config.setConnectionInitSql(READ_ONLY_SESSION_SQL);
        }

        config.setConnectionTimeout(settings.connectionTimeoutMs());
        config.setMaximumPoolSize(settings.maxPoolSize());
        config.setMinimumIdle(1);
        config.setIdleTimeout(60000);
        config.setPoolName(POOL_NAME);
        return config;
    }
}
