package com.sqlguard.util;

import org.springframework.stereotype.Component;

/**
 * Resolves the configured database URL into a JDBC connection configuration.
 *
 * <p>Accepted forms are {@code postgres://} / {@code postgresql://} DSNs and raw
 * {@code jdbc:postgresql://} URLs, which are passed through untouched.
 */
@Component
public class JdbcConnectionInfoResolver {

    private static final String JDBC_POSTGRES_PREFIX = "jdbc:postgresql:";

    /**
     * Resolve a DSN into JDBC connection info.
     *
     * @param dsn configured database URL
     * @return jdbc connection info
     * @throws IllegalArgumentException for malformed DSNs or other database types
     */
    public JdbcConnectionInfo resolve(String dsn) {
        if (dsn == null || dsn.isBlank()) {
            throw new IllegalArgumentException("Database URL is empty");
        }
        String trimmed = dsn.trim();
        if (trimmed.regionMatches(true, 0, JDBC_POSTGRES_PREFIX, 0, JDBC_POSTGRES_PREFIX.length())) {
            return JdbcConnectionInfo.builder()
                    .url(trimmed)
                    .dbType(DbTypeNormalizer.POSTGRES)
                    .build();
        }

        DsnParser.ParsedDsn parsed = DsnParser.parse(trimmed);
        String dbType = DbTypeNormalizer.normalize(parsed.scheme());
        if (!DbTypeNormalizer.POSTGRES.equals(dbType)) {
            throw new IllegalArgumentException("Unsupported database type: " + dbType);
        }

        int port = parsed.port() > 0 ? parsed.port() : 5432;
        return JdbcConnectionInfo.builder()
                .url(String.format("jdbc:postgresql://%s:%d/%s", parsed.host(), port, parsed.database()))
                .username(parsed.username())
                .password(parsed.password())
                .dbType(dbType)
                .properties(parsed.params())
                .build();
    }
}
