package com.sqlguard.config;

import org.springframework.core.env.Environment;

/**
 * Immutable database settings resolved once at startup.
 *
 * <p>{@code url} comes from {@code sqlguard.database.url}, which application.yml binds to the
 * {@code DATABASE_URL} environment variable. A blank url selects demo mode.
 */
public record DatabaseSettings(
        String url,
        int connectionTimeoutMs,
        int queryTimeoutMs,
        int maxPoolSize,
        int fetchSize,
        boolean redactBackendErrors
) {
    static final String PREFIX = "sqlguard.database.";

    public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 5000;
    public static final int DEFAULT_QUERY_TIMEOUT_MS = 30000;
    public static final int DEFAULT_MAX_POOL_SIZE = 5;
    public static final int DEFAULT_FETCH_SIZE = 50;

    public static DatabaseSettings fromEnvironment(Environment environment) {
        String url = environment.getProperty(PREFIX + "url", "");
        return new DatabaseSettings(
                url.trim(),
                positive(environment, "connection-timeout-ms", DEFAULT_CONNECTION_TIMEOUT_MS),
                positive(environment, "query-timeout-ms", DEFAULT_QUERY_TIMEOUT_MS),
                positive(environment, "max-pool-size", DEFAULT_MAX_POOL_SIZE),
                positive(environment, "fetch-size", DEFAULT_FETCH_SIZE),
                environment.getProperty(PREFIX + "redact-backend-errors", Boolean.class, false)
        );
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    /**
     * JDBC query timeouts are whole seconds; anything below one second rounds up.
     */
    public int queryTimeoutSeconds() {
        return Math.max(1, (queryTimeoutMs + 999) / 1000);
    }

    private static int positive(Environment environment, String key, int fallback) {
        Integer value = environment.getProperty(PREFIX + key, Integer.class);
        if (value == null || value <= 0) {
            return fallback;
        }
        return value;
    }
}
