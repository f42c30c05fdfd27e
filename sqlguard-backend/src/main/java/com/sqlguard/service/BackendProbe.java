package com.sqlguard.service;

import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.util.DsnParser;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Decides the process mode once, at startup, by trying to reach the configured database.
 */
@Component
public class BackendProbe {

    private static final Logger log = LoggerFactory.getLogger(BackendProbe.class);

    private final ReadOnlyDataSourceFactory dataSourceFactory;
    private final ResultNormalizer resultNormalizer;

    public BackendProbe(ReadOnlyDataSourceFactory dataSourceFactory, ResultNormalizer resultNormalizer) {
        this.dataSourceFactory = dataSourceFactory;
        this.resultNormalizer = resultNormalizer;
    }

    /**
     * Probe the backend. Any failure selects demo mode.
     *
     * @param settings database settings
     * @return live context owning the pool, or a demo context
     */
    public BackendContext probe(DatabaseSettings settings) {
        if (!settings.hasUrl()) {
            log.warn("No database URL configured - running in DEMO mode with synthetic e-commerce data");
            return BackendContext.demo();
        }

        log.info("Probing database {}", DsnParser.mask(settings.url()));
        HikariDataSource ds = null;
        try {
            ds = dataSourceFactory.create(settings);
            try (Connection conn = ds.getConnection()) {
                int timeoutSeconds = Math.max(1, settings.connectionTimeoutMs() / 1000);
                if (!conn.isValid(timeoutSeconds)) {
                    throw new SQLException("Connection is not valid");
                }
            }
            log.info("PostgreSQL connection verified - running in LIVE mode");
            return BackendContext.live(new ReadOnlySessionExecutor(ds, resultNormalizer, settings), ds);
        } catch (Exception e) {
            if (ds != null) {
                ds.close();
            }
            log.warn("PostgreSQL not reachable ({}) - running in DEMO mode with synthetic e-commerce data", e.getMessage());
            return BackendContext.demo();
        }
    }
}
