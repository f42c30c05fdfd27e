package com.sqlguard.service;

import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.guard.Classification;
import com.sqlguard.model.QueryResultSet;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs accepted statements on read-only, autocommit sessions.
 *
 * <p>The only way in is a {@link Classification.Accepted}, so text the classifier refused cannot
 * reach the database through this class. Each call borrows one connection and always returns it
 * before control leaves, whatever the outcome. Every borrow re-pins the session to read-only on
 * the server and verifies it there. Failures surface once as {@link SQLException};
 * nothing is retried.
 */
@Slf4j
public class ReadOnlySessionExecutor {

    static final String READ_ONLY_CHECK_SQL = "SHOW transaction_read_only";

    private final DataSource dataSource;
    private final ResultNormalizer resultNormalizer;
    private final DatabaseSettings settings;

    public ReadOnlySessionExecutor(DataSource dataSource, ResultNormalizer resultNormalizer, DatabaseSettings settings) {
        this.dataSource = dataSource;
        this.resultNormalizer = resultNormalizer;
        this.settings = settings;
    }

    /**
     * Execute exactly the accepted statement, without rewriting it.
     *
     * @param statement accepted statement
     * @return bounded, normalized result (empty column list for statements without a result set)
     * @throws SQLException on any backend failure, including a session that will not go read-only
     */
    public QueryResultSet execute(Classification.Accepted statement) throws SQLException {
        long startTime = System.currentTimeMillis();
        try (Connection conn = openReadOnly()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(settings.queryTimeoutSeconds());
                stmt.setFetchSize(settings.fetchSize());

                boolean isResultSet = stmt.execute(statement.getStatement());
                QueryResultSet result = isResultSet ? drain(stmt.getResultSet()) : emptyResult();
                log.debug("Query finished in {} ms ({} rows)", System.currentTimeMillis() - startTime, result.getRowCount());
                return result;
            }
        }
    }

    /**
     * Execute an accepted statement with bound parameters. Used by the catalog tools.
     *
     * @param statement accepted statement with {@code ?} placeholders
     * @param params positional parameters
     * @return bounded, normalized result
     * @throws SQLException on any backend failure
     */
    public QueryResultSet execute(Classification.Accepted statement, List<Object> params) throws SQLException {
        if (params == null || params.isEmpty()) {
            return execute(statement);
        }
        try (Connection conn = openReadOnly()) {
            try (PreparedStatement ps = conn.prepareStatement(statement.getStatement())) {
                ps.setQueryTimeout(settings.queryTimeoutSeconds());
                ps.setFetchSize(settings.fetchSize());
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                return drain(ps.executeQuery());
            }
        }
    }

    private Connection openReadOnly() throws SQLException {
        Connection conn = dataSource.getConnection();
        try {
            conn.setAutoCommit(true);
            conn.setReadOnly(true);
            pinSession(conn);
            return conn;
        } catch (SQLException | RuntimeException e) {
            try {
                conn.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Re-pin the session default on the server and read it back.
     *
     * <p>The driver's {@code setReadOnly} is cached per connection and sends nothing when the flag
     * is already set, while a previous statement on a pooled connection may have changed the
     * server-side default. The check reads the server's own state, not the driver flag.
     */
    private static void pinSession(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ReadOnlyDataSourceFactory.READ_ONLY_SESSION_SQL);
            try (ResultSet rs = stmt.executeQuery(READ_ONLY_CHECK_SQL)) {
                if (!rs.next() || !"on".equalsIgnoreCase(rs.getString(1))) {
                    throw new SQLException("Backend session refused read-only mode", ReadOnlySqlExceptionOverride.READ_ONLY_SQL_TRANSACTION);
                }
            }
        }
    }

    private QueryResultSet drain(ResultSet rs) throws SQLException {
        try (rs) {
            return resultNormalizer.normalize(rs);
        }
    }

    private static QueryResultSet emptyResult() {
        return QueryResultSet.builder().rowCount(0).truncated(false).build();
    }
}
