package com.sqlguard.service;

import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.guard.Classification;
import com.sqlguard.guard.StatementClassifier;
import com.sqlguard.model.QueryResultSet;
import com.sqlguard.model.ScalarValue;
import com.sqlguard.util.JdbcConnectionInfoResolver;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the executor against a real PostgreSQL server through a single-connection pool, so every
 * call reuses the same backend session.
 */
@Testcontainers(disabledWithoutDocker = true)
class ReadOnlySessionExecutorPostgresTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static final long INITIAL_VALUE = 10;

    private static HikariDataSource dataSource;
    private static ReadOnlySessionExecutor executor;

    private final StatementClassifier classifier = new StatementClassifier();

    @BeforeAll
    static void setUp() throws Exception {
        try (Connection admin = POSTGRES.createConnection(""); Statement st = admin.createStatement()) {
            st.execute("CREATE SEQUENCE order_seq");
        }
        String dsn = "postgres://" + POSTGRES.getUsername() + ":" + POSTGRES.getPassword()
                + "@" + POSTGRES.getHost() + ":" + POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT)
                + "/" + POSTGRES.getDatabaseName();
        DatabaseSettings settings = new DatabaseSettings(dsn, 5000, 30000, 1, 50, false);
        dataSource = new ReadOnlyDataSourceFactory(new JdbcConnectionInfoResolver()).create(settings);
        executor = new ReadOnlySessionExecutor(dataSource, new ResultNormalizer(), settings);
    }

    @AfterAll
    static void tearDown() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @BeforeEach
    void resetSequence() throws Exception {
        try (Connection admin = POSTGRES.createConnection(""); Statement st = admin.createStatement()) {
            st.execute("SELECT setval('order_seq', " + INITIAL_VALUE + ")");
        }
    }

    private QueryResultSet run(String sql) throws SQLException {
        Classification classification = classifier.classify(sql);
        assertTrue(classification.isAccepted(), sql);
        return executor.execute((Classification.Accepted) classification);
    }

    private static long sequenceValue() throws Exception {
        try (Connection admin = POSTGRES.createConnection("");
             Statement st = admin.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_value FROM order_seq")) {
            assertTrue(rs.next());
            return rs.getLong(1);
        }
    }

    @Test
    void plainReadRunsOnThePinnedSession() throws Exception {
        QueryResultSet rs = run("SELECT current_setting('transaction_read_only') AS ro");

        assertEquals(ScalarValue.of("on"), rs.getRows().get(0).get(0));
    }

    @Test
    void writingSelectsAreRefusedByTheServer() throws Exception {
        SQLException setval = assertThrows(SQLException.class, () -> run("SELECT setval('order_seq', 42)"));
        assertEquals("25006", setval.getSQLState());

        SQLException nextval = assertThrows(SQLException.class, () -> run("SELECT nextval('order_seq')"));
        assertEquals("25006", nextval.getSQLState());

        assertEquals(INITIAL_VALUE, sequenceValue());
    }

    @Test
    void sessionDefaultFlipDoesNotSurviveIntoTheNextBorrow() throws Exception {
        run("SELECT set_config('default_transaction_read_only', 'off', false)");

        SQLException e = assertThrows(SQLException.class, () -> run("SELECT setval('order_seq', 777)"));

        assertEquals("25006", e.getSQLState());
        assertEquals(INITIAL_VALUE, sequenceValue());
        assertEquals(ScalarValue.of("on"),
                run("SELECT current_setting('default_transaction_read_only')").getRows().get(0).get(0));
    }

    @Test
    void flipInsideTheSameStatementDoesNotApplyToIt() throws Exception {
        SQLException e = assertThrows(SQLException.class,
                () -> run("SELECT set_config('default_transaction_read_only', 'off', false), setval('order_seq', 99)"));

        assertEquals("25006", e.getSQLState());
        assertEquals(INITIAL_VALUE, sequenceValue());
    }
}
