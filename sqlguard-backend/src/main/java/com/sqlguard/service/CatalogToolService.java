package com.sqlguard.service;

import com.sqlguard.api.ToolOutput;
import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.demo.DemoDataset;
import com.sqlguard.guard.Classification;
import com.sqlguard.guard.StatementClassifier;
import com.sqlguard.model.BackendMode;
import com.sqlguard.model.QueryResultSet;
import com.sqlguard.model.ScalarValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Catalog tools: {@code list_tables}, {@code describe_table} and {@code slow_queries}.
 *
 * <p>The statements are fixed, but they are still classified once at construction so that the
 * executor keeps a single, classified entry point.
 */
@Slf4j
@Service
public class CatalogToolService {

    static final String LIST_TABLES_SQL = "SELECT schemaname || '.' || relname AS table_name, n_live_tup AS row_count "
            + "FROM pg_stat_user_tables "
            + "ORDER BY n_live_tup DESC";

    static final String DESCRIBE_TABLE_SQL = "SELECT column_name, data_type, is_nullable, column_default "
            + "FROM information_schema.columns "
            + "WHERE table_name = ? "
            + "ORDER BY ordinal_position";

    static final String SLOW_QUERIES_SQL = "SELECT pid, now() - pg_stat_activity.query_start AS duration, state, query "
            + "FROM pg_stat_activity "
            + "WHERE state != 'idle' "
            + "AND now() - pg_stat_activity.query_start > interval '5 seconds' "
            + "ORDER BY duration DESC";

    static final String NO_SLOW_QUERIES = "No slow queries detected (threshold: 5 seconds).";
    static final String SLOW_QUERIES_HEADER = "Slow Queries (running > 5s)";

    private static final int QUERY_PREVIEW_CHARS = 100;

    private final BackendContext backendContext;
    private final DemoDataset demoDataset;
    private final DatabaseSettings databaseSettings;

    private final Classification.Accepted listTables;
    private final Classification.Accepted describeTable;
    private final Classification.Accepted slowQueries;

    public CatalogToolService(
            StatementClassifier statementClassifier,
            BackendContext backendContext,
            DemoDataset demoDataset,
            DatabaseSettings databaseSettings
    ) {
        this.backendContext = backendContext;
        this.demoDataset = demoDataset;
        this.databaseSettings = databaseSettings;
        this.listTables = accept(statementClassifier, LIST_TABLES_SQL);
        this.describeTable = accept(statementClassifier, DESCRIBE_TABLE_SQL);
        this.slowQueries = accept(statementClassifier, SLOW_QUERIES_SQL);
    }

    public ToolOutput listTables() {
        BackendMode mode = backendContext.getMode();
        if (mode == BackendMode.DEMO) {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%-25s %-12s %-10s", "TABLE", "ROWS", "COLUMNS")).append('\n');
            sb.append("-".repeat(47));
            for (DemoDataset.DemoTable table : demoDataset.getTables()) {
                sb.append('\n').append(String.format("%-25s %-12d %-10d", table.name(), table.rowCount(), table.columns().size()));
            }
            return ToolOutput.text(mode, sb.toString());
        }

        try {
            QueryResultSet rs = executor().execute(listTables);
            if (rs.getRows().isEmpty()) {
                return ToolOutput.text(mode, "No tables found.");
            }
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%-40s %-12s", "TABLE", "ROWS")).append('\n');
            sb.append("-".repeat(52));
            for (List<ScalarValue> row : rs.getRows()) {
                sb.append('\n').append(String.format("%-40s %-12s", row.get(0).asText(), row.get(1).asText()));
            }
            appendTruncationNote(sb, rs);
            return ToolOutput.text(mode, sb.toString());
        } catch (SQLException e) {
            return failure(mode, "Error listing tables: ", e);
        }
    }

    /**
     * @param tableName table to describe; bound as a parameter, never concatenated
     */
    public ToolOutput describeTable(String tableName) {
        BackendMode mode = backendContext.getMode();
        if (mode == BackendMode.DEMO) {
            return demoDataset.findTable(tableName)
                    .map(table -> ToolOutput.text(mode, renderDemoTable(table)))
                    .orElseGet(() -> ToolOutput.text(mode, "Table '" + tableName + "' not found. Available tables: "
                            + demoDataset.getTables().stream().map(DemoDataset.DemoTable::name).collect(Collectors.joining(", "))));
        }

        try {
            QueryResultSet rs = executor().execute(describeTable, List.of(tableName));
            if (rs.getRows().isEmpty()) {
                return ToolOutput.text(mode, "Table '" + tableName + "' not found.");
            }
            StringBuilder sb = new StringBuilder();
            sb.append("Table: ").append(tableName).append("\n\n");
            sb.append(String.format("%-30s %-25s %-10s %-30s", "COLUMN", "TYPE", "NULLABLE", "DEFAULT")).append('\n');
            sb.append("-".repeat(95));
            for (List<ScalarValue> row : rs.getRows()) {
                sb.append('\n').append(String.format("%-30s %-25s %-10s %-30s",
                        row.get(0).asText(), row.get(1).asText(), row.get(2).asText(), row.get(3).asText()));
            }
            appendTruncationNote(sb, rs);
            return ToolOutput.text(mode, sb.toString());
        } catch (SQLException e) {
            return failure(mode, "Error describing table: ", e);
        }
    }

    public ToolOutput slowQueries() {
        BackendMode mode = backendContext.getMode();
        if (mode == BackendMode.DEMO) {
            StringBuilder sb = new StringBuilder(SLOW_QUERIES_HEADER).append('\n');
            for (DemoDataset.SlowQuery q : demoDataset.getSlowQueries()) {
                appendSlowQuery(sb, String.valueOf(q.pid()), q.duration(), q.state(), q.query());
            }
            return ToolOutput.text(mode, sb.toString().stripTrailing());
        }

        try {
            QueryResultSet rs = executor().execute(slowQueries);
            if (rs.getRows().isEmpty()) {
                return ToolOutput.text(mode, NO_SLOW_QUERIES);
            }
            StringBuilder sb = new StringBuilder(SLOW_QUERIES_HEADER).append('\n');
            for (List<ScalarValue> row : rs.getRows()) {
                appendSlowQuery(sb, row.get(0).asText(), row.get(1).asText(), row.get(2).asText(), row.get(3).asText());
            }
            appendTruncationNote(sb, rs);
            return ToolOutput.text(mode, sb.toString().stripTrailing());
        } catch (SQLException e) {
            return failure(mode, "Error checking slow queries: ", e);
        }
    }

    private ReadOnlySessionExecutor executor() {
        return backendContext.getExecutor()
                .orElseThrow(() -> new IllegalStateException("Live mode without an executor"));
    }

    private ToolOutput failure(BackendMode mode, String prefix, SQLException e) {
        log.warn("{}(SQLState: {}, Error Code: {}) {}", prefix, e.getSQLState(), e.getErrorCode(), e.getMessage());
        return ToolOutput.error(mode, prefix + BackendErrors.describe(e, databaseSettings));
    }

    private static String renderDemoTable(DemoDataset.DemoTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append("Table: ").append(table.name()).append(" (").append(table.rowCount()).append(" rows)\n\n");
        sb.append(String.format("%-20s %-25s %-10s %-30s", "COLUMN", "TYPE", "NULLABLE", "DEFAULT")).append('\n');
        sb.append("-".repeat(85));
        for (DemoDataset.DemoColumn col : table.columns()) {
            sb.append('\n').append(String.format("%-20s %-25s %-10s %-30s",
                    col.name(), col.type(), col.nullable() ? "YES" : "NO", col.defaultValue() != null ? col.defaultValue() : ""));
        }
        return sb.toString();
    }

    private static void appendSlowQuery(StringBuilder sb, String pid, String duration, String state, String query) {
        String preview = query.length() <= QUERY_PREVIEW_CHARS ? query : query.substring(0, QUERY_PREVIEW_CHARS);
        sb.append('\n');
        sb.append("PID: ").append(pid).append(" | Duration: ").append(duration).append(" | State: ").append(state).append('\n');
        sb.append("  Query: ").append(preview).append("...\n");
    }

    private static void appendTruncationNote(StringBuilder sb, QueryResultSet rs) {
        if (rs.isTruncated()) {
            sb.append("\n... (").append(rs.getRowCount() - rs.getRows().size()).append(" more rows not shown)");
        }
    }

    private static Classification.Accepted accept(StatementClassifier classifier, String sql) {
        Classification classification = classifier.classify(sql);
        if (classification instanceof Classification.Accepted accepted) {
            return accepted;
        }
        throw new IllegalStateException("Catalog statement refused by classifier: " + classification);
    }
}
