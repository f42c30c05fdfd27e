package com.sqlguard.service;

import com.sqlguard.api.ToolOutput;
import com.sqlguard.config.DatabaseSettings;
import com.sqlguard.demo.DemoDataset;
import com.sqlguard.guard.Classification;
import com.sqlguard.guard.StatementClassifier;
import com.sqlguard.model.BackendMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

/**
 * The {@code run_query} tool: classify, then execute live or answer from demo data.
 *
 * <p>Classification always runs first and a rejection ends the call; demo mode replaces only the
 * backend, never the checks.
 */
@Slf4j
@Service
public class QueryToolService {

    static final String BACKEND_ERROR_PREFIX = "Error executing query: ";

    private static final int AUDIT_EXCERPT_CHARS = 100;

    private final StatementClassifier statementClassifier;
    private final BackendContext backendContext;
    private final DemoDataset demoDataset;
    private final DatabaseSettings databaseSettings;

    public QueryToolService(
            StatementClassifier statementClassifier,
            BackendContext backendContext,
            DemoDataset demoDataset,
            DatabaseSettings databaseSettings
    ) {
        this.statementClassifier = statementClassifier;
        this.backendContext = backendContext;
        this.demoDataset = demoDataset;
        this.databaseSettings = databaseSettings;
    }

    /**
     * Run a caller-supplied statement.
     *
     * @param query statement text from the agent
     * @return tool output for the caller
     * @throws UnrepresentableValueException if the backend returned a value that cannot be normalized
     */
    public ToolOutput runQuery(String query) {
        BackendMode mode = backendContext.getMode();
        Classification classification = statementClassifier.classify(query);

        if (classification instanceof Classification.Rejected rejected) {
            log.warn("BLOCKED query ({}): {}", rejected.getReason(), excerpt(query));
            return ToolOutput.rejected(mode, rejected);
        }

        Classification.Accepted accepted = (Classification.Accepted) classification;
        if (mode == BackendMode.DEMO) {
            return ToolOutput.result(mode, demoDataset.answer(accepted));
        }

        ReadOnlySessionExecutor executor = backendContext.getExecutor()
                .orElseThrow(() -> new IllegalStateException("Live mode without an executor"));
        try {
            return ToolOutput.result(mode, executor.execute(accepted));
        } catch (SQLException e) {
            log.warn("Query failed (SQLState: {}, Error Code: {}): {}", e.getSQLState(), e.getErrorCode(), e.getMessage());
            return ToolOutput.error(mode, BACKEND_ERROR_PREFIX + BackendErrors.describe(e, databaseSettings));
        }
    }

    private static String excerpt(String query) {
        if (query == null) {
            return "";
        }
        return query.length() <= AUDIT_EXCERPT_CHARS ? query : query.substring(0, AUDIT_EXCERPT_CHARS);
    }
}
