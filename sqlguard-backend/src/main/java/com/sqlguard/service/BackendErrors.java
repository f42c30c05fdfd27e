package com.sqlguard.service;

import com.sqlguard.config.DatabaseSettings;

import java.sql.SQLException;

/**
 * Renders backend failures for the caller, verbatim or redacted to the SQLSTATE.
 */
final class BackendErrors {

    private BackendErrors() {
    }

    static String describe(SQLException e, DatabaseSettings settings) {
        if (settings.redactBackendErrors()) {
            String state = e.getSQLState() != null ? e.getSQLState() : "unknown";
            return "database error (SQLSTATE " + state + ")";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
