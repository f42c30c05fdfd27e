package com.sqlguard.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * Keeps pooled connections alive for statement-level failures.
 *
 * <p>Refused writes (25006) and SQLSTATE classes 42, 22 and 0A are statement errors; the
 * connection stays in the pool.
 */
public class ReadOnlySqlExceptionOverride implements SQLExceptionOverride {

    static final String READ_ONLY_SQL_TRANSACTION = "25006";

    private static final Set<String> NON_FATAL_CLASSES = Set.of("42", "22", "0A");

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null || sqlState.length() < 2) {
            return Override.CONTINUE_EVICT;
        }
        if (READ_ONLY_SQL_TRANSACTION.equals(sqlState) || NON_FATAL_CLASSES.contains(sqlState.substring(0, 2))) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
