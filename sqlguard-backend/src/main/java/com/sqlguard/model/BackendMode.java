package com.sqlguard.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Process-wide backend mode, decided once by the startup probe.
 */
public enum BackendMode {
    /** Accepted statements run against the configured database. */
    LIVE,
    /** No database reachable; accepted statements are answered from fixed synthetic data. */
    DEMO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
