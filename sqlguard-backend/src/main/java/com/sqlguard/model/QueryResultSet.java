package com.sqlguard.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bounded tabular result handed back to the caller.
 *
 * <p>{@code rowCount} is the number of rows the backend produced; {@code rows} holds at most
 * {@link #MAX_ROWS} of them and {@code truncated} is set iff rows were dropped.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryResultSet {

    public static final int MAX_ROWS = 100;

    @Singular
    List<String> columns;
    @Singular
    List<List<ScalarValue>> rows;
    long rowCount;
    boolean truncated;
}
