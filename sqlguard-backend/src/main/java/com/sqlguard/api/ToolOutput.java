package com.sqlguard.api;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.sqlguard.guard.Classification;
import com.sqlguard.model.BackendMode;
import com.sqlguard.model.QueryResultSet;
import lombok.Builder;
import lombok.Data;

import java.util.Locale;

/**
 * What a tool call hands back to the calling agent.
 *
 * <p>Exactly one of {@code text} or {@code result} carries the payload. Rejections and backend
 * failures are distinguishable by {@code status} and by the prefix of {@code text}.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ToolOutput {

    public enum Status {
        OK,
        REJECTED,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private Status status;
    private BackendMode mode;
    private String text;
    private String reasonCode;
    private String fragment;
    private QueryResultSet result;

    public static ToolOutput rejected(BackendMode mode, Classification.Rejected rejected) {
        return ToolOutput.builder()
                .status(Status.REJECTED)
                .mode(mode)
                .text(rejected.getMessage())
                .reasonCode(rejected.getReason().name())
                .fragment(rejected.getFragment())
                .build();
    }

    public static ToolOutput result(BackendMode mode, QueryResultSet result) {
        return ToolOutput.builder()
                .status(Status.OK)
                .mode(mode)
                .result(result)
                .build();
    }

    public static ToolOutput text(BackendMode mode, String text) {
        return ToolOutput.builder()
                .status(Status.OK)
                .mode(mode)
                .text(text)
                .build();
    }

    public static ToolOutput error(BackendMode mode, String text) {
        return ToolOutput.builder()
                .status(Status.ERROR)
                .mode(mode)
                .text(text)
                .build();
    }
}
