package com.sqlguard.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RunQueryRequest {
    // Blank text is a classifier rejection, not a validation error.
    @NotNull(message = "Query is required")
    private String query;
}
