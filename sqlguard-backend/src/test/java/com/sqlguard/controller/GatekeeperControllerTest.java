package com.sqlguard.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultMatcher;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "sqlguard.database.url=")
@AutoConfigureMockMvc
class GatekeeperControllerTest {

    @Autowired
    MockMvc mockMvc;

    private void runQuery(String body, ResultMatcher... matchers) throws Exception {
        mockMvc.perform(post("/v1/tools/run_query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpectAll(matchers);
    }

    @Test
    void statusReportsDemoMode() throws Exception {
        mockMvc.perform(get("/v1/status").header("X-Request-Id", "trace-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-1"))
                .andExpect(jsonPath("$.mode").value("demo"))
                .andExpect(jsonPath("$.max_rows").value(100))
                .andExpect(jsonPath("$.trace_id").value("trace-1"));
    }

    @Test
    void acceptedQueryReturnsSyntheticOrders() throws Exception {
        runQuery("{\"query\": \"SELECT id FROM orders WHERE status = 'pending'\"}",
                status().isOk(),
                jsonPath("$.status").value("ok"),
                jsonPath("$.mode").value("demo"),
                jsonPath("$.result.columns[0]").value("id"),
                jsonPath("$.result.rows.length()").value(5),
                jsonPath("$.result.rows[0][0]").value(48921),
                jsonPath("$.result.rows[0][2]").value(129.99),
                jsonPath("$.result.row_count").value(5),
                jsonPath("$.result.truncated").value(false));
    }

    @Test
    void rejectedQueryIsAToolOutcomeNotAnHttpError() throws Exception {
        runQuery("{\"query\": \"DROP TABLE orders\"}",
                status().isOk(),
                jsonPath("$.status").value("rejected"),
                jsonPath("$.reason_code").value("NOT_READ_ONLY_PREFIX"),
                jsonPath("$.text").value(startsWith("BLOCKED [NOT_READ_ONLY_PREFIX]: ")),
                jsonPath("$.result").doesNotExist());
    }

    @Test
    void stackedStatementReportsForbiddenKeyword() throws Exception {
        runQuery("{\"query\": \"SELECT * FROM orders; DELETE FROM orders\"}",
                status().isOk(),
                jsonPath("$.status").value("rejected"),
                jsonPath("$.reason_code").value("FORBIDDEN_KEYWORD"),
                jsonPath("$.fragment").value("DELETE"));
    }

    @Test
    void blankQueryIsRejectedAtPrefix() throws Exception {
        runQuery("{\"query\": \"   \"}",
                status().isOk(),
                jsonPath("$.reason_code").value("NOT_READ_ONLY_PREFIX"));
    }

    @Test
    void missingQueryIsAValidationError() throws Exception {
        runQuery("{}",
                status().isBadRequest(),
                jsonPath("$.code").value("VALIDATION_FAILED"),
                jsonPath("$.details").value("query: Query is required"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        runQuery("{not json",
                status().isBadRequest(),
                jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void catalogToolsAnswerFromDemoData() throws Exception {
        mockMvc.perform(get("/v1/tools/list_tables"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.text").value(startsWith("TABLE")));

        mockMvc.perform(get("/v1/tools/describe_table").param("table_name", "payments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value(startsWith("Table: payments")));

        mockMvc.perform(get("/v1/tools/slow_queries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value(startsWith("Slow Queries")));
    }

    @Test
    void describeTableRequiresANonBlankName() throws Exception {
        mockMvc.perform(get("/v1/tools/describe_table").param("table_name", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/v1/tools/describe_table"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }
}
