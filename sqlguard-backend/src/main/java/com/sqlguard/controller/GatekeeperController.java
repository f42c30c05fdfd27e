package com.sqlguard.controller;

import com.sqlguard.api.RunQueryRequest;
import com.sqlguard.api.StatusResponse;
import com.sqlguard.api.ToolOutput;
import com.sqlguard.model.QueryResultSet;
import com.sqlguard.service.BackendContext;
import com.sqlguard.service.CatalogToolService;
import com.sqlguard.service.QueryToolService;
import com.sqlguard.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1")
public class GatekeeperController {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperController.class);

    private final QueryToolService queryToolService;
    private final CatalogToolService catalogToolService;
    private final BackendContext backendContext;

    public GatekeeperController(
            QueryToolService queryToolService,
            CatalogToolService catalogToolService,
            BackendContext backendContext
    ) {
        this.queryToolService = queryToolService;
        this.catalogToolService = catalogToolService;
        this.backendContext = backendContext;
    }

    /**
     * Run a read-only statement.
     *
     * POST /v1/tools/run_query
     *
     * @param request statement text
     * @return tool output, always HTTP 200
     */
    @PostMapping("/tools/run_query")
    public ResponseEntity<ToolOutput> runQuery(@Valid @RequestBody RunQueryRequest request) {
        ToolOutput output = queryToolService.runQuery(request.getQuery());
        log.info("run_query finished: status={}, trace_id={}", output.getStatus(), MDC.get(TraceIdFilter.MDC_TRACE_ID));
        return ResponseEntity.ok(output);
    }

    /**
     * GET /v1/tools/list_tables
     */
    @GetMapping("/tools/list_tables")
    public ResponseEntity<ToolOutput> listTables() {
        return ResponseEntity.ok(catalogToolService.listTables());
    }

    /**
     * GET /v1/tools/describe_table?table_name=orders
     */
    @GetMapping("/tools/describe_table")
    public ResponseEntity<ToolOutput> describeTable(@RequestParam("table_name") String tableName) {
        if (tableName.isBlank()) {
            throw new IllegalArgumentException("table_name must not be blank");
        }
        return ResponseEntity.ok(catalogToolService.describeTable(tableName.strip()));
    }

    /**
     * GET /v1/tools/slow_queries
     */
    @GetMapping("/tools/slow_queries")
    public ResponseEntity<ToolOutput> slowQueries() {
        return ResponseEntity.ok(catalogToolService.slowQueries());
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(StatusResponse.builder()
                .mode(backendContext.getMode())
                .maxRows(QueryResultSet.MAX_ROWS)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build());
    }
}
