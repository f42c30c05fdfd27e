package com.sqlguard.demo;

import com.sqlguard.guard.Classification;
import com.sqlguard.model.QueryResultSet;
import com.sqlguard.model.ScalarValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed synthetic e-commerce data served in demo mode.
 *
 * <p>The scenario is a payment-gateway outage: recent orders stuck pending or failed, failed
 * payments with gateway timeouts, and two long-running queries.
 */
@Component
public class DemoDataset {

    public static final String SYNTHETIC_INFO = "Demo mode: synthetic results. Query was parsed and validated as safe.";
    public static final long ORDER_COUNT = 48921;

    private static final String GATEWAY_TIMEOUT = "Payment gateway timeout - service unavailable";

    /** Column definition of a demo table. */
    public record DemoColumn(String name, String type, boolean nullable, String defaultValue) {
    }

    /** Demo table with its estimated live row count. */
    public record DemoTable(String name, List<DemoColumn> columns, long rowCount) {
    }

    /** A running statement reported by the slow query tool. */
    public record SlowQuery(int pid, String duration, String state, String query) {
    }

    private final Map<String, DemoTable> tables = new LinkedHashMap<>();
    private final QueryResultSet recentOrders;
    private final QueryResultSet failedPayments;
    private final QueryResultSet orderCount;
    private final QueryResultSet info;
    private final List<SlowQuery> slowQueries;

    public DemoDataset() {
        addTable("customers", 15234,
                new DemoColumn("id", "integer", false, "nextval('customers_id_seq')"),
                new DemoColumn("email", "varchar(255)", false, null),
                new DemoColumn("name", "varchar(255)", false, null),
                new DemoColumn("phone", "varchar(20)", true, null),
                new DemoColumn("created_at", "timestamp", false, "now()"),
                new DemoColumn("tier", "varchar(20)", false, "'standard'"));
        addTable("orders", 48921,
                new DemoColumn("id", "integer", false, "nextval('orders_id_seq')"),
                new DemoColumn("customer_id", "integer", false, null),
                new DemoColumn("total_amount", "numeric(10,2)", false, null),
                new DemoColumn("status", "varchar(20)", false, "'pending'"),
                new DemoColumn("created_at", "timestamp", false, "now()"),
                new DemoColumn("payment_id", "varchar(50)", true, null));
        addTable("products", 1847,
                new DemoColumn("id", "integer", false, "nextval('products_id_seq')"),
                new DemoColumn("name", "varchar(255)", false, null),
                new DemoColumn("price", "numeric(10,2)", false, null),
                new DemoColumn("stock", "integer", false, "0"),
                new DemoColumn("category", "varchar(100)", true, null));
        addTable("order_items", 127453,
                new DemoColumn("id", "integer", false, "nextval('order_items_id_seq')"),
                new DemoColumn("order_id", "integer", false, null),
                new DemoColumn("product_id", "integer", false, null),
                new DemoColumn("quantity", "integer", false, null),
                new DemoColumn("unit_price", "numeric(10,2)", false, null));
        addTable("payments", 48921,
                new DemoColumn("id", "varchar(50)", false, null),
                new DemoColumn("order_id", "integer", false, null),
                new DemoColumn("amount", "numeric(10,2)", false, null),
                new DemoColumn("status", "varchar(20)", false, "'pending'"),
                new DemoColumn("provider", "varchar(50)", false, "'stripe'"),
                new DemoColumn("created_at", "timestamp", false, "now()"),
                new DemoColumn("error_message", "text", true, null));

        recentOrders = table(List.of("id", "customer_id", "total_amount", "status", "created_at"), List.of(
                row(48921, 1234, 129.99, "pending", "2026-02-14T01:20:00Z"),
                row(48920, 5678, 45.50, "pending", "2026-02-14T01:19:30Z"),
                row(48919, 9012, 234.00, "failed", "2026-02-14T01:18:45Z"),
                row(48918, 3456, 89.99, "failed", "2026-02-14T01:18:00Z"),
                row(48917, 7890, 156.75, "failed", "2026-02-14T01:17:30Z")));

        failedPayments = table(List.of("payment_id", "order_id", "amount", "status", "error_message", "created_at"), List.of(
                row("pay_err_001", 48919, 234.00, "failed", GATEWAY_TIMEOUT, "2026-02-14T01:18:45Z"),
                row("pay_err_002", 48918, 89.99, "failed", GATEWAY_TIMEOUT, "2026-02-14T01:18:00Z"),
                row("pay_err_003", 48917, 156.75, "failed", GATEWAY_TIMEOUT, "2026-02-14T01:17:30Z"),
                row("pay_err_004", 48916, 67.25, "failed", GATEWAY_TIMEOUT, "2026-02-14T01:16:45Z"),
                row("pay_err_005", 48915, 199.99, "failed", GATEWAY_TIMEOUT, "2026-02-14T01:16:00Z")));

        orderCount = table(List.of("count"), List.of(row(ORDER_COUNT)));
        info = table(List.of("info"), List.of(row(SYNTHETIC_INFO)));

        slowQueries = List.of(
                new SlowQuery(1234, "45.2s", "active",
                        "SELECT o.*, c.email FROM orders o JOIN customers c ON o.customer_id = c.id WHERE o.status = 'pending' ORDER BY o.created_at DESC"),
                new SlowQuery(1235, "12.8s", "active",
                        "SELECT COUNT(*), status FROM payments WHERE created_at > NOW() - INTERVAL '1 hour' GROUP BY status"));
    }

    /**
     * Pick the synthetic result for an accepted statement by sniffing its keywords.
     *
     * @param statement accepted statement
     * @return fixed result whose shape loosely matches the statement
     */
    public QueryResultSet answer(Classification.Accepted statement) {
        String q = statement.getStatement().toUpperCase(Locale.ROOT);
        if (q.contains("PAYMENT") && (q.contains("FAIL") || q.contains("ERROR"))) {
            return failedPayments;
        }
        if (q.contains("ORDER")) {
            return recentOrders;
        }
        if (q.contains("COUNT")) {
            return orderCount;
        }
        return info;
    }

    public List<DemoTable> getTables() {
        return List.copyOf(tables.values());
    }

    public Optional<DemoTable> findTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public List<SlowQuery> getSlowQueries() {
        return slowQueries;
    }

    private void addTable(String name, long rowCount, DemoColumn... columns) {
        tables.put(name, new DemoTable(name, List.of(columns), rowCount));
    }

    private static QueryResultSet table(List<String> columns, List<List<ScalarValue>> rows) {
        return QueryResultSet.builder()
                .columns(columns)
                .rows(rows)
                .rowCount(rows.size())
                .truncated(false)
                .build();
    }

    private static List<ScalarValue> row(Object... values) {
        List<ScalarValue> out = new ArrayList<>(values.length);
        for (Object v : values) {
            if (v instanceof Number n && !(v instanceof Double)) {
                out.add(ScalarValue.of(n.longValue()));
            } else if (v instanceof Double d) {
                out.add(ScalarValue.of(d));
            } else {
                out.add(ScalarValue.of((String) v));
            }
        }
        return out;
    }
}
