package com.sqlguard.demo;

import com.sqlguard.guard.Classification;
import com.sqlguard.guard.StatementClassifier;
import com.sqlguard.model.QueryResultSet;
import com.sqlguard.model.ScalarValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DemoDatasetTest {

    private final DemoDataset dataset = new DemoDataset();
    private final StatementClassifier classifier = new StatementClassifier();

    private QueryResultSet answer(String sql) {
        return dataset.answer((Classification.Accepted) classifier.classify(sql));
    }

    @Test
    void failedPaymentQueriesGetPaymentErrors() {
        QueryResultSet rs = answer("SELECT * FROM payments WHERE status = 'failed'");

        assertEquals(List.of("payment_id", "order_id", "amount", "status", "error_message", "created_at"), rs.getColumns());
        assertEquals(5, rs.getRowCount());
        assertEquals(ScalarValue.of("pay_err_001"), rs.getRows().get(0).get(0));
    }

    @Test
    void paymentErrorWinsOverOrderSniffing() {
        QueryResultSet rs = answer("SELECT error_message FROM payments ORDER BY created_at");
        assertEquals("payment_id", rs.getColumns().get(0));
    }

    @Test
    void orderQueriesGetRecentOrders() {
        QueryResultSet rs = answer("select id from orders");

        assertEquals(List.of("id", "customer_id", "total_amount", "status", "created_at"), rs.getColumns());
        assertEquals(5, rs.getRows().size());
        assertFalse(rs.isTruncated());
    }

    @Test
    void countQueriesGetTheOrderCount() {
        QueryResultSet rs = answer("SELECT count(*) FROM customers");

        assertEquals(List.of("count"), rs.getColumns());
        assertEquals(List.of(List.of(ScalarValue.of(DemoDataset.ORDER_COUNT))), rs.getRows());
    }

    @Test
    void anythingElseGetsTheSyntheticNotice() {
        QueryResultSet rs = answer("SELECT 1");

        assertEquals(List.of("info"), rs.getColumns());
        assertEquals(ScalarValue.of(DemoDataset.SYNTHETIC_INFO), rs.getRows().get(0).get(0));
        assertEquals(1, rs.getRowCount());
    }

    @Test
    void catalogLookups() {
        assertEquals(5, dataset.getTables().size());
        assertTrue(dataset.findTable("payments").isPresent());
        assertTrue(dataset.findTable("PAYMENTS").isEmpty());
        assertEquals(2, dataset.getSlowQueries().size());
    }
}
