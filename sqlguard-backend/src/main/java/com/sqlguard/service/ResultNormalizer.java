package com.sqlguard.service;

import com.sqlguard.model.QueryResultSet;
import com.sqlguard.model.ScalarValue;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.StringJoiner;

/**
 * Converts JDBC driver values into {@link ScalarValue}s and caps row count.
 *
 * <p>Numbers, booleans and nulls pass through; every other type becomes its canonical text.
 * Only the first {@link QueryResultSet#MAX_ROWS} rows are kept, in backend order, while the full
 * count is still reported.
 */
@Component
public class ResultNormalizer {

    private static final int MAX_NESTED_DEPTH = 3;
    private static final String PG_OBJECT_CLASS = "org.postgresql.util.PGobject";

    /**
     * Normalize an already materialized result.
     *
     * @param columns column names in projection order
     * @param rawRows rows of backend values
     * @return bounded result
     * @throws SQLException if a LOB value cannot be read
     */
    public QueryResultSet normalize(List<String> columns, List<? extends List<?>> rawRows) throws SQLException {
        QueryResultSet.QueryResultSetBuilder out = QueryResultSet.builder().columns(columns);
        int kept = 0;
        for (List<?> raw : rawRows) {
            if (kept >= QueryResultSet.MAX_ROWS) {
                break;
            }
            List<ScalarValue> row = new ArrayList<>(raw.size());
            for (Object v : raw) {
                row.add(normalizeValue(v));
            }
            out.row(row);
            kept++;
        }
        return out.rowCount(rawRows.size())
                .truncated(rawRows.size() > QueryResultSet.MAX_ROWS)
                .build();
    }

    /**
     * Drain a JDBC result set. Rows past the cap are counted but not converted.
     *
     * @param rs open result set, positioned before the first row
     * @return bounded result
     * @throws SQLException on JDBC errors
     */
    public QueryResultSet normalize(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        QueryResultSet.QueryResultSetBuilder out = QueryResultSet.builder();
        for (int i = 1; i <= columnCount; i++) {
            out.column(rsmd.getColumnLabel(i));
        }

        long count = 0;
        while (rs.next()) {
            if (count < QueryResultSet.MAX_ROWS) {
                List<ScalarValue> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    row.add(normalizeValue(rs.getObject(i)));
                }
                out.row(row);
            }
            count++;
        }

        return out.rowCount(count)
                .truncated(count > QueryResultSet.MAX_ROWS)
                .build();
    }

    /**
     * Convert one backend value.
     *
     * @param v value as returned by the driver
     * @return normalized scalar
     * @throws SQLException if a LOB or array cannot be read
     * @throws UnrepresentableValueException if the value has no canonical text form
     */
    public ScalarValue normalizeValue(Object v) throws SQLException {
        return toScalar(v, 0);
    }

    private ScalarValue toScalar(Object v, int depth) throws SQLException {
        if (v == null) {
            return ScalarValue.ofNull();
        }
        if (v instanceof Boolean b) {
            return ScalarValue.of(b);
        }
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ScalarValue.of(((Number) v).longValue());
        }
        if (v instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? ScalarValue.of(big.longValue()) : ScalarValue.of(big.toString());
        }
        if (v instanceof Double || v instanceof Float) {
            return ScalarValue.of(((Number) v).doubleValue());
        }
        return ScalarValue.of(toText(v, depth));
    }

    private String toText(Object v, int depth) throws SQLException {
        if (depth > MAX_NESTED_DEPTH) {
            throw new UnrepresentableValueException(v.getClass().getName() + " (nested deeper than " + MAX_NESTED_DEPTH + ")");
        }
        if (v instanceof String s) {
            return s;
        }
        if (v instanceof BigDecimal dec) {
            return dec.toPlainString();
        }
        if (PG_OBJECT_CLASS.equals(v.getClass().getName())) {
            return readPgObject(v);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            return renderArray(arr.getArray(), depth);
        }
        if (v instanceof Object[] elements) {
            return renderArray(elements, depth);
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            StringJoiner joiner = new StringJoiner(",", "(", ")");
            for (Object attr : attrs != null ? attrs : new Object[0]) {
                joiner.add(attr == null ? "" : toText(attr, depth + 1));
            }
            return joiner.toString();
        }
        if (v instanceof Ref || v instanceof ResultSet) {
            throw new UnrepresentableValueException(v.getClass().getName());
        }
        // Dates, times, UUIDs, intervals and other driver types all render through toString().
        if (!overridesToString(v.getClass())) {
            throw new UnrepresentableValueException(v.getClass().getName());
        }
        return String.valueOf(v);
    }

    private String renderArray(Object arrayValue, int depth) throws SQLException {
        if (!(arrayValue instanceof Object[] elements)) {
            throw new UnrepresentableValueException(arrayValue == null ? "null array" : arrayValue.getClass().getName());
        }
        StringJoiner joiner = new StringJoiner(",", "{", "}");
        for (Object elem : elements) {
            if (elem == null) {
                joiner.add("NULL");
            } else if (elem instanceof Object[] || elem instanceof java.sql.Array) {
                joiner.add(toScalar(elem, depth + 1).asText());
            } else {
                joiner.add(quoteArrayElement(toScalar(elem, depth + 1).asText()));
            }
        }
        return joiner.toString();
    }

    /**
     * Quote an array element the way PostgreSQL's array output does: when it is empty, spells
     * NULL, or holds a delimiter, brace, quote, backslash or whitespace.
     */
    static String quoteArrayElement(String text) {
        boolean quote = text.isEmpty() || text.equalsIgnoreCase("NULL");
        for (int i = 0; i < text.length() && !quote; i++) {
            char c = text.charAt(i);
            quote = c == ',' || c == '{' || c == '}' || c == '"' || c == '\\' || Character.isWhitespace(c);
        }
        if (!quote) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    private String readPgObject(Object v) {
        try {
            Method getValue = v.getClass().getMethod("getValue");
            Object value = getValue.invoke(v);
            return value != null ? value.toString() : "";
        } catch (ReflectiveOperationException e) {
            throw new UnrepresentableValueException(PG_OBJECT_CLASS);
        }
    }

    private String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        if (length <= 0) {
            return "";
        }
        if (length > Integer.MAX_VALUE) {
            throw new UnrepresentableValueException("Clob of " + length + " characters");
        }
        return clob.getSubString(1, (int) length);
    }

    private String readBlobBase64(Blob blob) throws SQLException {
        long length = blob.length();
        if (length <= 0) {
            return "";
        }
        if (length > Integer.MAX_VALUE) {
            throw new UnrepresentableValueException("Blob of " + length + " bytes");
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) length));
    }

    private static boolean overridesToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
