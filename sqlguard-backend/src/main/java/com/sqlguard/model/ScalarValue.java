package com.sqlguard.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

/**
 * A normalized cell value. Backend-native types never cross the boundary; every value is one
 * of the kinds below and serializes as the plain JSON scalar it holds.
 */
@EqualsAndHashCode
@ToString
public final class ScalarValue {

    public enum Kind {
        NULL,
        BOOLEAN,
        INTEGER,
        FLOAT,
        TEXT
    }

    private static final ScalarValue NULL = new ScalarValue(Kind.NULL, null);
    private static final ScalarValue TRUE = new ScalarValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final ScalarValue FALSE = new ScalarValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private ScalarValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ScalarValue ofNull() {
        return NULL;
    }

    public static ScalarValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ScalarValue of(long value) {
        return new ScalarValue(Kind.INTEGER, value);
    }

    /**
     * Non-finite doubles have no JSON number form and are kept as text.
     */
    public static ScalarValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return new ScalarValue(Kind.TEXT, Double.toString(value));
        }
        return new ScalarValue(Kind.FLOAT, value);
    }

    public static ScalarValue of(String value) {
        return value == null ? NULL : new ScalarValue(Kind.TEXT, value);
    }

    public Kind getKind() {
        return kind;
    }

    @JsonValue
    public Object getValue() {
        return value;
    }

    public String asText() {
        return Objects.toString(value, "");
    }
}
