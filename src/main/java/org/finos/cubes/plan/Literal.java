package org.finos.cubes.plan;

import org.finos.cubes.QueryException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Literal values: strings, numbers, booleans, dates, null.
 *
 * Cut key values arrive as plain objects; {@link #of(Object)} types them.
 */
public record Literal(Object value, Type type) implements Expression {

    public enum Type {
        STRING, INTEGER, DECIMAL, BOOLEAN, DATE, NULL
    }

    public Literal {
        Objects.requireNonNull(type, "Type cannot be null");
        if (type != Type.NULL) {
            Objects.requireNonNull(value, "Value cannot be null for type " + type);
        }
    }

    public static Literal string(String value) {
        return new Literal(value, Type.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, Type.INTEGER);
    }

    public static Literal decimal(BigDecimal value) {
        return new Literal(value, Type.DECIMAL);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, Type.BOOLEAN);
    }

    public static Literal date(LocalDate value) {
        return new Literal(value, Type.DATE);
    }

    public static Literal nil() {
        return new Literal(null, Type.NULL);
    }

    /**
     * Creates a literal from a key value.
     *
     * @throws QueryException if the value has no literal representation
     */
    public static Literal of(Object value) {
        if (value == null) {
            return nil();
        }
        if (value instanceof String s) {
            return string(s);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return integer(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return decimal(new BigDecimal(big));
        }
        if (value instanceof BigDecimal decimal) {
            return decimal(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new QueryException("Cannot use " + value + " as a key value");
            }
            return decimal(BigDecimal.valueOf(d));
        }
        if (value instanceof Boolean b) {
            return bool(b);
        }
        if (value instanceof LocalDate date) {
            return date(date);
        }
        throw new QueryException("Unsupported key value type " + value.getClass().getName() + ": " + value);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return type == Type.STRING ? "'" + value + "'" : String.valueOf(value);
    }
}
