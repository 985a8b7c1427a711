package org.finos.cubes.plan;

import java.util.Objects;

/**
 * Represents an aggregate expression for use in summary and GROUP BY queries.
 * Maps to SQL aggregate functions like SUM, COUNT, AVG, MIN, MAX.
 *
 * {@link AggregateFunction#COUNT_ALL} counts rows and takes no argument.
 */
public record AggregateExpression(
        AggregateFunction function,
        Expression argument) implements Expression {

    /**
     * Supported aggregate functions that can be pushed to SQL.
     */
    public enum AggregateFunction {
        SUM("SUM"),
        COUNT("COUNT"),
        AVG("AVG"),
        MIN("MIN"),
        MAX("MAX"),
        COUNT_ALL("COUNT");

        private final String sql;

        AggregateFunction(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        if (function == AggregateFunction.COUNT_ALL) {
            if (argument != null) {
                throw new IllegalArgumentException("COUNT(*) takes no argument");
            }
        } else {
            Objects.requireNonNull(argument, "Aggregate argument cannot be null");
        }
    }

    public static AggregateExpression of(AggregateFunction function, Expression argument) {
        return new AggregateExpression(function, argument);
    }

    public static AggregateExpression countAll() {
        return new AggregateExpression(AggregateFunction.COUNT_ALL, null);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        return function.sql() + "(" + (argument == null ? "*" : argument) + ")";
    }
}
