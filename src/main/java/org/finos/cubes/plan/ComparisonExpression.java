package org.finos.cubes.plan;

import java.util.Objects;

/**
 * Represents a comparison expression (e.g., column = 'value').
 *
 * @param left     The left operand
 * @param operator The comparison operator
 * @param right    The right operand, null for IS NULL / IS NOT NULL
 */
public record ComparisonExpression(
        Expression left,
        ComparisonOperator operator,
        Expression right) implements Expression {

    public enum ComparisonOperator {
        EQUALS("="),
        NOT_EQUALS("<>"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">="),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String sql;

        ComparisonOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }

        public boolean isUnary() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    public ComparisonExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        if (operator.isUnary() && right != null) {
            throw new IllegalArgumentException(operator + " takes no right operand");
        }
        if (!operator.isUnary()) {
            Objects.requireNonNull(right, "Right operand cannot be null for " + operator);
        }
    }

    /**
     * Factory for equals comparison.
     */
    public static ComparisonExpression equals(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.EQUALS, right);
    }

    /**
     * Factory for column equals value.
     */
    public static ComparisonExpression columnEquals(String columnName, Object value) {
        return equals(ColumnReference.of(columnName), Literal.of(value));
    }

    public static ComparisonExpression isNotNull(Expression operand) {
        return new ComparisonExpression(operand, ComparisonOperator.IS_NOT_NULL, null);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        if (operator.isUnary()) {
            return left + " " + operator.toSql();
        }
        return left + " " + operator.toSql() + " " + right;
    }
}
