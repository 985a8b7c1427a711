package org.finos.cubes.plan;

import java.util.Objects;

/**
 * Represents a projected column: an expression and its output name.
 *
 * @param expression The expression to project
 * @param alias      The output column name
 */
public record Projection(
        Expression expression,
        String alias) {

    public Projection {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
    }

    /**
     * Projects a column under its own name.
     */
    public static Projection column(String columnName) {
        return new Projection(ColumnReference.of(columnName), columnName);
    }

    /**
     * Projects a column under another name.
     */
    public static Projection column(String columnName, String alias) {
        return new Projection(ColumnReference.of(columnName), alias);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }
}
