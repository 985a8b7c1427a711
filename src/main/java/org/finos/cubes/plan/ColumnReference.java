package org.finos.cubes.plan;

import java.util.Objects;

/**
 * Represents a reference to a column of the fact source or of a derived table.
 *
 * Column names are physical names after mapping and may contain dots
 * (e.g., "date.year"); they are always quoted as a single identifier.
 *
 * @param columnName The column name
 */
public record ColumnReference(String columnName) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(columnName, "Column name cannot be null");
        if (columnName.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static ColumnReference of(String columnName) {
        return new ColumnReference(columnName);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return columnName;
    }
}
