package org.finos.cubes.plan;

import java.util.List;
import java.util.Objects;

/**
 * Orders the source rows; the ORDER BY clause.
 *
 * Columns refer to output fields: generated names such as {@code amount_sum}
 * or logical attribute names such as {@code date.month}.
 *
 * @param source  The source relation
 * @param columns Sort keys, most significant first
 */
public record SortNode(
        RelationNode source,
        List<SortColumn> columns) implements RelationNode {

    public SortNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Sort needs at least one column");
        }
        columns = List.copyOf(columns);
    }

    /**
     * Sorts by a single field.
     */
    public static SortNode by(RelationNode source, String field, SortDirection direction) {
        return new SortNode(source, List.of(new SortColumn(ColumnReference.of(field), direction)));
    }

    public record SortColumn(Expression column, SortDirection direction) {
        public SortColumn {
            Objects.requireNonNull(column, "Column cannot be null");
            Objects.requireNonNull(direction, "Direction cannot be null");
        }

        public static SortColumn asc(Expression column) {
            return new SortColumn(column, SortDirection.ASC);
        }

        public static SortColumn desc(Expression column) {
            return new SortColumn(column, SortDirection.DESC);
        }
    }

    public enum SortDirection {
        ASC, DESC
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "SortNode(" + columns + " <- " + source + ")";
    }
}
