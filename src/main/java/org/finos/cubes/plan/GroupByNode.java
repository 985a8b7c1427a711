package org.finos.cubes.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a GROUP BY operation in the logical plan.
 * Produces one row per distinct combination of the grouping columns.
 *
 * Example, drilling a sales cube down to months:
 *
 * <pre>
 * SELECT SUM("amount") AS "amount_sum", COUNT(*) AS "record_count", "date.month" AS "date.month"
 * FROM "ft_sales" AS "v" GROUP BY "date.month"
 * </pre>
 *
 * @param source          The source relation
 * @param groupingColumns The grouping expressions
 * @param projections     Grouping column and aggregate projections
 */
public record GroupByNode(
        RelationNode source,
        List<Expression> groupingColumns,
        List<Projection> projections) implements RelationNode {

    public GroupByNode {
        Objects.requireNonNull(source, "Source node cannot be null");
        Objects.requireNonNull(groupingColumns, "Grouping columns cannot be null");
        Objects.requireNonNull(projections, "Projections cannot be null");
        if (groupingColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one grouping column is required");
        }
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("At least one projection is required");
        }
        groupingColumns = List.copyOf(groupingColumns);
        projections = List.copyOf(projections);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "GroupByNode(" + groupingColumns + " " + projections + " <- " + source + ")";
    }
}
