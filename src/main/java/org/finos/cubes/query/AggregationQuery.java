package org.finos.cubes.query;

import org.finos.cubes.model.Level;
import org.finos.cubes.plan.RelationNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The plans compiled for one aggregation request.
 *
 * @param measure      The aggregated measure; null for a record count only
 * @param aggregations The selected operators
 * @param summary      The ungrouped grand total plan
 * @param drillPlan    The grouped plan; null without drill-down
 * @param rowLevels    The levels the drill plan groups by
 * @param hasLimit     Whether a rank limit truncates the drill rows
 */
public record AggregationQuery(
        String measure,
        List<Aggregation> aggregations,
        RelationNode summary,
        RelationNode drillPlan,
        List<Level> rowLevels,
        boolean hasLimit) {

    public AggregationQuery {
        Objects.requireNonNull(aggregations, "Aggregations cannot be null");
        Objects.requireNonNull(summary, "Summary plan cannot be null");
        Objects.requireNonNull(rowLevels, "Row levels cannot be null");
        aggregations = List.copyOf(aggregations);
        rowLevels = List.copyOf(rowLevels);
        if (hasLimit && drillPlan == null) {
            throw new IllegalArgumentException("A limit requires a drill plan");
        }
    }

    public Optional<RelationNode> drill() {
        return Optional.ofNullable(drillPlan);
    }

    public boolean isDrillDown() {
        return drillPlan != null;
    }
}
