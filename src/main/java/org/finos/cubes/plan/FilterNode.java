package org.finos.cubes.plan;

import java.util.List;
import java.util.Objects;

/**
 * Keeps the rows of the source that satisfy a condition; the WHERE clause.
 *
 * @param source    The source relation
 * @param condition The condition, usually the conjunction of cut predicates
 */
public record FilterNode(
        RelationNode source,
        Expression condition) implements RelationNode {

    public FilterNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(condition, "Condition cannot be null");
    }

    /**
     * Filters by all conditions, or returns the source unchanged when there
     * are none.
     */
    public static RelationNode where(RelationNode source, List<Expression> conditions) {
        Objects.requireNonNull(conditions, "Conditions cannot be null");
        return conditions.isEmpty() ? source : new FilterNode(source, Conjunction.allOf(conditions));
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "FilterNode(" + condition + " <- " + source + ")";
    }
}
