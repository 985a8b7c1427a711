package org.finos.cubes.plan;

/**
 * Visitor over relation nodes. Cube plans are chains that read the fact
 * source, filter it by the slice's cuts, then project or group, sort and page.
 *
 * @param <T> The return type of the visitor methods
 */
public interface RelationNodeVisitor<T> {

    /** The fact source. */
    T visit(TableNode table);

    T visit(FilterNode filter);

    /** Fact attributes, or the summary aggregates of a slice. */
    T visit(ProjectNode project);

    /** Drill-down rows and dimension members. */
    T visit(GroupByNode groupBy);

    T visit(SortNode sort);

    /** Pages and rank limits. */
    T visit(LimitNode limit);
}
