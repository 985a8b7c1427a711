package org.finos.cubes.plan;

/**
 * Sealed interface representing nodes in the relational query tree.
 * This is the intermediate representation a compiled cube query takes before
 * it is rendered for a particular database.
 *
 * The hierarchy models the operations a cube query needs:
 * - TableNode: fact source scan (FROM clause)
 * - FilterNode: row filtering (WHERE clause)
 * - ProjectNode: column projection, possibly aggregated (SELECT clause)
 * - GroupByNode: grouped aggregation (GROUP BY clause)
 * - SortNode: ordering (ORDER BY clause)
 * - LimitNode: pagination and row caps (LIMIT/OFFSET clause)
 */
public sealed interface RelationNode
        permits TableNode, FilterNode, ProjectNode, GroupByNode, SortNode, LimitNode {

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(RelationNodeVisitor<T> visitor);
}
