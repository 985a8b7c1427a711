package org.finos.cubes.plan;

/**
 * Sealed interface representing expressions in the query plan.
 * Expressions are used in filters, projections, groupings and orderings.
 *
 * Includes:
 * - ColumnReference: reference to a fact source column
 * - Literal: constant value
 * - ComparisonExpression: comparison operators (=, <, >, IS NOT NULL, etc.)
 * - BetweenExpression: inclusive range test
 * - Conjunction: conditions joined with AND
 * - AggregateExpression: SUM, COUNT, AVG, MIN, MAX
 */
public sealed interface Expression
        permits ColumnReference, Literal, ComparisonExpression, BetweenExpression, Conjunction,
        AggregateExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
