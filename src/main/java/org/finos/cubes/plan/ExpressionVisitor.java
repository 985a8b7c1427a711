package org.finos.cubes.plan;

/**
 * Visitor over the expressions a cube plan can hold.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnRef);

    T visitLiteral(Literal literal);

    T visitComparison(ComparisonExpression comparison);

    /**
     * Range cut predicate, bounds included.
     */
    T visitBetween(BetweenExpression between);

    T visitConjunction(Conjunction conjunction);

    /**
     * Measure aggregate or the record count.
     */
    T visitAggregate(AggregateExpression aggregate);
}
