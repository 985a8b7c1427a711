package org.finos.cubes.plan;

import java.util.List;
import java.util.Objects;

/**
 * Two or more conditions that must all hold.
 *
 * The predicates of a slice's cuts are combined into one conjunction, in cut
 * order.
 *
 * @param operands The conditions, at least two
 */
public record Conjunction(List<Expression> operands) implements Expression {

    public Conjunction {
        Objects.requireNonNull(operands, "Operands cannot be null");
        operands = List.copyOf(operands);
        if (operands.size() < 2) {
            throw new IllegalArgumentException("A conjunction needs at least 2 operands, got " + operands.size());
        }
    }

    public static Conjunction and(Expression... expressions) {
        return new Conjunction(List.of(expressions));
    }

    /**
     * Combines conditions with AND; a single condition is returned as is.
     *
     * @throws IllegalArgumentException if there are no conditions
     */
    public static Expression allOf(List<Expression> expressions) {
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("At least one condition is required");
        }
        return expressions.size() == 1 ? expressions.get(0) : new Conjunction(expressions);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConjunction(this);
    }

    @Override
    public String toString() {
        return "(" + String.join(" AND ", operands.stream().map(Object::toString).toList()) + ")";
    }
}
