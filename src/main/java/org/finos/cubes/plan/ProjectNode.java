package org.finos.cubes.plan;

import java.util.List;
import java.util.Objects;

/**
 * Selects aliased expressions from the source without grouping.
 *
 * Over fact rows this lists cube attributes. When every projection is an
 * aggregate it yields the single summary row of a slice.
 *
 * @param source      The source relation
 * @param projections The selected expressions, in output order
 */
public record ProjectNode(
        RelationNode source,
        List<Projection> projections) implements RelationNode {

    public ProjectNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(projections, "Projections cannot be null");
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("Nothing to project from " + source);
        }
        projections = List.copyOf(projections);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "ProjectNode(" + projections + " <- " + source + ")";
    }
}
