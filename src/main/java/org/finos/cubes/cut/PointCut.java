package org.finos.cubes.cut;

import org.finos.cubes.model.Path;

import java.util.Objects;
import java.util.Optional;

/**
 * Cut by a point within a dimension hierarchy.
 *
 * Example: {@code point("date", 2023, Path.ALL)} selects all months of 2023.
 *
 * @param dimension The dimension name
 * @param hierarchy Optional hierarchy name; the dimension's default hierarchy when null
 * @param path      The point, top level first
 */
public record PointCut(
        String dimension,
        String hierarchy,
        Path path) implements Cut {

    public PointCut {
        Objects.requireNonNull(dimension, "Dimension cannot be null");
        Objects.requireNonNull(path, "Path cannot be null");
    }

    public Optional<String> hierarchyName() {
        return Optional.ofNullable(hierarchy);
    }

    @Override
    public <T> T accept(CutVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "PointCut(" + dimension + (hierarchy != null ? "@" + hierarchy : "") + " " + path + ")";
    }
}
