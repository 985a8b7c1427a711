package org.finos.cubes.cut;

import org.finos.cubes.model.Path;

import java.util.List;
import java.util.Objects;

/**
 * Cut by a set of dimension points.
 *
 * @param dimension The dimension name
 * @param paths     The selected points
 */
public record SetCut(
        String dimension,
        List<Path> paths) implements Cut {

    public SetCut {
        Objects.requireNonNull(dimension, "Dimension cannot be null");
        Objects.requireNonNull(paths, "Paths cannot be null");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("Set cut needs at least one path");
        }
        paths = List.copyOf(paths);
    }

    @Override
    public <T> T accept(CutVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "SetCut(" + dimension + " " + paths + ")";
    }
}
