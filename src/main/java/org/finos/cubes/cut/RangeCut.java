package org.finos.cubes.cut;

import java.util.Objects;

/**
 * Cut by an inclusive range of the dimension's key field.
 *
 * The range is not hierarchy aware: it applies to the single key field
 * configured on the dimension.
 *
 * @param dimension The dimension name
 * @param fromKey   Lower bound, inclusive
 * @param toKey     Upper bound, inclusive
 */
public record RangeCut(
        String dimension,
        Object fromKey,
        Object toKey) implements Cut {

    public RangeCut {
        Objects.requireNonNull(dimension, "Dimension cannot be null");
        Objects.requireNonNull(fromKey, "Range start cannot be null");
        Objects.requireNonNull(toKey, "Range end cannot be null");
    }

    @Override
    public <T> T accept(CutVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "RangeCut(" + dimension + " " + fromKey + ".." + toKey + ")";
    }
}
