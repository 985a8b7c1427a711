package org.finos.cubes.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A point in a dimension hierarchy: one value per level, top level first.
 *
 * An entry is either a concrete key value or {@link #ALL}, which leaves that
 * level unconstrained.
 *
 * @param values The path entries; never null, use {@link #ALL} for wildcards
 */
public record Path(List<Object> values) {

    /**
     * Wildcard entry matching every value at its level.
     */
    public static final Object ALL = Wildcard.ALL;

    private enum Wildcard {
        ALL;

        @Override
        public String toString() {
            return "*";
        }
    }

    private static final Path EMPTY = new Path(List.of());

    public Path {
        Objects.requireNonNull(values, "Path values cannot be null");
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("Path values cannot be null, use Path.ALL for a wildcard");
            }
        }
        values = List.copyOf(values);
    }

    public static Path of(Object... values) {
        return new Path(Arrays.asList(values));
    }

    public static Path empty() {
        return EMPTY;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public boolean isWildcard(int index) {
        return values.get(index) == ALL;
    }

    /**
     * Returns a path with one more entry appended.
     */
    public Path append(Object value) {
        List<Object> extended = new ArrayList<>(values);
        extended.add(value);
        return new Path(extended);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
