package org.finos.cubes.model;

import org.finos.cubes.QueryException;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of levels within a dimension, defining drill-down order.
 *
 * Levels are resolved against the owning dimension when the dimension is
 * built, so a hierarchy always refers to concrete levels.
 *
 * @param name          The hierarchy name
 * @param label         Human readable label (defaults to the name)
 * @param levels        The resolved levels, top level first
 * @param dimensionName The name of the owning dimension
 */
public record Hierarchy(
        String name,
        String label,
        List<Level> levels,
        String dimensionName) {

    public Hierarchy {
        Objects.requireNonNull(name, "Hierarchy name cannot be null");
        Objects.requireNonNull(levels, "Levels cannot be null");
        Objects.requireNonNull(dimensionName, "Dimension name cannot be null");
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("Hierarchy '" + name + "' must have at least one level");
        }
        levels = List.copyOf(levels);
        if (label == null) {
            label = name;
        }
    }

    /**
     * @return The number of levels in this hierarchy
     */
    public int depth() {
        return levels.size();
    }

    public List<String> levelNames() {
        return levels.stream().map(Level::name).toList();
    }

    /**
     * Returns the levels addressed by a path.
     *
     * Without drill-down these are the first {@code path.size()} levels. With
     * drill-down the next level is included as well, unless the path is
     * already a base path.
     *
     * @param path      The path into this hierarchy
     * @param drillDown Whether to include the level below the path
     * @return The levels, top level first
     * @throws QueryException if the path is longer than the hierarchy
     */
    public List<Level> levelsForPath(Path path, boolean drillDown) {
        checkPath(path);
        int count = drillDown ? Math.min(path.size() + 1, depth()) : path.size();
        return levels.subList(0, count);
    }

    /**
     * Returns true if no further drill-down is possible from the path.
     */
    public boolean pathIsBase(Path path) {
        return path.size() == depth();
    }

    /**
     * Returns the level immediately below the given path.
     *
     * @throws QueryException if the path is a base path or longer than the hierarchy
     */
    public Level nextLevel(Path path) {
        checkPath(path);
        if (pathIsBase(path)) {
            throw new QueryException("Path " + path + " is a base path of hierarchy '" + name
                    + "' in dimension '" + dimensionName + "', there is no next level");
        }
        return levels.get(path.size());
    }

    public Level levelAt(int index) {
        if (index < 0 || index >= depth()) {
            throw new QueryException("No level number " + index + " (count: " + depth()
                    + ") in hierarchy '" + name + "' of dimension '" + dimensionName + "'");
        }
        return levels.get(index);
    }

    private void checkPath(Path path) {
        Objects.requireNonNull(path, "Path cannot be null");
        if (path.size() > depth()) {
            throw new QueryException("Path " + path + " is longer than hierarchy levels "
                    + levelNames() + " of dimension '" + dimensionName + "'");
        }
    }

    @Override
    public String toString() {
        return "Hierarchy(" + dimensionName + "." + name + " " + levelNames() + ")";
    }
}
