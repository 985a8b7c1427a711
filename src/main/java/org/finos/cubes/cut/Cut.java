package org.finos.cubes.cut;

import org.finos.cubes.model.Path;

import java.util.List;

/**
 * Sealed interface representing a selection predicate over one dimension.
 *
 * - PointCut: a point (or prefix) in a dimension hierarchy
 * - RangeCut: a closed range over the dimension's key field
 * - SetCut: a set of points (recognized, not executable)
 *
 * Cuts refer to their dimension by name and are resolved against the queried
 * cube when compiled.
 */
public sealed interface Cut permits PointCut, RangeCut, SetCut {

    /**
     * @return The name of the dimension this cut applies to
     */
    String dimension();

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this cut
     */
    <T> T accept(CutVisitor<T> visitor);

    static PointCut point(String dimension, Object... path) {
        return new PointCut(dimension, null, Path.of(path));
    }

    static PointCut point(String dimension, Path path) {
        return new PointCut(dimension, null, path);
    }

    static PointCut point(String dimension, String hierarchy, Path path) {
        return new PointCut(dimension, hierarchy, path);
    }

    static RangeCut range(String dimension, Object fromKey, Object toKey) {
        return new RangeCut(dimension, fromKey, toKey);
    }

    static SetCut set(String dimension, List<Path> paths) {
        return new SetCut(dimension, paths);
    }
}
