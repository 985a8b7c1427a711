package org.finos.cubes.cut;

/**
 * Visitor interface for handling every kind of cut.
 *
 * @param <T> The return type of the visitor methods
 */
public interface CutVisitor<T> {

    T visit(PointCut cut);

    T visit(RangeCut cut);

    T visit(SetCut cut);
}
