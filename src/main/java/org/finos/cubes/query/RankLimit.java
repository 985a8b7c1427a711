package org.finos.cubes.query;

import java.util.Objects;

/**
 * A Top-N style limit applied to drill-down rows.
 *
 * Only {@link Type#RANK} and its {@link Type#TOP_10} preset compile;
 * percent and value limits are recognized and rejected.
 *
 * @param type        The limit kind
 * @param value       Row count for rank limits, threshold for the others; may be null
 * @param sort        Sort name: asc, ascending, bottom, desc, descending or top; null for ascending
 * @param aggregation Aggregation ordering the rows; null for sum
 */
public record RankLimit(
        Type type,
        Number value,
        String sort,
        Aggregation aggregation) {

    public enum Type {
        RANK, TOP_10, PERCENT, VALUE
    }

    public RankLimit {
        Objects.requireNonNull(type, "Limit type cannot be null");
    }

    public static RankLimit rank(int value, String sort) {
        return new RankLimit(Type.RANK, value, sort, null);
    }

    public static RankLimit rank(int value, String sort, Aggregation aggregation) {
        return new RankLimit(Type.RANK, value, sort, aggregation);
    }

    /**
     * The ten largest rows by sum.
     */
    public static RankLimit top10() {
        return new RankLimit(Type.TOP_10, 10, "top", null);
    }

    public static RankLimit percent(double value, String sort) {
        return new RankLimit(Type.PERCENT, value, sort, null);
    }

    public static RankLimit value(double value, String sort) {
        return new RankLimit(Type.VALUE, value, sort, null);
    }
}
