package org.finos.cubes.browser;

import org.finos.cubes.execution.Row;
import org.finos.cubes.query.Aggregation;
import org.finos.cubes.query.CubeQueryCompiler;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated totals of a measure plus the record count.
 *
 * Aggregate values are doubles; a value is null when the store returned
 * NULL, as SUM does over no rows.
 *
 * @param values      Aggregate values by operator
 * @param recordCount Number of fact records
 */
public record Summary(Map<Aggregation, Double> values, long recordCount) {

    public Summary {
        Objects.requireNonNull(values, "Values cannot be null");
        Map<Aggregation, Double> copy = new EnumMap<>(Aggregation.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads a summary from the single row of a summary statement.
     */
    public static Summary fromRow(Row row, String measure, Collection<Aggregation> aggregations) {
        Map<Aggregation, Double> values = new EnumMap<>(Aggregation.class);
        if (measure != null) {
            for (Aggregation aggregation : aggregations) {
                values.put(aggregation, row.getDouble(CubeQueryCompiler.aggregatedFieldName(measure, aggregation)));
            }
        }
        Double count = row.getDouble(CubeQueryCompiler.RECORD_COUNT_FIELD);
        return new Summary(values, count == null ? 0 : count.longValue());
    }

    /**
     * @return The value of an operator; null if not selected or NULL
     */
    public Double value(Aggregation aggregation) {
        return values.get(aggregation);
    }

    public Double sum() {
        return values.get(Aggregation.SUM);
    }
}
