package org.finos.cubes.browser;

import org.finos.cubes.execution.Row;
import org.finos.cubes.query.AggregationOptions;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of an aggregation request.
 *
 * @param measure   The aggregated measure; null for a record count only
 * @param summary   Grand totals of the slice
 * @param rows      Drill-down rows with computed fields; empty without drill-down
 * @param remainder Totals of the rows a rank limit cut off; null without a limit
 * @param options   The options of the request
 */
public record AggregationResult(
        String measure,
        Summary summary,
        List<Row> rows,
        Summary remainder,
        AggregationOptions options) {

    public AggregationResult {
        Objects.requireNonNull(summary, "Summary cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        rows = List.copyOf(rows);
    }

    public Optional<Summary> findRemainder() {
        return Optional.ofNullable(remainder);
    }
}
