package org.finos.cubes.browser;

import org.finos.cubes.execution.DataStore;
import org.finos.cubes.execution.ExecutionContext;
import org.finos.cubes.execution.Row;
import org.finos.cubes.model.Cube;
import org.finos.cubes.model.Path;
import org.finos.cubes.query.Aggregation;
import org.finos.cubes.query.AggregationOptions;
import org.finos.cubes.query.AggregationQuery;
import org.finos.cubes.query.CubeQueryCompiler;
import org.finos.cubes.query.FactQueryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs dimensional queries on one cube.
 *
 * Each request compiles the slice's cuts with a {@link CubeQueryCompiler},
 * executes the plans on the {@link DataStore} and assembles the result.
 * Summaries are cached on the slice; drill rows are always fetched.
 */
public final class AggregationBrowser {

    private static final Logger logger = LoggerFactory.getLogger(AggregationBrowser.class);

    private final Cube cube;
    private final DataStore dataStore;
    private final ExecutionContext context;
    private final CubeQueryCompiler compiler;

    public AggregationBrowser(Cube cube, DataStore dataStore) {
        this(cube, dataStore, ExecutionContext.none());
    }

    public AggregationBrowser(Cube cube, DataStore dataStore, ExecutionContext context) {
        this.cube = Objects.requireNonNull(cube, "Cube cannot be null");
        this.dataStore = Objects.requireNonNull(dataStore, "Data store cannot be null");
        this.context = Objects.requireNonNull(context, "Execution context cannot be null");
        this.compiler = new CubeQueryCompiler(cube);
    }

    public Cube cube() {
        return cube;
    }

    public CubeQueryCompiler compiler() {
        return compiler;
    }

    /**
     * @return A slice without cuts
     */
    public Slice fullCube() {
        return new Slice(this, List.of());
    }

    /**
     * Aggregates a measure over a slice.
     *
     * The summary is taken from the slice's cache when the same measure and
     * aggregations were computed for the current cuts. With a rank limit the
     * result carries the remainder: summary totals minus the totals of the
     * returned rows.
     */
    public AggregationResult aggregate(Slice slice, String measure, AggregationOptions options) {
        checkSlice(slice);
        AggregationQuery query = compiler.compileAggregation(slice.cuts(), measure, options);

        SummaryCache.SummaryKey key = new SummaryCache.SummaryKey(
                slice.cuts(), measure, new LinkedHashSet<>(query.aggregations()));
        Optional<Summary> cached = slice.summaryCache().find(key);
        Summary summary;
        if (cached.isPresent()) {
            logger.debug("Summary cache hit for {} {}", measure, slice);
            summary = cached.get();
        } else {
            logger.debug("Summary cache miss for {} {}", measure, slice);
            List<Row> summaryRows = dataStore.execute(query.summary(), context);
            summary = summaryRows.isEmpty()
                    ? new Summary(Map.of(), 0)
                    : Summary.fromRow(summaryRows.get(0), measure, query.aggregations());
            slice.summaryCache().put(key, summary);
        }

        List<Row> rows = List.of();
        if (query.isDrillDown()) {
            rows = applyComputedFields(dataStore.execute(query.drillPlan(), context), options);
        }

        Summary remainder = query.hasLimit() ? remainder(summary, rows, query) : null;
        return new AggregationResult(measure, summary, rows, remainder, options);
    }

    private static List<Row> applyComputedFields(List<Row> rows, AggregationOptions options) {
        if (options.computedFields().isEmpty()) {
            return rows;
        }
        List<Row> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Row computed = row;
            for (Map.Entry<String, ComputedField> field : options.computedFields().entrySet()) {
                computed = computed.with(field.getKey(), field.getValue().compute(computed));
            }
            result.add(computed);
        }
        return result;
    }

    /**
     * Totals excluded by the limit, for sum, count and the record count.
     */
    private static Summary remainder(Summary summary, List<Row> rows, AggregationQuery query) {
        Map<Aggregation, Double> values = new EnumMap<>(Aggregation.class);
        if (query.measure() != null) {
            for (Aggregation aggregation : query.aggregations()) {
                if (aggregation != Aggregation.SUM && aggregation != Aggregation.COUNT) {
                    continue;
                }
                String field = CubeQueryCompiler.aggregatedFieldName(query.measure(), aggregation);
                double returned = 0;
                for (Row row : rows) {
                    Double value = row.getDouble(field);
                    returned += value == null ? 0 : value;
                }
                Double total = summary.value(aggregation);
                values.put(aggregation, (total == null ? 0 : total) - returned);
            }
        }
        long returnedCount = 0;
        for (Row row : rows) {
            Double count = row.getDouble(CubeQueryCompiler.RECORD_COUNT_FIELD);
            returnedCount += count == null ? 0 : count.longValue();
        }
        return new Summary(values, summary.recordCount() - returnedCount);
    }

    public List<Row> facts(Slice slice, FactQueryOptions options) {
        checkSlice(slice);
        return dataStore.execute(compiler.compileFacts(slice.cuts(), options), context);
    }

    /**
     * Looks up one fact by the cube's key field.
     */
    public Optional<Row> fact(Object id) {
        return first(dataStore.execute(compiler.compileFact(id), context));
    }

    /**
     * Lists the members of a dimension directly below a path, within the slice.
     */
    public List<Row> dimensionValues(Slice slice, String dimension, Path path, FactQueryOptions options) {
        checkSlice(slice);
        return dataStore.execute(compiler.compileDimensionValues(slice.cuts(), dimension, path, options), context);
    }

    /**
     * Returns all level attributes of the dimension member at a path. The
     * slice's cuts do not apply.
     */
    public Optional<Row> dimensionDetail(Slice slice, String dimension, Path path) {
        checkSlice(slice);
        return dimensionDetail(dimension, path);
    }

    public Optional<Row> dimensionDetail(String dimension, Path path) {
        return first(dataStore.execute(compiler.compileDimensionDetail(dimension, path), context));
    }

    private static Optional<Row> first(List<Row> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private void checkSlice(Slice slice) {
        Objects.requireNonNull(slice, "Slice cannot be null");
        if (slice.browser() != this) {
            throw new IllegalArgumentException("Slice " + slice + " belongs to another browser");
        }
    }
}
