package org.finos.cubes.query;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.QueryException;
import org.finos.cubes.UnsupportedQueryException;
import org.finos.cubes.cut.Cut;
import org.finos.cubes.cut.CutVisitor;
import org.finos.cubes.cut.PointCut;
import org.finos.cubes.cut.RangeCut;
import org.finos.cubes.cut.SetCut;
import org.finos.cubes.model.Cube;
import org.finos.cubes.model.Dimension;
import org.finos.cubes.model.Hierarchy;
import org.finos.cubes.model.Level;
import org.finos.cubes.model.Path;
import org.finos.cubes.plan.AggregateExpression;
import org.finos.cubes.plan.BetweenExpression;
import org.finos.cubes.plan.ColumnReference;
import org.finos.cubes.plan.ComparisonExpression;
import org.finos.cubes.plan.Expression;
import org.finos.cubes.plan.FilterNode;
import org.finos.cubes.plan.GroupByNode;
import org.finos.cubes.plan.LimitNode;
import org.finos.cubes.plan.Literal;
import org.finos.cubes.plan.ProjectNode;
import org.finos.cubes.plan.Projection;
import org.finos.cubes.plan.RelationNode;
import org.finos.cubes.plan.SortNode;
import org.finos.cubes.plan.SortNode.SortColumn;
import org.finos.cubes.plan.SortNode.SortDirection;
import org.finos.cubes.plan.TableNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles dimensional requests against one cube into relational plans.
 *
 * Cuts are resolved against the cube at compile time: a point cut uses its
 * hierarchy override or the dimension's default hierarchy and constrains the
 * key attribute of every level with a concrete path value; a range cut
 * constrains the dimension's key field. All predicates are conjoined in cut
 * order.
 *
 * Dimension attributes are selected under their logical name
 * ({@code date.year}); aggregates as {@code <measure>_<operator>} plus
 * {@code record_count}.
 *
 * The compiler is stateless and deterministic. Rendering to SQL is left to
 * {@link org.finos.cubes.transpiler.SQLGenerator}.
 */
public final class CubeQueryCompiler {

    public static final String RECORD_COUNT_FIELD = "record_count";

    private final Cube cube;

    public CubeQueryCompiler(Cube cube) {
        this.cube = Objects.requireNonNull(cube, "Cube cannot be null");
    }

    public Cube cube() {
        return cube;
    }

    /**
     * @return The generated field name of an aggregated measure, e.g. {@code amount_sum}
     */
    public static String aggregatedFieldName(String field, Aggregation aggregation) {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(aggregation, "Aggregation cannot be null");
        return field + "_" + aggregation.operatorName();
    }

    /**
     * @throws ConfigurationException if the operator is not sum, count, average, min or max
     */
    public static String aggregatedFieldName(String field, String operatorName) {
        return aggregatedFieldName(field, Aggregation.fromName(operatorName));
    }

    // ==================== Predicates ====================

    /**
     * Compiles the predicates of all cuts, in cut order.
     *
     * @return The predicates; empty when the cuts constrain nothing
     */
    public List<Expression> predicates(List<Cut> cuts) {
        List<Expression> predicates = new ArrayList<>();
        CutCompiler cutCompiler = new CutCompiler();
        for (Cut cut : cuts) {
            predicates.addAll(cut.accept(cutCompiler));
        }
        return predicates;
    }

    private final class CutCompiler implements CutVisitor<List<Expression>> {

        @Override
        public List<Expression> visit(PointCut cut) {
            Dimension dimension = cube.dimension(cut.dimension());
            Hierarchy hierarchy = cut.hierarchyName()
                    .map(dimension::hierarchy)
                    .orElseGet(dimension::defaultHierarchy);
            return pathPredicates(dimension, hierarchy, cut.path());
        }

        @Override
        public List<Expression> visit(RangeCut cut) {
            Dimension dimension = cube.dimension(cut.dimension());
            String keyField = dimension.keyField()
                    .orElseThrow(() -> new ConfigurationException("Dimension '" + dimension.name()
                            + "' has no key field, required for range cuts"));
            return List.of(new BetweenExpression(
                    ColumnReference.of(cube.columnFor(dimension.name(), keyField)),
                    Literal.of(cut.fromKey()),
                    Literal.of(cut.toKey())));
        }

        @Override
        public List<Expression> visit(SetCut cut) {
            throw new UnsupportedQueryException("Set cuts are not supported (dimension '" + cut.dimension() + "')");
        }
    }

    private List<Expression> pathPredicates(Dimension dimension, Hierarchy hierarchy, Path path) {
        List<Level> levels = hierarchy.levelsForPath(path, false);
        List<Expression> predicates = new ArrayList<>();
        for (int i = 0; i < levels.size(); i++) {
            if (path.isWildcard(i)) {
                continue;
            }
            String column = cube.columnFor(dimension.name(), levels.get(i).key());
            predicates.add(ComparisonExpression.equals(ColumnReference.of(column), Literal.of(path.get(i))));
        }
        return predicates;
    }

    private RelationNode filtered(List<Expression> predicates) {
        return FilterNode.where(new TableNode(cube.fact()), predicates);
    }

    // ==================== Aggregation ====================

    /**
     * Compiles the summary plan and, for drill-down requests, the drill plan.
     *
     * @param cuts    The slice's cuts
     * @param measure The measure to aggregate; null to count records only
     * @param options Aggregation, drill-down, order, page and limit options
     * @throws QueryException for invalid order, page or limit options
     */
    public AggregationQuery compileAggregation(List<Cut> cuts, String measure, AggregationOptions options) {
        Objects.requireNonNull(cuts, "Cuts cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        List<Aggregation> aggregations = measure == null ? List.of() : List.copyOf(options.aggregations());
        List<Projection> aggregates = new ArrayList<>();
        if (measure != null) {
            ColumnReference measureColumn = ColumnReference.of(cube.measureColumn(measure));
            for (Aggregation aggregation : aggregations) {
                aggregates.add(new Projection(
                        AggregateExpression.of(aggregation.function(), measureColumn),
                        aggregatedFieldName(measure, aggregation)));
            }
        }
        aggregates.add(new Projection(AggregateExpression.countAll(), RECORD_COUNT_FIELD));

        SortDirection direction = orderDirection(options.orderDirection());
        RelationNode source = filtered(predicates(cuts));
        RelationNode summary = new ProjectNode(source, aggregates);

        if (!options.isDrillDown()) {
            if (options.limit() != null) {
                throw new QueryException("A limit requires drill-down (row levels or drill-down dimension)");
            }
            return new AggregationQuery(measure, aggregations, summary, null, List.of(), false);
        }

        if (options.rowDimension() == null) {
            throw new QueryException("Drill-down requires a row dimension");
        }
        Dimension rowDimension = cube.dimension(options.rowDimension());
        List<Level> rowLevels = rowLevels(cuts, rowDimension, options);

        List<Projection> projections = new ArrayList<>(aggregates);
        List<Expression> grouping = new ArrayList<>();
        List<SortColumn> defaultOrder = new ArrayList<>();
        for (String attribute : levelAttributes(rowLevels)) {
            String field = Cube.logicalField(rowDimension.name(), attribute);
            ColumnReference column = ColumnReference.of(cube.columnFor(rowDimension.name(), attribute));
            projections.add(new Projection(column, field));
            grouping.add(column);
            defaultOrder.add(SortColumn.asc(ColumnReference.of(field)));
        }

        RelationNode drill = new GroupByNode(source, grouping, projections);
        drill = options.orderBy() != null
                ? SortNode.by(drill, options.orderBy(), direction)
                : new SortNode(drill, defaultOrder);
        drill = paginate(drill, options.page(), options.pageSize());

        boolean hasLimit = options.limit() != null;
        if (hasLimit) {
            drill = applyLimit(drill, measure, aggregations, options.limit());
        }
        return new AggregationQuery(measure, aggregations, summary, drill, rowLevels, hasLimit);
    }

    private List<Level> rowLevels(List<Cut> cuts, Dimension dimension, AggregationOptions options) {
        if (options.rowLevels() != null) {
            if (options.rowLevels().isEmpty()) {
                throw new QueryException("Row levels of dimension '" + dimension.name() + "' cannot be empty");
            }
            List<Level> levels = new ArrayList<>();
            for (String levelName : options.rowLevels()) {
                levels.add(dimension.level(levelName));
            }
            return levels;
        }

        // Drill one level below the last point cut on the row dimension
        PointCut pointCut = null;
        for (Cut cut : cuts) {
            if (cut instanceof PointCut point && point.dimension().equals(dimension.name())) {
                pointCut = point;
            }
        }
        if (pointCut == null) {
            return dimension.defaultHierarchy().levelsForPath(Path.empty(), true);
        }
        Hierarchy hierarchy = pointCut.hierarchyName()
                .map(dimension::hierarchy)
                .orElseGet(dimension::defaultHierarchy);
        return hierarchy.levelsForPath(pointCut.path(), true);
    }

    private RelationNode applyLimit(RelationNode drill, String measure, List<Aggregation> aggregations,
                                    RankLimit limit) {
        if (limit.type() == RankLimit.Type.PERCENT || limit.type() == RankLimit.Type.VALUE) {
            throw new UnsupportedQueryException(limit.type().name().toLowerCase(Locale.ROOT)
                    + " limits are not supported");
        }
        if (limit.value() == null) {
            throw new QueryException("Limit value for aggregation rank limit not provided");
        }
        int value = rankLimitValue(limit.value());

        Aggregation limitAggregation = limit.aggregation() != null ? limit.aggregation() : Aggregation.SUM;
        if (!aggregations.contains(limitAggregation)) {
            throw new QueryException("Invalid aggregation '" + limitAggregation.operatorName()
                    + "' to limit, selected aggregations are " + aggregations);
        }
        String field = aggregatedFieldName(measure, limitAggregation);
        return LimitNode.limit(
                SortNode.by(drill, field, limitDirection(limit.sort())),
                value);
    }

    private static int rankLimitValue(Number number) {
        BigDecimal value;
        try {
            value = new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new QueryException("Limit value is not a number: " + number, e);
        }
        if (value.signum() < 0) {
            throw new QueryException("Limit value cannot be negative: " + number);
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new QueryException("Limit value must be a whole number up to " + Integer.MAX_VALUE + ": " + number, e);
        }
    }

    // ==================== Listings ====================

    /**
     * Compiles a fact listing: the cube attributes (all columns when none are
     * declared) of the facts matching the cuts.
     */
    public RelationNode compileFacts(List<Cut> cuts, FactQueryOptions options) {
        Objects.requireNonNull(options, "Options cannot be null");
        RelationNode node = factProjection(filtered(predicates(cuts)));
        SortDirection direction = orderDirection(options.orderDirection());
        if (options.orderBy() != null) {
            node = SortNode.by(node, cube.fieldColumn(options.orderBy()), direction);
        }
        return paginate(node, options.page(), options.pageSize());
    }

    /**
     * Compiles the lookup of one fact by the cube's key field.
     */
    public RelationNode compileFact(Object id) {
        Objects.requireNonNull(id, "Fact id cannot be null");
        Expression condition = ComparisonExpression.equals(
                ColumnReference.of(cube.fieldColumn(cube.keyField())), Literal.of(id));
        return LimitNode.limit(factProjection(new FilterNode(new TableNode(cube.fact()), condition)), 1);
    }

    private RelationNode factProjection(RelationNode source) {
        if (cube.attributes().isEmpty()) {
            return source;
        }
        List<Projection> projections = new ArrayList<>();
        for (String attribute : cube.attributes()) {
            projections.add(Projection.column(cube.fieldColumn(attribute), attribute));
        }
        return new ProjectNode(source, projections);
    }

    /**
     * Compiles the distinct members of a dimension below a path, using the
     * dimension's default hierarchy.
     */
    public RelationNode compileDimensionValues(List<Cut> cuts, String dimensionName, Path path,
                                               FactQueryOptions options) {
        Dimension dimension = cube.dimension(dimensionName);
        return compileDimensionValues(cuts, dimension, dimension.defaultHierarchy(), path, options);
    }

    /**
     * Compiles the distinct members of a dimension below a path.
     *
     * Concrete path values are equality predicates, added to the slice's own
     * cut predicates. The attributes of the wildcard levels and of the next
     * level are selected and grouped; rows without a next level key are
     * skipped. Rows are ordered by the next level key unless another order is
     * requested.
     *
     * @throws QueryException if the path is a base path or too long
     */
    public RelationNode compileDimensionValues(List<Cut> cuts, Dimension dimension, Hierarchy hierarchy,
                                               Path path, FactQueryOptions options) {
        Objects.requireNonNull(options, "Options cannot be null");
        Level nextLevel = hierarchy.nextLevel(path);

        List<Expression> predicates = predicates(cuts);
        predicates.addAll(pathPredicates(dimension, hierarchy, path));
        String nextKey = Cube.logicalField(dimension.name(), nextLevel.key());
        predicates.add(ComparisonExpression.isNotNull(
                ColumnReference.of(cube.columnFor(dimension.name(), nextLevel.key()))));

        List<Level> openLevels = new ArrayList<>();
        for (int i = 0; i < path.size(); i++) {
            if (path.isWildcard(i)) {
                openLevels.add(hierarchy.levelAt(i));
            }
        }
        openLevels.add(nextLevel);

        List<Projection> projections = new ArrayList<>();
        List<Expression> grouping = new ArrayList<>();
        for (String attribute : levelAttributes(openLevels)) {
            ColumnReference column = ColumnReference.of(cube.columnFor(dimension.name(), attribute));
            projections.add(new Projection(column, Cube.logicalField(dimension.name(), attribute)));
            grouping.add(column);
        }

        SortDirection direction = orderDirection(options.orderDirection());
        String orderField = options.orderBy() != null ? options.orderBy() : nextKey;
        RelationNode node = new GroupByNode(filtered(predicates), grouping, projections);
        node = SortNode.by(node, orderField, direction);
        return paginate(node, options.page(), options.pageSize());
    }

    /**
     * Compiles the detail of one dimension member: every attribute of every
     * level of the default hierarchy, from the first fact at the path.
     */
    public RelationNode compileDimensionDetail(String dimensionName, Path path) {
        Dimension dimension = cube.dimension(dimensionName);
        return compileDimensionDetail(dimension, dimension.defaultHierarchy(), path);
    }

    public RelationNode compileDimensionDetail(Dimension dimension, Hierarchy hierarchy, Path path) {
        List<Projection> projections = new ArrayList<>();
        for (String attribute : levelAttributes(hierarchy.levels())) {
            projections.add(Projection.column(cube.columnFor(dimension.name(), attribute),
                    Cube.logicalField(dimension.name(), attribute)));
        }
        RelationNode source = filtered(pathPredicates(dimension, hierarchy, path));
        return LimitNode.limit(new ProjectNode(source, projections), 1);
    }

    // ==================== Options ====================

    private static Set<String> levelAttributes(List<Level> levels) {
        Set<String> attributes = new LinkedHashSet<>();
        for (Level level : levels) {
            attributes.addAll(level.attributes());
        }
        return attributes;
    }

    /**
     * @throws QueryException for anything but asc, ascending, desc, descending or null
     */
    static SortDirection orderDirection(String direction) {
        if (direction == null) {
            return SortDirection.ASC;
        }
        return switch (direction.toLowerCase(Locale.ROOT)) {
            case "asc", "ascending" -> SortDirection.ASC;
            case "desc", "descending" -> SortDirection.DESC;
            default -> throw new QueryException("Unknown order direction '" + direction + "'");
        };
    }

    /**
     * @throws QueryException for anything but asc, ascending, bottom, desc, descending, top or null
     */
    static SortDirection limitDirection(String sort) {
        if (sort == null) {
            return SortDirection.ASC;
        }
        return switch (sort.toLowerCase(Locale.ROOT)) {
            case "asc", "ascending", "bottom" -> SortDirection.ASC;
            case "desc", "descending", "top" -> SortDirection.DESC;
            default -> throw new QueryException("Unknown limit sort '" + sort + "'");
        };
    }

    /**
     * Page {@code p} of size {@code s} skips {@code p*s} rows and takes {@code s}.
     *
     * @throws QueryException for a page without size or negative values
     */
    static RelationNode paginate(RelationNode node, Integer page, Integer pageSize) {
        if (page == null && pageSize == null) {
            return node;
        }
        if (pageSize == null) {
            throw new QueryException("Page " + page + " requested without a page size");
        }
        int p = page == null ? 0 : page;
        if (p < 0 || pageSize < 0) {
            throw new QueryException("Page and page size cannot be negative: page " + p + ", size " + pageSize);
        }
        return LimitNode.page(node, p, pageSize);
    }
}
