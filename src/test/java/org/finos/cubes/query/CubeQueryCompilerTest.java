package org.finos.cubes.query;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.NotFoundException;
import org.finos.cubes.QueryException;
import org.finos.cubes.SalesModel;
import org.finos.cubes.UnsupportedQueryException;
import org.finos.cubes.cut.Cut;
import org.finos.cubes.model.Cube;
import org.finos.cubes.model.Dimension;
import org.finos.cubes.model.Level;
import org.finos.cubes.model.Model;
import org.finos.cubes.model.Path;
import org.finos.cubes.plan.ComparisonExpression;
import org.finos.cubes.plan.Expression;
import org.finos.cubes.transpiler.DuckDBDialect;
import org.finos.cubes.transpiler.SQLGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for compiling cuts and aggregation requests into plans.
 */
class CubeQueryCompilerTest {

    private static final String SUMMARY_2023 = "SELECT SUM(\"amount\") AS \"amount_sum\", COUNT(*) AS \"record_count\""
            + " FROM \"ft_sales\" AS \"v\" WHERE \"date.year\" = 2023";

    private CubeQueryCompiler compiler;
    private SQLGenerator sqlGenerator;

    @BeforeEach
    void setUp() {
        compiler = new CubeQueryCompiler(SalesModel.salesCube());
        sqlGenerator = new SQLGenerator(DuckDBDialect.INSTANCE);
    }

    private String drillSql(List<Cut> cuts, AggregationOptions options) {
        AggregationQuery query = compiler.compileAggregation(cuts, "amount", options);
        return sqlGenerator.generate(query.drill().orElseThrow());
    }

    // ==================== Predicates ====================

    @Test
    @DisplayName("Wildcard path entries emit no predicate")
    void testWildcardPredicate() {
        // WHEN
        List<Expression> predicates = compiler.predicates(List.of(Cut.point("date", 2023, Path.ALL)));

        // THEN: only the year is constrained
        assertEquals(List.of(ComparisonExpression.columnEquals("date.year", 2023)), predicates);
    }

    @Test
    @DisplayName("Predicates of all cuts are conjoined in cut order")
    void testPredicatesInCutOrder() {
        List<Expression> predicates = compiler.predicates(List.of(
                Cut.point("product", "fruit"),
                Cut.point("date", Path.ALL, 3)));

        assertEquals(List.of(
                ComparisonExpression.columnEquals("product.category", "fruit"),
                ComparisonExpression.columnEquals("date.month", 3)), predicates);
    }

    @Test
    @DisplayName("Point cut with hierarchy override resolves levels of that hierarchy")
    void testHierarchyOverride() {
        assertEquals(1, compiler.predicates(List.of(Cut.point("date", "y", Path.of(2023)))).size());
        assertThrows(QueryException.class,
                () -> compiler.predicates(List.of(Cut.point("date", "y", Path.of(2023, 1)))));
        assertThrows(NotFoundException.class,
                () -> compiler.predicates(List.of(Cut.point("date", "fiscal", Path.of(2023)))));
    }

    @Test
    @DisplayName("Range cut compiles to BETWEEN on the dimension key field")
    void testRangeCut() {
        String sql = sqlGenerator.generate(compiler.compileFacts(
                List.of(Cut.range("date", 2020, 2023)), FactQueryOptions.none()));

        assertEquals("SELECT * FROM \"ft_sales\" AS \"v\" WHERE \"date.year\" BETWEEN 2020 AND 2023", sql);
    }

    @Test
    @DisplayName("Range cut on a dimension without key field is a configuration error")
    void testRangeCutWithoutKeyField() {
        assertThrows(ConfigurationException.class,
                () -> compiler.predicates(List.of(Cut.range("product", "a", "f"))));
    }

    @Test
    @DisplayName("Set cuts are unsupported")
    void testSetCut() {
        List<Cut> cuts = List.of(Cut.set("date", List.of(Path.of(2022), Path.of(2023))));

        assertThrows(UnsupportedQueryException.class, () -> compiler.predicates(cuts));
    }

    @Test
    @DisplayName("Cuts on dimensions outside the cube fail compilation")
    void testUnknownDimension() {
        List<Cut> cuts = List.of(Cut.point("store", "north"));

        assertThrows(ConfigurationException.class,
                () -> compiler.compileAggregation(cuts, "amount", AggregationOptions.defaults()));
    }

    @Test
    @DisplayName("Path longer than the hierarchy is a query error")
    void testPathTooLong() {
        assertThrows(QueryException.class,
                () -> compiler.predicates(List.of(Cut.point("date", 2023, 1, 15))));
    }

    // ==================== Aggregation ====================

    @Test
    @DisplayName("Aggregation without drill-down compiles only the summary")
    void testSummaryOnly() {
        // WHEN
        AggregationQuery query = compiler.compileAggregation(
                List.of(Cut.point("date", 2023)), "amount", AggregationOptions.defaults());

        // THEN
        assertEquals(SUMMARY_2023, sqlGenerator.generate(query.summary()));
        assertFalse(query.isDrillDown());
        assertFalse(query.hasLimit());
        assertEquals(List.of(Aggregation.SUM), query.aggregations());
    }

    @Test
    @DisplayName("Row levels group, order and select level attributes by logical name")
    void testDrillDown() {
        // GIVEN
        AggregationOptions options = AggregationOptions.builder().rowLevels("date", "month").build();

        // WHEN
        AggregationQuery query = compiler.compileAggregation(List.of(Cut.point("date", 2023)), "amount", options);
        String drill = sqlGenerator.generate(query.drill().orElseThrow());

        // THEN
        System.out.println("Drill SQL: " + drill);
        assertEquals(SUMMARY_2023, sqlGenerator.generate(query.summary()));
        assertEquals("SELECT SUM(\"amount\") AS \"amount_sum\", COUNT(*) AS \"record_count\","
                + " \"date.month\" AS \"date.month\", \"date.month_name\" AS \"date.month_name\""
                + " FROM \"ft_sales\" AS \"v\" WHERE \"date.year\" = 2023"
                + " GROUP BY \"date.month\", \"date.month_name\""
                + " ORDER BY \"date.month\" ASC, \"date.month_name\" ASC", drill);
    }

    @Test
    @DisplayName("drillDown derives row levels from the point cut on the row dimension")
    void testDerivedDrillDown() {
        AggregationOptions options = AggregationOptions.builder().drillDown("date").build();

        AggregationQuery cutQuery = compiler.compileAggregation(List.of(Cut.point("date", 2023)), "amount", options);
        AggregationQuery fullQuery = compiler.compileAggregation(List.of(), "amount", options);

        assertEquals(List.of("year", "month"), cutQuery.rowLevels().stream().map(Level::name).toList());
        assertEquals(List.of("year"), fullQuery.rowLevels().stream().map(Level::name).toList());
    }

    @Test
    @DisplayName("Each requested operator is projected as <measure>_<operator>")
    void testAggregations() {
        AggregationOptions options = AggregationOptions.builder().aggregations("sum", "average", "max").build();

        String sql = sqlGenerator.generate(compiler.compileAggregation(List.of(), "amount", options).summary());

        assertEquals("SELECT SUM(\"amount\") AS \"amount_sum\", AVG(\"amount\") AS \"amount_average\","
                + " MAX(\"amount\") AS \"amount_max\", COUNT(*) AS \"record_count\" FROM \"ft_sales\" AS \"v\"", sql);
    }

    @Test
    @DisplayName("Aggregation without measure counts records")
    void testRecordCountOnly() {
        String sql = sqlGenerator.generate(
                compiler.compileAggregation(List.of(), null, AggregationOptions.defaults()).summary());

        assertEquals("SELECT COUNT(*) AS \"record_count\" FROM \"ft_sales\" AS \"v\"", sql);
    }

    @Test
    @DisplayName("aggregatedFieldName joins field and operator")
    void testAggregatedFieldName() {
        for (Aggregation aggregation : Aggregation.values()) {
            assertEquals("amount_" + aggregation.operatorName(),
                    CubeQueryCompiler.aggregatedFieldName("amount", aggregation));
        }
        assertEquals("amount_sum", CubeQueryCompiler.aggregatedFieldName("amount", "sum"));
        assertEquals("amount_average", CubeQueryCompiler.aggregatedFieldName("amount", "AVERAGE"));
        assertThrows(ConfigurationException.class, () -> CubeQueryCompiler.aggregatedFieldName("amount", "median"));
        assertThrows(ConfigurationException.class, () -> AggregationOptions.builder().aggregations("median"));
    }

    // ==================== Order, page, limit ====================

    @Test
    @DisplayName("orderBy orders the drill rows by a generated field")
    void testOrderBy() {
        String sql = drillSql(List.of(), AggregationOptions.builder()
                .rowLevels("date", "year")
                .orderBy("amount_sum", "descending")
                .build());

        assertTrue(sql.endsWith("GROUP BY \"date.year\" ORDER BY \"amount_sum\" DESC"));
    }

    @Test
    @DisplayName("Unknown order direction is a query error")
    void testUnknownOrderDirection() {
        AggregationOptions options = AggregationOptions.builder()
                .rowLevels("date", "year")
                .orderBy("amount_sum", "sideways")
                .build();

        assertThrows(QueryException.class, () -> compiler.compileAggregation(List.of(), "amount", options));
    }

    @Test
    @DisplayName("Page p of size s skips p*s rows")
    void testPagination() {
        String sql = drillSql(List.of(), AggregationOptions.builder().rowLevels("date", "year").page(2, 5).build());

        assertTrue(sql.endsWith("LIMIT 5 OFFSET 10"));
    }

    @Test
    @DisplayName("Page without size and negative pages are query errors")
    void testInvalidPagination() {
        AggregationOptions noSize = AggregationOptions.builder().rowLevels("date", "year").page(1).build();
        AggregationOptions negative = AggregationOptions.builder().rowLevels("date", "year").page(-1, 5).build();

        assertThrows(QueryException.class, () -> compiler.compileAggregation(List.of(), "amount", noSize));
        assertThrows(QueryException.class, () -> compiler.compileAggregation(List.of(), "amount", negative));
    }

    @Test
    @DisplayName("Rank limit wraps the drill plan and orders by the aggregated field")
    void testRankLimit() {
        // GIVEN
        AggregationOptions options = AggregationOptions.builder()
                .rowLevels("date", "year")
                .limit(RankLimit.rank(3, "descending"))
                .build();

        // WHEN
        AggregationQuery query = compiler.compileAggregation(List.of(), "amount", options);
        String sql = sqlGenerator.generate(query.drill().orElseThrow());

        // THEN
        System.out.println("Rank SQL: " + sql);
        assertTrue(query.hasLimit());
        assertTrue(sql.startsWith("SELECT * FROM (SELECT SUM(\"amount\") AS \"amount_sum\""));
        assertTrue(sql.endsWith(") AS \"s\" ORDER BY \"amount_sum\" DESC LIMIT 3"));
    }

    @Test
    @DisplayName("Rank limit values must be whole numbers within int range")
    void testRankLimitValueRange() {
        String wholeDouble = drillSql(List.of(), AggregationOptions.builder()
                .rowLevels("date", "year")
                .limit(new RankLimit(RankLimit.Type.RANK, 4.0, "top", null))
                .build());
        assertTrue(wholeDouble.endsWith("DESC LIMIT 4"));

        for (Number value : List.<Number>of(2.9, 3_000_000_000L, -1)) {
            AggregationOptions options = AggregationOptions.builder()
                    .rowLevels("date", "year")
                    .limit(new RankLimit(RankLimit.Type.RANK, value, "top", null))
                    .build();

            QueryException e = assertThrows(QueryException.class,
                    () -> compiler.compileAggregation(List.of(), "amount", options));
            assertTrue(e.getMessage().contains(value.toString()), e.getMessage());
        }
    }

    @Test
    @DisplayName("Limit sort names map to directions")
    void testLimitSorts() {
        for (String sort : List.of("asc", "ascending", "bottom")) {
            assertTrue(drillSql(List.of(), AggregationOptions.builder().rowLevels("date", "year")
                    .limit(RankLimit.rank(2, sort)).build()).endsWith("ASC LIMIT 2"), sort);
        }
        for (String sort : List.of("desc", "descending", "top")) {
            assertTrue(drillSql(List.of(), AggregationOptions.builder().rowLevels("date", "year")
                    .limit(RankLimit.rank(2, sort)).build()).endsWith("DESC LIMIT 2"), sort);
        }
        AggregationOptions unknown = AggregationOptions.builder().rowLevels("date", "year")
                .limit(RankLimit.rank(2, "middle")).build();
        assertThrows(QueryException.class, () -> compiler.compileAggregation(List.of(), "amount", unknown));
    }

    @Test
    @DisplayName("top_10 preset is a descending rank limit of ten")
    void testTop10() {
        String sql = drillSql(List.of(), AggregationOptions.builder()
                .rowLevels("date", "year")
                .limit(RankLimit.top10())
                .build());

        assertTrue(sql.endsWith("ORDER BY \"amount_sum\" DESC LIMIT 10"));
    }

    @Test
    @DisplayName("Limit aggregation must be among the selected aggregations")
    void testLimitAggregationNotSelected() {
        AggregationOptions options = AggregationOptions.builder()
                .rowLevels("date", "year")
                .limit(RankLimit.rank(3, "top", Aggregation.MAX))
                .build();

        QueryException e = assertThrows(QueryException.class,
                () -> compiler.compileAggregation(List.of(), "amount", options));
        assertTrue(e.getMessage().contains("max"));
    }

    @Test
    @DisplayName("Limit by another selected aggregation orders by its field")
    void testLimitByMax() {
        String sql = drillSql(List.of(), AggregationOptions.builder()
                .aggregations(Aggregation.SUM, Aggregation.MAX)
                .rowLevels("date", "year")
                .limit(RankLimit.rank(3, "top", Aggregation.MAX))
                .build());

        assertTrue(sql.endsWith("ORDER BY \"amount_max\" DESC LIMIT 3"));
    }

    @Test
    @DisplayName("Percent and value limits are unsupported")
    void testPercentAndValueLimits() {
        for (RankLimit limit : List.of(RankLimit.percent(10, "top"), RankLimit.value(1000, "top"))) {
            AggregationOptions options = AggregationOptions.builder().rowLevels("date", "year").limit(limit).build();

            assertThrows(UnsupportedQueryException.class,
                    () -> compiler.compileAggregation(List.of(), "amount", options));
        }
    }

    @Test
    @DisplayName("Limits need drill-down and a value")
    void testLimitPreconditions() {
        AggregationOptions noDrill = AggregationOptions.builder().limit(RankLimit.rank(3, "top")).build();
        AggregationOptions noValue = AggregationOptions.builder()
                .rowLevels("date", "year")
                .limit(new RankLimit(RankLimit.Type.RANK, null, "top", null))
                .build();

        assertThrows(QueryException.class, () -> compiler.compileAggregation(List.of(), "amount", noDrill));
        assertThrows(QueryException.class, () -> compiler.compileAggregation(List.of(), "amount", noValue));
    }

    // ==================== Listings ====================

    @Test
    @DisplayName("Dimension values select the next level below the path")
    void testDimensionValues() {
        String sql = sqlGenerator.generate(compiler.compileDimensionValues(
                List.of(), "date", Path.of(2023), FactQueryOptions.none()));

        assertEquals("SELECT \"date.month\" AS \"date.month\", \"date.month_name\" AS \"date.month_name\""
                + " FROM \"ft_sales\" AS \"v\" WHERE (\"date.year\" = 2023 AND \"date.month\" IS NOT NULL)"
                + " GROUP BY \"date.month\", \"date.month_name\" ORDER BY \"date.month\" ASC", sql);
    }

    @Test
    @DisplayName("Levels keyed outside their attributes still select and group the key")
    void testDimensionValuesWithSeparateKey() {
        // GIVEN: month is keyed by month_id but lists only month_name
        Model model = new Model("keyed");
        model.addDimension(Dimension.builder("date")
                .addLevel("year")
                .addLevel(new Level("month", null, "month_id", List.of("month_name"), null, "date"))
                .addHierarchy("ym", List.of("year", "month"))
                .build());
        CubeQueryCompiler keyed = new CubeQueryCompiler(model.createCube(Cube.builder("sales")
                .measures("amount")
                .fact("ft_sales")
                .dimensions("date")));

        // WHEN
        String sql = sqlGenerator.generate(keyed.compileDimensionValues(
                List.of(), "date", Path.of(2023), FactQueryOptions.none()));

        // THEN
        assertEquals("SELECT \"date.month_id\" AS \"date.month_id\", \"date.month_name\" AS \"date.month_name\""
                + " FROM \"ft_sales\" AS \"v\" WHERE (\"date.year\" = 2023 AND \"date.month_id\" IS NOT NULL)"
                + " GROUP BY \"date.month_id\", \"date.month_name\" ORDER BY \"date.month_id\" ASC", sql);
    }

    @Test
    @DisplayName("Dimension values include wildcard levels and the slice cuts")
    void testDimensionValuesWithWildcard() {
        String sql = sqlGenerator.generate(compiler.compileDimensionValues(
                List.of(Cut.point("product", "fruit")), "date", Path.of(Path.ALL),
                FactQueryOptions.builder().page(0, 10).build()));

        assertEquals("SELECT \"date.year\" AS \"date.year\", \"date.month\" AS \"date.month\","
                + " \"date.month_name\" AS \"date.month_name\" FROM \"ft_sales\" AS \"v\""
                + " WHERE (\"product.category\" = 'fruit' AND \"date.month\" IS NOT NULL)"
                + " GROUP BY \"date.year\", \"date.month\", \"date.month_name\""
                + " ORDER BY \"date.month\" ASC LIMIT 10", sql);
    }

    @Test
    @DisplayName("Dimension values below a base path are a query error")
    void testDimensionValuesAtBase() {
        assertThrows(QueryException.class, () -> compiler.compileDimensionValues(
                List.of(), "date", Path.of(2023, 1), FactQueryOptions.none()));
    }

    @Test
    @DisplayName("Dimension detail selects every level attribute of one row")
    void testDimensionDetail() {
        String sql = sqlGenerator.generate(compiler.compileDimensionDetail("date", Path.of(2023, 2)));

        assertEquals("SELECT \"date.year\" AS \"date.year\", \"date.month\" AS \"date.month\","
                + " \"date.month_name\" AS \"date.month_name\" FROM \"ft_sales\" AS \"v\""
                + " WHERE (\"date.year\" = 2023 AND \"date.month\" = 2) LIMIT 1", sql);
    }

    @Test
    @DisplayName("Facts are filtered, ordered and paginated")
    void testFacts() {
        String sql = sqlGenerator.generate(compiler.compileFacts(List.of(Cut.point("date", 2023)),
                FactQueryOptions.builder().orderBy("amount", "desc").page(1, 2).build()));

        assertEquals("SELECT * FROM \"ft_sales\" AS \"v\" WHERE \"date.year\" = 2023"
                + " ORDER BY \"amount\" DESC LIMIT 2 OFFSET 2", sql);
    }

    @Test
    @DisplayName("Single fact lookup uses the cube key field")
    void testFact() {
        String sql = sqlGenerator.generate(compiler.compileFact(5));

        assertEquals("SELECT * FROM \"ft_sales\" AS \"v\" WHERE \"id\" = 5 LIMIT 1", sql);
    }

    @Test
    @DisplayName("Mapped fields use physical columns and keep logical names")
    void testMappings() {
        // GIVEN: A cube mapping logical fields to physical columns
        Model model = new Model("mapped");
        model.addDimension(Dimension.builder("date").addLevel("year").build());
        Cube cube = model.createCube(Cube.builder("sales")
                .measures("amount")
                .attributes(List.of("id", "amount"))
                .mapping("date.year", "yr")
                .mapping("amount", "amt")
                .fact("dw.ft_sales")
                .dimensions("date"));
        CubeQueryCompiler mapped = new CubeQueryCompiler(cube);

        // WHEN
        String drill = sqlGenerator.generate(mapped.compileAggregation(List.of(Cut.point("date", 2023)), "amount",
                AggregationOptions.builder().rowLevels("date", "year").build()).drill().orElseThrow());
        String facts = sqlGenerator.generate(mapped.compileFacts(List.of(), FactQueryOptions.none()));

        // THEN
        assertEquals("SELECT SUM(\"amt\") AS \"amount_sum\", COUNT(*) AS \"record_count\", \"yr\" AS \"date.year\""
                + " FROM \"dw\".\"ft_sales\" AS \"v\" WHERE \"yr\" = 2023 GROUP BY \"yr\""
                + " ORDER BY \"date.year\" ASC", drill);
        assertEquals("SELECT \"id\" AS \"id\", \"amt\" AS \"amount\" FROM \"dw\".\"ft_sales\" AS \"v\"", facts);
    }
}
