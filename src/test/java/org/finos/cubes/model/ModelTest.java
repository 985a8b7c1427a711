package org.finos.cubes.model;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.NotFoundException;
import org.finos.cubes.model.definition.CubeDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Model as the registry of dimensions and cubes.
 */
class ModelTest {

    private Model model;

    @BeforeEach
    void setUp() {
        model = new Model("sales_model");
        model.addDimension(Dimension.builder("date")
                .addLevel("year")
                .addLevel("month")
                .addHierarchy("ym", List.of("year", "month"))
                .build());
        model.addDimension(Dimension.builder("store").addLevel("store").build());
    }

    @Test
    @DisplayName("createCube resolves dimensions against the model")
    void testCreateCube() {
        // WHEN
        Cube sales = model.createCube(Cube.builder("sales").measures("amount").dimensions("date"));

        // THEN
        assertEquals("sales_model", sales.modelName());
        assertSame(model.dimension("date"), sales.dimension("date"));
        assertSame(sales, model.cube("sales"));
        assertEquals("sales", sales.fact().name());
        assertEquals(Cube.DEFAULT_KEY_FIELD, sales.keyField());
    }

    @Test
    @DisplayName("A cube may only use dimensions registered on its model")
    void testUnregisteredDimension() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> model.createCube(Cube.builder("sales").dimensions("date", "product")));

        assertTrue(e.getMessage().contains("product"));
        assertTrue(model.findCube("sales").isEmpty());
    }

    @Test
    @DisplayName("Duplicate dimension and cube names are rejected")
    void testDuplicates() {
        model.createCube(Cube.builder("sales").dimensions("date"));

        assertThrows(ConfigurationException.class,
                () -> model.addDimension(Dimension.builder("date").addLevel("year").build()));
        assertThrows(ConfigurationException.class, () -> model.createCube(Cube.builder("sales")));
        assertThrows(ConfigurationException.class, () -> Cube.builder("returns").dimensions("date", "date"));
    }

    @Test
    @DisplayName("Lookups throw NotFoundException")
    void testLookups() {
        assertThrows(NotFoundException.class, () -> model.cube("returns"));
        assertThrows(NotFoundException.class, () -> model.dimension("product"));
        assertTrue(model.findDimension("store").isPresent());
    }

    @Test
    @DisplayName("Cube dimension reference outside the cube fails")
    void testCubeDimensionLookup() {
        Cube sales = model.createCube(Cube.builder("sales").dimensions("date"));

        assertFalse(sales.hasDimension("store"));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> sales.dimension("store"));
        assertTrue(e.getMessage().contains("Invalid dimension reference"));
    }

    @Test
    @DisplayName("Dimensions can be added to and removed from a cube")
    void testCubeDimensionAdministration() {
        model.createCube(Cube.builder("sales").dimensions("date"));

        Cube extended = model.addCubeDimension("sales", "store");
        assertEquals(List.of("date", "store"), extended.dimensionNames());
        assertSame(extended, model.cube("sales"));

        Cube reduced = model.removeCubeDimension("sales", "date");
        assertEquals(List.of("store"), reduced.dimensionNames());
        assertTrue(model.findDimension("date").isPresent());

        assertThrows(ConfigurationException.class, () -> model.addCubeDimension("sales", "product"));
    }

    @Test
    @DisplayName("A dimension used by a cube cannot be removed")
    void testRemoveDimension() {
        model.createCube(Cube.builder("sales").dimensions("date"));

        assertThrows(ConfigurationException.class, () -> model.removeDimension("date"));

        model.removeDimension("store");
        assertTrue(model.findDimension("store").isEmpty());
    }

    @Test
    @DisplayName("createCube accepts a cube definition")
    void testCreateCubeFromDefinition() {
        CubeDefinition definition = new CubeDefinition("returns", null, null, List.of("quantity"), null,
                null, "dw.ft_returns", "return_id", null, List.of("date", "store"));

        Cube returns = model.createCube(definition);

        assertEquals(List.of("date", "store"), returns.dimensionNames());
        assertEquals("dw", returns.fact().schema());
        assertEquals("return_id", returns.keyField());
        assertSame(returns, model.cube("returns"));
    }

    @Test
    @DisplayName("Logical fields map to physical columns, defaulting to the logical name")
    void testMappings() {
        Cube sales = model.createCube(Cube.builder("sales")
                .measures("amount")
                .mapping("date.year", "yr")
                .mapping("amount", "amt")
                .dimensions("date"));

        assertEquals("yr", sales.columnFor("date", "year"));
        assertEquals("date.month", sales.columnFor("date", "month"));
        assertEquals("amt", sales.measureColumn("amount"));
        assertThrows(NotFoundException.class, () -> sales.measure("discount"));
    }

    @Test
    @DisplayName("Fact sources are tables or SELECT statements")
    void testFactSource() {
        assertEquals(FactSource.table("ft_sales"), FactSource.parse("ft_sales"));
        assertEquals(FactSource.table("dw", "ft_sales"), FactSource.parse("dw.ft_sales"));

        assertEquals(FactSource.table("fact-sales"), FactSource.parse("fact-sales"));
        assertEquals(FactSource.table("ventes_été"), FactSource.parse(" ventes_été "));
        assertEquals(FactSource.table("dw", "fact sales"), FactSource.parse("dw.fact sales"));
        assertTrue(FactSource.parse("selection").isTable());
        assertFalse(FactSource.parse("with t as (select 1) select * from t").isTable());
        assertFalse(FactSource.parse("(SELECT 1)").isTable());

        FactSource query = FactSource.parse("SELECT * FROM ft_sales WHERE amount > 0");
        assertFalse(query.isTable());
        assertEquals("SELECT * FROM ft_sales WHERE amount > 0", query.query());
    }
}
