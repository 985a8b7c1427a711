package org.finos.cubes.model;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.NotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Dimension construction, lookups and default hierarchy resolution.
 */
class DimensionTest {

    private static Dimension dateDimension() {
        return Dimension.builder("date")
                .addLevel("year")
                .addLevel("month", List.of("month", "month_name"))
                .addLevel("day")
                .addHierarchy("ymd", List.of("year", "month", "day"))
                .addHierarchy("ym", List.of("year", "month"))
                .defaultHierarchy("ymd")
                .build();
    }

    @Test
    @DisplayName("Explicit default hierarchy name wins")
    void testExplicitDefaultHierarchy() {
        // GIVEN: Two hierarchies with an explicit default
        Dimension date = dateDimension();

        // WHEN / THEN
        assertEquals("ymd", date.defaultHierarchy().name());
        assertEquals(3, date.defaultHierarchy().depth());
    }

    @Test
    @DisplayName("Hierarchy named 'default' is used when no default is configured")
    void testHierarchyNamedDefault() {
        Dimension product = Dimension.builder("product")
                .addLevel("category")
                .addLevel("product")
                .addHierarchy("flat", List.of("product"))
                .addHierarchy("default", List.of("category", "product"))
                .build();

        assertEquals("default", product.defaultHierarchy().name());
    }

    @Test
    @DisplayName("Sole hierarchy is the default")
    void testSoleHierarchy() {
        Dimension date = Dimension.builder("date")
                .addLevel("year")
                .addLevel("month")
                .addHierarchy("calendar", List.of("year", "month"))
                .build();

        assertEquals("calendar", date.defaultHierarchy().name());
        assertEquals(List.of("year", "month"), date.defaultHierarchy().levelNames());
    }

    @Test
    @DisplayName("Single level dimension gets a synthesized hierarchy")
    void testFlatDimension() {
        Dimension store = Dimension.builder("store").addLevel("store", List.of("code", "name")).build();

        Hierarchy hierarchy = store.defaultHierarchy();

        assertTrue(store.isFlat());
        assertEquals(1, hierarchy.depth());
        assertEquals("store", hierarchy.levelAt(0).name());
        assertEquals(List.of("code", "name"), store.allAttributes());
    }

    @Test
    @DisplayName("Ambiguous default hierarchy is a configuration error")
    void testAmbiguousDefaultHierarchy() {
        Dimension date = Dimension.builder("date")
                .addLevel("year")
                .addLevel("month")
                .addHierarchy("a", List.of("year"))
                .addHierarchy("b", List.of("year", "month"))
                .build();

        assertThrows(ConfigurationException.class, date::defaultHierarchy);
    }

    @Test
    @DisplayName("Several levels without hierarchies have no default hierarchy")
    void testLevelsWithoutHierarchy() {
        Dimension date = Dimension.builder("date").addLevel("year").addLevel("month").build();

        ConfigurationException e = assertThrows(ConfigurationException.class, date::defaultHierarchy);
        assertTrue(e.getMessage().contains("more than one level"));
    }

    @Test
    @DisplayName("Dimension without levels has no default hierarchy")
    void testEmptyDimension() {
        Dimension empty = Dimension.builder("empty").build();

        assertThrows(ConfigurationException.class, empty::defaultHierarchy);
    }

    @Test
    @DisplayName("Hierarchy referring to an unknown level fails at construction")
    void testUnknownHierarchyLevel() {
        Dimension.Builder builder = Dimension.builder("date")
                .addLevel("year")
                .addHierarchy("ym", List.of("year", "month"));

        ConfigurationException e = assertThrows(ConfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("month"));
    }

    @Test
    @DisplayName("Duplicate level names are rejected")
    void testDuplicateLevel() {
        Dimension.Builder builder = Dimension.builder("date").addLevel("year").addLevel("year");

        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    @DisplayName("Level and hierarchy lookups throw NotFoundException, find methods return empty")
    void testLookups() {
        Dimension date = dateDimension();

        assertEquals("month", date.level("month").name());
        assertEquals("ym", date.hierarchy("ym").name());
        assertTrue(date.findLevel("week").isEmpty());
        assertTrue(date.findHierarchy("fiscal").isEmpty());
        assertThrows(NotFoundException.class, () -> date.level("week"));
        assertThrows(NotFoundException.class, () -> date.hierarchy("fiscal"));
    }

    @Test
    @DisplayName("Level key defaults to the first attribute")
    void testLevelKeyDefault() {
        Level month = dateDimension().level("month");

        assertEquals("month", month.key());
        assertEquals("month", month.labelAttribute());
        assertEquals(List.of("month", "month_name"), month.attributes());
        assertEquals("date", month.dimensionName());
    }

    @Test
    @DisplayName("Level without key and attributes is a configuration error")
    void testLevelWithoutAttributes() {
        assertThrows(ConfigurationException.class,
                () -> new Level("year", null, null, List.of(), null, "date"));
    }

    @Test
    @DisplayName("Level from another dimension is rejected")
    void testForeignLevel() {
        Dimension.Builder builder = Dimension.builder("date");

        assertThrows(ConfigurationException.class, () -> builder.addLevel(Level.of("product", "category")));
    }

    @Test
    @DisplayName("allAttributes lists attributes of every hierarchy level in order")
    void testAllAttributes() {
        Dimension date = dateDimension();

        assertEquals(List.of("year", "month", "month_name", "day"), date.allAttributes());
        assertEquals(List.of("year", "month", "month_name"), date.allAttributes(date.hierarchy("ym")));
    }

    @Test
    @DisplayName("An explicit key missing from the attributes becomes the first attribute")
    void testKeyAddedToAttributes() {
        Level month = new Level("month", null, "month_id", List.of("month_name"), null, "date");
        Level listed = new Level("month", null, "month", List.of("month_name", "month"), null, "date");

        assertEquals("month_id", month.key());
        assertEquals(List.of("month_id", "month_name"), month.attributes());
        assertEquals(List.of("month_name", "month"), listed.attributes());
    }
}
