package org.finos.cubes.cut;

import org.finos.cubes.model.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for cut construction and visitor dispatch.
 */
class CutTest {

    private static final CutVisitor<String> KIND = new CutVisitor<>() {
        @Override
        public String visit(PointCut cut) {
            return "point";
        }

        @Override
        public String visit(RangeCut cut) {
            return "range";
        }

        @Override
        public String visit(SetCut cut) {
            return "set";
        }
    };

    @Test
    @DisplayName("Point cut factories build paths")
    void testPointCut() {
        PointCut byValues = Cut.point("date", 2023, 1);
        PointCut byPath = Cut.point("date", Path.of(2023, 1));
        PointCut withHierarchy = Cut.point("date", "ym", Path.of(2023));

        assertEquals(byValues, byPath);
        assertTrue(byValues.hierarchyName().isEmpty());
        assertEquals("ym", withHierarchy.hierarchyName().orElseThrow());
        assertEquals("date", withHierarchy.dimension());
    }

    @Test
    @DisplayName("Visitor dispatches on the cut variant")
    void testVisitor() {
        assertEquals("point", Cut.point("date", 2023).accept(KIND));
        assertEquals("range", Cut.range("date", 2020, 2023).accept(KIND));
        assertEquals("set", Cut.set("date", List.of(Path.of(2020), Path.of(2022))).accept(KIND));
    }

    @Test
    @DisplayName("Cuts validate their parts")
    void testValidation() {
        assertThrows(NullPointerException.class, () -> Cut.range("date", null, 2023));
        assertThrows(NullPointerException.class, () -> Cut.point(null, 2023));
        assertThrows(IllegalArgumentException.class, () -> Cut.set("date", List.of()));
    }
}
