package org.finos.cubes.query;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.plan.AggregateExpression.AggregateFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregationTest {

    @Test
    @DisplayName("Operators are looked up by name ignoring case")
    void testFromName() {
        assertEquals(Aggregation.SUM, Aggregation.fromName("sum"));
        assertEquals(Aggregation.AVERAGE, Aggregation.fromName("Average"));
        assertEquals(Aggregation.MAX, Aggregation.fromName("MAX"));
    }

    @Test
    @DisplayName("Unknown or missing operator names are configuration errors")
    void testUnknownName() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> Aggregation.fromName("median"));
        assertTrue(e.getMessage().contains("median"));
        assertThrows(ConfigurationException.class, () -> Aggregation.fromName(null));
        assertThrows(ConfigurationException.class, () -> Aggregation.fromName("avg"));
    }

    @Test
    @DisplayName("Average maps to the AVG function")
    void testFunctions() {
        assertEquals(AggregateFunction.AVG, Aggregation.AVERAGE.function());
        assertEquals(AggregateFunction.COUNT, Aggregation.COUNT.function());
    }

    @Test
    @DisplayName("Options default to sum without drill-down")
    void testDefaultOptions() {
        AggregationOptions options = AggregationOptions.defaults();

        assertEquals(1, options.aggregations().size());
        assertTrue(options.aggregations().contains(Aggregation.SUM));
        assertFalse(options.isDrillDown());
        assertNull(options.limit());
    }

    @Test
    @DisplayName("top_10 preset ranks ten rows from the top")
    void testTop10() {
        RankLimit limit = RankLimit.top10();

        assertEquals(RankLimit.Type.RANK, limit.type());
        assertEquals(10, limit.value().intValue());
        assertEquals("top", limit.sort());
    }
}
