package org.finos.cubes.model.definition;

import org.finos.cubes.model.CubeJoin;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Description of a cube.
 *
 * @param name        The cube name
 * @param label       Optional label
 * @param description Optional description
 * @param measures    Measure names
 * @param attributes  Fact attribute names
 * @param mappings    Logical field to physical column mappings
 * @param fact        Fact table, view or SELECT statement; the cube name when absent
 * @param key         Optional row key field
 * @param joins       Declared joins
 * @param dimensions  Names of the model dimensions used by the cube
 */
public record CubeDefinition(
        String name,
        String label,
        String description,
        List<String> measures,
        List<String> attributes,
        Map<String, String> mappings,
        String fact,
        String key,
        List<CubeJoin> joins,
        List<String> dimensions) {

    public CubeDefinition {
        Objects.requireNonNull(name, "Cube name cannot be null");
        measures = measures == null ? List.of() : List.copyOf(measures);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        mappings = mappings == null ? Map.of() : Map.copyOf(mappings);
        joins = joins == null ? List.of() : List.copyOf(joins);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }
}
