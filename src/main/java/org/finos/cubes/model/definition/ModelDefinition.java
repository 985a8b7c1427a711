package org.finos.cubes.model.definition;

import java.util.List;
import java.util.Objects;

/**
 * Description of a complete model, as read from a model document.
 *
 * @param name        The model name
 * @param label       Optional label
 * @param description Optional description
 * @param dimensions  Dimension descriptions
 * @param cubes       Cube descriptions
 */
public record ModelDefinition(
        String name,
        String label,
        String description,
        List<DimensionDefinition> dimensions,
        List<CubeDefinition> cubes) {

    public ModelDefinition {
        Objects.requireNonNull(name, "Model name cannot be null");
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        cubes = cubes == null ? List.of() : List.copyOf(cubes);
    }
}
