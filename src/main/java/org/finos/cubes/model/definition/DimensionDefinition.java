package org.finos.cubes.model.definition;

import java.util.List;
import java.util.Objects;

/**
 * Description of a dimension with its levels and hierarchies.
 *
 * @param name             The dimension name
 * @param label            Optional label
 * @param description      Optional description
 * @param levels           Levels in declaration order
 * @param hierarchies      Hierarchies in declaration order
 * @param defaultHierarchy Optional name of the default hierarchy
 * @param keyField         Optional key field used by range cuts
 */
public record DimensionDefinition(
        String name,
        String label,
        String description,
        List<LevelDefinition> levels,
        List<HierarchyDefinition> hierarchies,
        String defaultHierarchy,
        String keyField) {

    public DimensionDefinition {
        Objects.requireNonNull(name, "Dimension name cannot be null");
        levels = levels == null ? List.of() : List.copyOf(levels);
        hierarchies = hierarchies == null ? List.of() : List.copyOf(hierarchies);
    }
}
