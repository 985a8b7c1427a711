package org.finos.cubes.model.definition;

import java.util.List;
import java.util.Objects;

/**
 * Description of a hierarchy: an ordered list of level names.
 *
 * @param name   The hierarchy name
 * @param label  Optional label
 * @param levels Level names, top level first
 */
public record HierarchyDefinition(
        String name,
        String label,
        List<String> levels) {

    public HierarchyDefinition {
        Objects.requireNonNull(name, "Hierarchy name cannot be null");
        Objects.requireNonNull(levels, "Hierarchy levels cannot be null");
        levels = List.copyOf(levels);
    }
}
