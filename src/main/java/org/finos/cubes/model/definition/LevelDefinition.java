package org.finos.cubes.model.definition;

import java.util.List;
import java.util.Objects;

/**
 * Description of a dimension level.
 *
 * <pre>
 * "month": { "label": "Month", "key": "month", "attributes": ["month", "month_name"],
 *            "label_attribute": "month_name" }
 * </pre>
 *
 * @param name           The level name
 * @param label          Optional label
 * @param key            Optional key attribute
 * @param attributes     Ordered attribute names
 * @param labelAttribute Optional label attribute
 */
public record LevelDefinition(
        String name,
        String label,
        String key,
        List<String> attributes,
        String labelAttribute) {

    public LevelDefinition {
        Objects.requireNonNull(name, "Level name cannot be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
