package org.finos.cubes.model;

import org.finos.cubes.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One rung of a dimension hierarchy, such as year or month of a date dimension.
 *
 * @param name           The level name, unique within its dimension
 * @param label          Human readable label (defaults to the name)
 * @param key            The key attribute; the first attribute when not given
 * @param attributes     Ordered attribute names of the level; a key not listed is put first
 * @param labelAttribute The attribute used for display; the key when not given
 * @param dimensionName  The name of the owning dimension
 */
public record Level(
        String name,
        String label,
        String key,
        List<String> attributes,
        String labelAttribute,
        String dimensionName) {

    public Level {
        Objects.requireNonNull(name, "Level name cannot be null");
        Objects.requireNonNull(dimensionName, "Dimension name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Level name cannot be blank");
        }

        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        if (key == null) {
            if (attributes.isEmpty()) {
                throw new ConfigurationException("Level '" + name + "' in dimension '" + dimensionName
                        + "' has neither a key nor attributes");
            }
            key = attributes.get(0);
        }
        if (!attributes.contains(key)) {
            // the key is always selected and grouped with the level
            List<String> withKey = new ArrayList<>(attributes.size() + 1);
            withKey.add(key);
            withKey.addAll(attributes);
            attributes = List.copyOf(withKey);
        }
        if (label == null) {
            label = name;
        }
        if (labelAttribute == null) {
            labelAttribute = key;
        }
    }

    /**
     * Creates a level whose only attribute is also its key.
     */
    public static Level of(String dimensionName, String name) {
        return new Level(name, null, null, List.of(name), null, dimensionName);
    }

    /**
     * Creates a level with the given attributes, keyed by the first one.
     */
    public static Level of(String dimensionName, String name, List<String> attributes) {
        return new Level(name, null, null, attributes, null, dimensionName);
    }

    @Override
    public String toString() {
        return dimensionName + "." + name;
    }
}
