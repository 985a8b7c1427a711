package org.finos.cubes.model;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.NotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named axis for slicing and grouping facts, organized into hierarchies of
 * levels.
 *
 * Immutable once built. Hierarchies are resolved against the dimension's
 * levels during construction, so an unknown level name fails fast.
 */
public final class Dimension {

    /**
     * Name of the hierarchy used when no default is configured explicitly.
     */
    public static final String DEFAULT_HIERARCHY_NAME = "default";

    private final String name;
    private final String label;
    private final String description;
    private final String keyField;
    private final Map<String, Level> levels;
    private final Map<String, Hierarchy> hierarchies;
    private final String defaultHierarchyName;
    private final Hierarchy flatHierarchy;

    private Dimension(Builder builder) {
        this.name = builder.name;
        this.label = builder.label != null ? builder.label : builder.name;
        this.description = builder.description;
        this.keyField = builder.keyField;
        this.defaultHierarchyName = builder.defaultHierarchyName;

        Map<String, Level> levelMap = new LinkedHashMap<>();
        for (Level level : builder.levels) {
            if (levelMap.put(level.name(), level) != null) {
                throw new ConfigurationException("Duplicate level '" + level.name() + "' in dimension '" + name + "'");
            }
        }
        this.levels = Collections.unmodifiableMap(levelMap);

        Map<String, Hierarchy> hierarchyMap = new LinkedHashMap<>();
        for (PendingHierarchy pending : builder.hierarchies) {
            List<Level> resolved = new ArrayList<>();
            for (String levelName : pending.levelNames()) {
                Level level = levelMap.get(levelName);
                if (level == null) {
                    throw new ConfigurationException("Hierarchy '" + pending.name() + "' refers to unknown level '"
                            + levelName + "' in dimension '" + name + "'");
                }
                resolved.add(level);
            }
            if (resolved.isEmpty()) {
                throw new ConfigurationException("Hierarchy '" + pending.name() + "' in dimension '" + name
                        + "' has no levels");
            }
            if (hierarchyMap.put(pending.name(), new Hierarchy(pending.name(), pending.label(), resolved, name)) != null) {
                throw new ConfigurationException("Duplicate hierarchy '" + pending.name() + "' in dimension '" + name + "'");
            }
        }
        this.hierarchies = Collections.unmodifiableMap(hierarchyMap);

        if (hierarchyMap.isEmpty() && levelMap.size() == 1) {
            Level only = levelMap.values().iterator().next();
            this.flatHierarchy = new Hierarchy(only.name(), only.label(), List.of(only), name);
        } else {
            this.flatHierarchy = null;
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String label() {
        return label;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    /**
     * @return The field used by range cuts, if configured
     */
    public Optional<String> keyField() {
        return Optional.ofNullable(keyField);
    }

    public Optional<String> defaultHierarchyName() {
        return Optional.ofNullable(defaultHierarchyName);
    }

    /**
     * @return The levels in declaration order
     */
    public Collection<Level> levels() {
        return levels.values();
    }

    public List<String> levelNames() {
        return List.copyOf(levels.keySet());
    }

    public Collection<Hierarchy> hierarchies() {
        return hierarchies.values();
    }

    public Optional<Level> findLevel(String levelName) {
        return Optional.ofNullable(levels.get(levelName));
    }

    /**
     * @throws NotFoundException if the dimension has no such level
     */
    public Level level(String levelName) {
        return findLevel(levelName)
                .orElseThrow(() -> new NotFoundException("No level '" + levelName + "' in dimension '" + name + "'"));
    }

    public Optional<Hierarchy> findHierarchy(String hierarchyName) {
        return Optional.ofNullable(hierarchies.get(hierarchyName));
    }

    /**
     * @throws NotFoundException if the dimension has no such hierarchy
     */
    public Hierarchy hierarchy(String hierarchyName) {
        return findHierarchy(hierarchyName)
                .orElseThrow(() -> new NotFoundException(
                        "No hierarchy '" + hierarchyName + "' in dimension '" + name + "'"));
    }

    /**
     * Resolves the hierarchy used when a query does not name one.
     *
     * In order: the configured default hierarchy, a hierarchy named
     * {@code default} when nothing is configured, the only hierarchy, and
     * finally a single-level hierarchy synthesized from the only level of a
     * dimension without hierarchies.
     *
     * @throws ConfigurationException if none of these applies
     */
    public Hierarchy defaultHierarchy() {
        String wanted = defaultHierarchyName != null ? defaultHierarchyName : DEFAULT_HIERARCHY_NAME;
        Hierarchy hierarchy = hierarchies.get(wanted);
        if (hierarchy != null) {
            return hierarchy;
        }
        if (hierarchies.size() == 1) {
            return hierarchies.values().iterator().next();
        }
        if (!hierarchies.isEmpty()) {
            throw new ConfigurationException("No default hierarchy specified in dimension '" + name
                    + "' and there is more (" + hierarchies.size() + ") than one hierarchy defined");
        }
        if (flatHierarchy != null) {
            return flatHierarchy;
        }
        if (levels.isEmpty()) {
            throw new ConfigurationException("There are no hierarchies in dimension '" + name
                    + "' and there are no levels to make a hierarchy from");
        }
        throw new ConfigurationException("There are no hierarchies in dimension '" + name
                + "' and there is more than one level");
    }

    /**
     * @return True if the dimension has exactly one level
     */
    public boolean isFlat() {
        return levels.size() == 1;
    }

    /**
     * Returns all attributes of all levels of a hierarchy, top level first.
     */
    public List<String> allAttributes(Hierarchy hierarchy) {
        List<String> attributes = new ArrayList<>();
        for (Level level : hierarchy.levels()) {
            attributes.addAll(level.attributes());
        }
        return attributes;
    }

    public List<String> allAttributes() {
        return allAttributes(defaultHierarchy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dimension other)) {
            return false;
        }
        return name.equals(other.name)
                && levels.equals(other.levels)
                && hierarchies.equals(other.hierarchies)
                && Objects.equals(defaultHierarchyName, other.defaultHierarchyName)
                && Objects.equals(keyField, other.keyField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, levels, hierarchies);
    }

    @Override
    public String toString() {
        return "Dimension(" + name + " " + levels.keySet() + ")";
    }

    private record PendingHierarchy(String name, String label, List<String> levelNames) {
    }

    /**
     * Builder for Dimension.
     */
    public static final class Builder {
        private final String name;
        private String label;
        private String description;
        private String keyField;
        private String defaultHierarchyName;
        private final List<Level> levels = new ArrayList<>();
        private final List<PendingHierarchy> hierarchies = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Dimension name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Dimension name cannot be blank");
            }
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder keyField(String keyField) {
            this.keyField = keyField;
            return this;
        }

        public Builder defaultHierarchy(String hierarchyName) {
            this.defaultHierarchyName = hierarchyName;
            return this;
        }

        public Builder addLevel(String levelName) {
            return addLevel(Level.of(name, levelName));
        }

        public Builder addLevel(String levelName, List<String> attributes) {
            return addLevel(Level.of(name, levelName, attributes));
        }

        public Builder addLevel(Level level) {
            if (!level.dimensionName().equals(name)) {
                throw new ConfigurationException("Level '" + level.name() + "' belongs to dimension '"
                        + level.dimensionName() + "', not '" + name + "'");
            }
            levels.add(level);
            return this;
        }

        public Builder addHierarchy(String hierarchyName, List<String> levelNames) {
            return addHierarchy(hierarchyName, null, levelNames);
        }

        public Builder addHierarchy(String hierarchyName, String hierarchyLabel, List<String> levelNames) {
            Objects.requireNonNull(hierarchyName, "Hierarchy name cannot be null");
            Objects.requireNonNull(levelNames, "Hierarchy levels cannot be null");
            hierarchies.add(new PendingHierarchy(hierarchyName, hierarchyLabel, List.copyOf(levelNames)));
            return this;
        }

        public Dimension build() {
            return new Dimension(this);
        }
    }
}
