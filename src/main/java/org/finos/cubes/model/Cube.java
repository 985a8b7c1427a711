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
 * A named, analyzable set of facts with measures and the dimensions they can
 * be sliced by.
 *
 * A cube is created through {@link Model#createCube(Builder)}, which resolves
 * the cube's dimension names against the model. The cube keeps the resolved
 * dimensions and refers to its model by name only.
 *
 * Logical fields are {@code dimension.attribute} for dimension attributes and
 * the plain name for measures and fact attributes. {@link #mappings()} maps a
 * logical field to a physical column; unmapped fields use the logical name.
 */
public final class Cube {

    /**
     * Key field used for single fact lookup when none is configured.
     */
    public static final String DEFAULT_KEY_FIELD = "id";

    private final String name;
    private final String label;
    private final String description;
    private final List<String> measures;
    private final List<String> attributes;
    private final Map<String, String> mappings;
    private final FactSource fact;
    private final String keyField;
    private final List<CubeJoin> joins;
    private final Map<String, Dimension> dimensions;
    private final String modelName;

    private Cube(Builder builder, List<Dimension> resolvedDimensions, String modelName) {
        this.name = builder.name;
        this.label = builder.label != null ? builder.label : builder.name;
        this.description = builder.description;
        this.measures = List.copyOf(builder.measures);
        this.attributes = List.copyOf(builder.attributes);
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.mappings));
        this.fact = builder.fact != null ? builder.fact : FactSource.table(builder.name);
        this.keyField = builder.keyField != null ? builder.keyField : DEFAULT_KEY_FIELD;
        this.joins = List.copyOf(builder.joins);
        this.modelName = modelName;

        Map<String, Dimension> dimensionMap = new LinkedHashMap<>();
        for (Dimension dimension : resolvedDimensions) {
            dimensionMap.put(dimension.name(), dimension);
        }
        this.dimensions = Collections.unmodifiableMap(dimensionMap);
    }

    private Cube(Cube original, Map<String, Dimension> dimensions) {
        this.name = original.name;
        this.label = original.label;
        this.description = original.description;
        this.measures = original.measures;
        this.attributes = original.attributes;
        this.mappings = original.mappings;
        this.fact = original.fact;
        this.keyField = original.keyField;
        this.joins = original.joins;
        this.modelName = original.modelName;
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    static Cube create(Builder builder, List<Dimension> resolvedDimensions, String modelName) {
        return new Cube(builder, resolvedDimensions, modelName);
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

    public List<String> measures() {
        return measures;
    }

    public List<String> attributes() {
        return attributes;
    }

    public Map<String, String> mappings() {
        return mappings;
    }

    public FactSource fact() {
        return fact;
    }

    /**
     * @return The field identifying a single fact row
     */
    public String keyField() {
        return keyField;
    }

    public List<CubeJoin> joins() {
        return joins;
    }

    /**
     * @return The name of the model owning this cube
     */
    public String modelName() {
        return modelName;
    }

    public Collection<Dimension> dimensions() {
        return dimensions.values();
    }

    public List<String> dimensionNames() {
        return List.copyOf(dimensions.keySet());
    }

    public boolean hasDimension(String dimensionName) {
        return dimensions.containsKey(dimensionName);
    }

    /**
     * @throws NotFoundException if the dimension is not part of this cube
     */
    public Dimension dimension(String dimensionName) {
        Dimension dimension = dimensions.get(dimensionName);
        if (dimension == null) {
            throw new NotFoundException("Invalid dimension reference '" + dimensionName + "' for cube '" + name + "'");
        }
        return dimension;
    }

    /**
     * Validates a measure name against the declared measures.
     * Cubes without declared measures accept any measure.
     *
     * @throws NotFoundException if measures are declared and the name is not one of them
     */
    public String measure(String measureName) {
        Objects.requireNonNull(measureName, "Measure cannot be null");
        if (!measures.isEmpty() && !measures.contains(measureName)) {
            throw new NotFoundException("No measure '" + measureName + "' in cube '" + name + "'");
        }
        return measureName;
    }

    /**
     * @return The physical column of a measure
     */
    public String measureColumn(String measureName) {
        return fieldColumn(measure(measureName));
    }

    /**
     * @return The logical name of a dimension attribute, as used for result row fields
     */
    public static String logicalField(String dimensionName, String attribute) {
        return dimensionName + "." + attribute;
    }

    /**
     * @return The physical column of a dimension attribute
     */
    public String columnFor(String dimensionName, String attribute) {
        return fieldColumn(logicalField(dimensionName, attribute));
    }

    /**
     * @return The physical column of a logical field
     */
    public String fieldColumn(String logicalField) {
        return mappings.getOrDefault(logicalField, logicalField);
    }

    Cube withDimension(Dimension dimension) {
        Map<String, Dimension> copy = new LinkedHashMap<>(dimensions);
        copy.put(dimension.name(), dimension);
        return new Cube(this, copy);
    }

    Cube withoutDimension(String dimensionName) {
        Map<String, Dimension> copy = new LinkedHashMap<>(dimensions);
        copy.remove(dimensionName);
        return new Cube(this, copy);
    }

    @Override
    public String toString() {
        return "Cube(" + name + " " + dimensions.keySet() + " " + measures + ")";
    }

    /**
     * Builder for Cube. Dimensions are referenced by name and resolved by the model.
     */
    public static final class Builder {
        private final String name;
        private String label;
        private String description;
        private final List<String> measures = new ArrayList<>();
        private final List<String> attributes = new ArrayList<>();
        private final Map<String, String> mappings = new LinkedHashMap<>();
        private FactSource fact;
        private String keyField;
        private final List<CubeJoin> joins = new ArrayList<>();
        private final List<String> dimensionNames = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Cube name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Cube name cannot be blank");
            }
        }

        public String name() {
            return name;
        }

        public List<String> dimensionNames() {
            return List.copyOf(dimensionNames);
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder measures(String... measureNames) {
            return measures(List.of(measureNames));
        }

        public Builder measures(List<String> measureNames) {
            measures.addAll(measureNames);
            return this;
        }

        public Builder attributes(List<String> attributeNames) {
            attributes.addAll(attributeNames);
            return this;
        }

        public Builder mapping(String logicalField, String column) {
            mappings.put(logicalField, column);
            return this;
        }

        public Builder mappings(Map<String, String> fieldMappings) {
            mappings.putAll(fieldMappings);
            return this;
        }

        public Builder fact(FactSource source) {
            this.fact = source;
            return this;
        }

        public Builder fact(String source) {
            this.fact = FactSource.parse(source);
            return this;
        }

        public Builder keyField(String field) {
            this.keyField = field;
            return this;
        }

        public Builder join(CubeJoin join) {
            joins.add(join);
            return this;
        }

        public Builder dimensions(String... names) {
            return dimensions(List.of(names));
        }

        public Builder dimensions(List<String> names) {
            for (String dimensionName : names) {
                if (dimensionNames.contains(dimensionName)) {
                    throw new ConfigurationException("Dimension '" + dimensionName
                            + "' listed twice for cube '" + name + "'");
                }
                dimensionNames.add(dimensionName);
            }
            return this;
        }
    }
}
