package org.finos.cubes.model;

import org.finos.cubes.ConfigurationException;
import org.finos.cubes.NotFoundException;
import org.finos.cubes.model.definition.CubeDefinition;
import org.finos.cubes.model.definition.ModelBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A multidimensional model: the registry of dimensions and the cubes built on
 * them.
 *
 * The model owns cubes and dimensions by name. Administrative mutation
 * (adding or removing dimensions, creating cubes) is meant for configuration
 * time and is not thread-safe; queries only read.
 */
public final class Model {

    private final String name;
    private final String label;
    private final String description;
    private final Map<String, Dimension> dimensions = new LinkedHashMap<>();
    private final Map<String, Cube> cubes = new LinkedHashMap<>();

    public Model(String name) {
        this(name, null, null);
    }

    public Model(String name, String label, String description) {
        this.name = Objects.requireNonNull(name, "Model name cannot be null");
        this.label = label != null ? label : name;
        this.description = description;
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

    // ==================== Dimensions ====================

    /**
     * Registers a dimension.
     *
     * @throws ConfigurationException if a dimension with the same name exists
     */
    public Model addDimension(Dimension dimension) {
        Objects.requireNonNull(dimension, "Dimension cannot be null");
        if (dimensions.containsKey(dimension.name())) {
            throw new ConfigurationException("Dimension '" + dimension.name() + "' already exists in model '"
                    + name + "'");
        }
        dimensions.put(dimension.name(), dimension);
        return this;
    }

    /**
     * Removes a dimension that no cube uses.
     *
     * @throws ConfigurationException if a cube still uses the dimension
     */
    public Model removeDimension(String dimensionName) {
        dimension(dimensionName);
        List<String> users = cubes.values().stream()
                .filter(c -> c.hasDimension(dimensionName))
                .map(Cube::name)
                .toList();
        if (!users.isEmpty()) {
            throw new ConfigurationException("Dimension '" + dimensionName + "' is used by cubes " + users);
        }
        dimensions.remove(dimensionName);
        return this;
    }

    public Collection<Dimension> dimensions() {
        return List.copyOf(dimensions.values());
    }

    public Optional<Dimension> findDimension(String dimensionName) {
        return Optional.ofNullable(dimensions.get(dimensionName));
    }

    /**
     * @throws NotFoundException if there is no such dimension
     */
    public Dimension dimension(String dimensionName) {
        return findDimension(dimensionName)
                .orElseThrow(() -> new NotFoundException("No dimension '" + dimensionName + "' in model '"
                        + name + "'"));
    }

    // ==================== Cubes ====================

    /**
     * Creates and registers a cube, resolving its dimensions against this model.
     *
     * @throws ConfigurationException if a dimension is not registered on the
     *                                model or a cube with the same name exists
     */
    public Cube createCube(Cube.Builder builder) {
        if (cubes.containsKey(builder.name())) {
            throw new ConfigurationException("Cube '" + builder.name() + "' already exists in model '" + name + "'");
        }
        List<Dimension> resolved = new ArrayList<>();
        for (String dimensionName : builder.dimensionNames()) {
            Dimension dimension = dimensions.get(dimensionName);
            if (dimension == null) {
                throw new ConfigurationException("There is no dimension '" + dimensionName + "' for cube '"
                        + builder.name() + "' in model '" + name + "'");
            }
            resolved.add(dimension);
        }
        Cube cube = Cube.create(builder, resolved, name);
        cubes.put(cube.name(), cube);
        return cube;
    }

    public Cube createCube(CubeDefinition definition) {
        return createCube(ModelBuilder.cubeBuilder(definition));
    }

    /**
     * Adds a registered dimension to an existing cube.
     *
     * @return The updated cube, which replaces the previous one in this model
     * @throws ConfigurationException if the dimension is not registered on the model
     */
    public Cube addCubeDimension(String cubeName, String dimensionName) {
        Cube cube = cube(cubeName);
        Dimension dimension = findDimension(dimensionName)
                .orElseThrow(() -> new ConfigurationException("There is no dimension '" + dimensionName
                        + "' for cube '" + cubeName + "' in model '" + name + "'"));
        Cube updated = cube.withDimension(dimension);
        cubes.put(cubeName, updated);
        return updated;
    }

    /**
     * Removes a dimension from a cube; the dimension stays registered on the model.
     */
    public Cube removeCubeDimension(String cubeName, String dimensionName) {
        Cube cube = cube(cubeName);
        cube.dimension(dimensionName);
        Cube updated = cube.withoutDimension(dimensionName);
        cubes.put(cubeName, updated);
        return updated;
    }

    public Collection<Cube> cubes() {
        return List.copyOf(cubes.values());
    }

    public Optional<Cube> findCube(String cubeName) {
        return Optional.ofNullable(cubes.get(cubeName));
    }

    /**
     * @throws NotFoundException if there is no such cube
     */
    public Cube cube(String cubeName) {
        return findCube(cubeName)
                .orElseThrow(() -> new NotFoundException("No cube '" + cubeName + "' in model '" + name + "'"));
    }

    @Override
    public String toString() {
        return "Model(" + name + " dimensions=" + dimensions.keySet() + " cubes=" + cubes.keySet() + ")";
    }
}
