package org.finos.cubes.model.definition;

import org.finos.cubes.model.Cube;
import org.finos.cubes.model.CubeJoin;
import org.finos.cubes.model.Dimension;
import org.finos.cubes.model.Level;
import org.finos.cubes.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Builds runtime model objects from definitions.
 *
 * Converts descriptions into the runtime model:
 * - DimensionDefinition -> Dimension (levels and hierarchies resolved)
 * - CubeDefinition -> Cube (dimension names resolved against the model)
 * - ModelDefinition -> Model
 *
 * Dimensions are registered before cubes, so a cube may use any dimension of
 * the same description.
 */
public final class ModelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ModelBuilder.class);

    private ModelBuilder() {
    }

    /**
     * Reads and builds a model from its parsed description.
     */
    public static Model fromDescription(Map<String, ?> description) {
        return build(ModelDefinitionReader.read(description));
    }

    public static Model build(ModelDefinition definition) {
        Model model = new Model(definition.name(), definition.label(), definition.description());

        for (DimensionDefinition dimensionDef : definition.dimensions()) {
            model.addDimension(buildDimension(dimensionDef));
        }
        for (CubeDefinition cubeDef : definition.cubes()) {
            model.createCube(cubeBuilder(cubeDef));
        }

        logger.debug("Built model '{}' with dimensions {} and cubes {}", model.name(),
                model.dimensions().stream().map(Dimension::name).toList(),
                model.cubes().stream().map(Cube::name).toList());
        return model;
    }

    public static Dimension buildDimension(DimensionDefinition definition) {
        Dimension.Builder builder = Dimension.builder(definition.name())
                .label(definition.label())
                .description(definition.description())
                .keyField(definition.keyField())
                .defaultHierarchy(definition.defaultHierarchy());

        for (LevelDefinition levelDef : definition.levels()) {
            builder.addLevel(new Level(
                    levelDef.name(),
                    levelDef.label(),
                    levelDef.key(),
                    levelDef.attributes(),
                    levelDef.labelAttribute(),
                    definition.name()));
        }
        for (HierarchyDefinition hierarchyDef : definition.hierarchies()) {
            builder.addHierarchy(hierarchyDef.name(), hierarchyDef.label(), hierarchyDef.levels());
        }
        return builder.build();
    }

    public static Cube.Builder cubeBuilder(CubeDefinition definition) {
        Cube.Builder builder = Cube.builder(definition.name())
                .label(definition.label())
                .description(definition.description())
                .measures(definition.measures())
                .attributes(definition.attributes())
                .mappings(definition.mappings())
                .keyField(definition.key())
                .dimensions(definition.dimensions());
        if (definition.fact() != null) {
            builder.fact(definition.fact());
        }
        for (CubeJoin join : definition.joins()) {
            builder.join(join);
        }
        return builder;
    }
}
