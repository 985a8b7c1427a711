package org.finos.cubes.model.definition;

import org.finos.cubes.ModelException;
import org.finos.cubes.model.CubeJoin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a model description object graph into definitions.
 *
 * The input is the parsed form of a model document (JSON, YAML) as nested maps
 * and lists:
 *
 * <pre>
 * {
 *   "name": "sales_model",
 *   "dimensions": {
 *     "date": {
 *       "levels": { "year": {"attributes": ["year"]}, "month": {"attributes": ["month"]} },
 *       "hierarchies": { "ymd": {"levels": ["year", "month"]} },
 *       "default_hierarchy": "ymd"
 *     }
 *   },
 *   "cubes": {
 *     "sales": { "measures": ["amount"], "fact": "ft_sales", "dimensions": ["date"] }
 *   }
 * }
 * </pre>
 *
 * Levels and hierarchies may also be given as lists of maps carrying a
 * {@code name} entry. Anything else is a {@link ModelException}.
 */
public final class ModelDefinitionReader {

    private ModelDefinitionReader() {
    }

    public static ModelDefinition read(Map<String, ?> description) {
        if (description == null) {
            throw new ModelException("Model description cannot be null");
        }
        String name = requiredString(description, "name", "model");

        List<DimensionDefinition> dimensions = new ArrayList<>();
        for (Map.Entry<String, Map<String, ?>> entry : namedEntries(description.get("dimensions"), "dimensions")
                .entrySet()) {
            dimensions.add(readDimension(entry.getKey(), entry.getValue()));
        }

        List<CubeDefinition> cubes = new ArrayList<>();
        for (Map.Entry<String, Map<String, ?>> entry : namedEntries(description.get("cubes"), "cubes").entrySet()) {
            cubes.add(readCube(entry.getKey(), entry.getValue()));
        }

        return new ModelDefinition(
                name,
                optionalString(description, "label", "model " + name),
                optionalString(description, "description", "model " + name),
                dimensions,
                cubes);
    }

    static DimensionDefinition readDimension(String name, Map<String, ?> description) {
        String context = "dimension " + name;

        List<LevelDefinition> levels = new ArrayList<>();
        for (Map.Entry<String, Map<String, ?>> entry : namedEntries(description.get("levels"), context + " levels")
                .entrySet()) {
            Map<String, ?> level = entry.getValue();
            String levelContext = context + " level " + entry.getKey();
            levels.add(new LevelDefinition(
                    entry.getKey(),
                    optionalString(level, "label", levelContext),
                    optionalString(level, "key", levelContext),
                    stringList(level.get("attributes"), levelContext + " attributes"),
                    optionalString(level, "label_attribute", levelContext)));
        }

        List<HierarchyDefinition> hierarchies = new ArrayList<>();
        for (Map.Entry<String, Map<String, ?>> entry : namedEntries(description.get("hierarchies"),
                context + " hierarchies").entrySet()) {
            Map<String, ?> hierarchy = entry.getValue();
            String hierarchyContext = context + " hierarchy " + entry.getKey();
            Object hierarchyLevels = hierarchy.get("levels");
            if (hierarchyLevels == null) {
                throw new ModelException("Missing 'levels' in " + hierarchyContext);
            }
            hierarchies.add(new HierarchyDefinition(
                    entry.getKey(),
                    optionalString(hierarchy, "label", hierarchyContext),
                    stringList(hierarchyLevels, hierarchyContext + " levels")));
        }

        return new DimensionDefinition(
                name,
                optionalString(description, "label", context),
                optionalString(description, "description", context),
                levels,
                hierarchies,
                optionalString(description, "default_hierarchy", context),
                optionalString(description, "key_field", context));
    }

    static CubeDefinition readCube(String name, Map<String, ?> description) {
        String context = "cube " + name;

        Map<String, String> mappings = new LinkedHashMap<>();
        Object rawMappings = description.get("mappings");
        if (rawMappings != null) {
            if (!(rawMappings instanceof Map<?, ?> mappingMap)) {
                throw new ModelException("Expected a map for mappings of " + context);
            }
            for (Map.Entry<?, ?> entry : mappingMap.entrySet()) {
                if (!(entry.getKey() instanceof String field) || !(entry.getValue() instanceof String column)) {
                    throw new ModelException("Mappings of " + context + " must map strings to strings");
                }
                mappings.put(field, column);
            }
        }

        List<CubeJoin> joins = new ArrayList<>();
        Object rawJoins = description.get("joins");
        if (rawJoins != null) {
            if (!(rawJoins instanceof List<?> joinList)) {
                throw new ModelException("Expected a list for joins of " + context);
            }
            for (Object rawJoin : joinList) {
                Map<String, ?> join = asMap(rawJoin, context + " join");
                joins.add(new CubeJoin(
                        requiredString(join, "master", context + " join"),
                        requiredString(join, "detail", context + " join"),
                        optionalString(join, "alias", context + " join")));
            }
        }

        return new CubeDefinition(
                name,
                optionalString(description, "label", context),
                optionalString(description, "description", context),
                stringList(description.get("measures"), context + " measures"),
                stringList(description.get("attributes"), context + " attributes"),
                mappings,
                optionalString(description, "fact", context),
                optionalString(description, "key", context),
                joins,
                stringList(description.get("dimensions"), context + " dimensions"));
    }

    /**
     * Normalizes either a map of name to description or a list of descriptions
     * with a "name" entry into an ordered name to description map.
     */
    private static Map<String, Map<String, ?>> namedEntries(Object value, String context) {
        Map<String, Map<String, ?>> result = new LinkedHashMap<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String entryName)) {
                    throw new ModelException("Expected string keys in " + context);
                }
                Object entryValue = entry.getValue();
                result.put(entryName, entryValue == null ? Map.of() : asMap(entryValue, context + " " + entryName));
            }
            return result;
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                Map<String, ?> entry = asMap(item, context);
                String entryName = requiredString(entry, "name", context);
                if (result.put(entryName, entry) != null) {
                    throw new ModelException("Duplicate '" + entryName + "' in " + context);
                }
            }
            return result;
        }
        throw new ModelException("Expected a map or a list for " + context + ", got " + value.getClass().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(Object value, String context) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ModelException("Expected a map for " + context + ", got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new ModelException("Expected string keys in " + context);
            }
        }
        return (Map<String, ?>) map;
    }

    private static List<String> stringList(Object value, String context) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ModelException("Expected a list of strings for " + context);
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw new ModelException("Expected a list of strings for " + context + ", found " + item);
            }
            result.add(s);
        }
        return result;
    }

    private static String requiredString(Map<String, ?> map, String key, String context) {
        String value = optionalString(map, key, context);
        if (value == null || value.isBlank()) {
            throw new ModelException("Missing '" + key + "' in " + context);
        }
        return value;
    }

    private static String optionalString(Map<String, ?> map, String key, String context) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new ModelException("Expected a string for '" + key + "' in " + context + ", got "
                    + value.getClass().getSimpleName());
        }
        return s;
    }
}
