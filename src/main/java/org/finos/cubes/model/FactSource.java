package org.finos.cubes.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The flat source of a cube's facts: a table or view, or a SELECT statement
 * used as a derived table.
 *
 * @param schema The schema of a table source (empty for the default schema or a query source)
 * @param name   The table or view name, null for a query source
 * @param query  The SELECT statement, null for a table source
 */
public record FactSource(
        String schema,
        String name,
        String query) {

    private static final Pattern QUERY_START = Pattern.compile("(?i)^(\\(|(select|with)\\b)");

    public FactSource {
        Objects.requireNonNull(schema, "Schema cannot be null (use empty string for default)");
        if ((name == null) == (query == null)) {
            throw new IllegalArgumentException("Fact source must be either a table or a query");
        }
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("Fact table name cannot be blank");
        }
        if (query != null && query.isBlank()) {
            throw new IllegalArgumentException("Fact query cannot be blank");
        }
    }

    public static FactSource table(String name) {
        return new FactSource("", name, null);
    }

    public static FactSource table(String schema, String name) {
        return new FactSource(schema, name, null);
    }

    public static FactSource query(String selectStatement) {
        return new FactSource("", null, selectStatement);
    }

    /**
     * Interprets a model description value. Text starting with SELECT, WITH
     * or an opening parenthesis is a query; anything else names a table,
     * schema-qualified when it contains a dot. Table names are quoted when
     * rendered, so they may hold any character.
     */
    public static FactSource parse(String source) {
        Objects.requireNonNull(source, "Fact source cannot be null");
        String trimmed = source.trim();
        if (QUERY_START.matcher(trimmed).find()) {
            return query(trimmed);
        }
        int dot = trimmed.indexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1) {
            return table(trimmed);
        }
        return table(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    public boolean isTable() {
        return name != null;
    }

    @Override
    public String toString() {
        if (!isTable()) {
            return "(" + query + ")";
        }
        return schema.isEmpty() ? name : schema + "." + name;
    }
}
