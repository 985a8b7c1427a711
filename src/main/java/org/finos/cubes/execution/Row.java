package org.finos.cubes.execution;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: field name to value, in column order.
 *
 * @param values The field values; values may be null
 */
public record Row(Map<String, Object> values) {

    public Row {
        Objects.requireNonNull(values, "Values cannot be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    /**
     * @throws IllegalArgumentException if the row has no such field
     */
    public Object get(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException("Field not found: " + field + " (fields: " + values.keySet() + ")");
        }
        return values.get(field);
    }

    /**
     * Reads a numeric field. Text is parsed, as some stores return aggregates
     * as strings; null reads as null.
     */
    public Double getDouble(String field) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + field + " is not numeric: " + value, e);
        }
    }

    /**
     * @return A copy of this row with the field added or replaced
     */
    public Row with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(field, value);
        return new Row(copy);
    }

    /**
     * Materializes all remaining rows of a JDBC ResultSet, keyed by column label.
     */
    public static List<Row> fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> labels = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            labels.add(meta.getColumnLabel(i));
        }

        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columnCount; i++) {
                values.put(labels.get(i), rs.getObject(i + 1));
            }
            rows.add(new Row(values));
        }
        return rows;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
